package com.questrail.screenlink.api;

/**
 * Physical carrier used by a session.
 */
public enum TransportKind
{
    /** TCP stream over the local Wi-Fi network. */
    WIFI_SOCKET,

    /** RFCOMM stream to a paired Bluetooth device. */
    BLUETOOTH
}

package com.questrail.screenlink.protocol.mirror.transport.socket;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

/**
 * A parsed {@code host[:port]} socket target. IPv6 literals are written in
 * brackets ({@code [::1]:9295}) and stored without them.
 */
public record SocketTarget(String host, int port)
{
    public SocketTarget
    {
        Objects.requireNonNull(host, "host");
        if (host.isEmpty()) {
            throw new IllegalArgumentException("host must not be empty");
        }
        if (port < 1 || port > 0xFFFF) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    /**
     * @throws IllegalArgumentException if {@code target} is not a bare
     *         {@code host[:port]}
     */
    public static SocketTarget parse(String target, int defaultPort)
    {
        Objects.requireNonNull(target, "target");
        final String trimmed = target.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("socket target must not be empty");
        }

        final URI uri;
        try {
            uri = new URI("tcp://" + trimmed);
        }
        catch (URISyntaxException e) {
            throw new IllegalArgumentException("invalid socket target '" + target + "'", e);
        }

        String host = uri.getHost();
        if (host == null
                || uri.getUserInfo() != null
                || (uri.getPath() != null && !uri.getPath().isEmpty())
                || uri.getQuery() != null
                || uri.getFragment() != null) {
            throw new IllegalArgumentException("socket target must be host[:port]: '" + target + "'");
        }
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }

        return new SocketTarget(host, uri.getPort() == -1 ? defaultPort : uri.getPort());
    }

    @Override
    public String toString()
    {
        return (host.indexOf(':') >= 0 ? "[" + host + "]" : host) + ":" + port;
    }
}

package com.questrail.screenlink.protocol.mirror.transport;

import com.questrail.screenlink.api.TransportKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * TransportFactory
 * -----------------------------------------------------------------------------
 * Produces a fresh, unconnected {@link Transport} for each connect attempt.
 *
 * <p>This is the only place carrier kinds are resolved to implementations; the
 * session asks for a kind and never branches on it.</p>
 */
public final class TransportFactory
{
    private final Map<TransportKind, Supplier<? extends Transport>> suppliers;

    private TransportFactory(Map<TransportKind, Supplier<? extends Transport>> suppliers)
    {
        this.suppliers = new EnumMap<>(suppliers);
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public boolean supports(TransportKind kind)
    {
        return suppliers.containsKey(kind);
    }

    /**
     * @throws IllegalArgumentException if no carrier is registered for {@code kind}
     */
    public Transport create(TransportKind kind)
    {
        Objects.requireNonNull(kind, "kind");
        Supplier<? extends Transport> supplier = suppliers.get(kind);
        if (supplier == null) {
            throw new IllegalArgumentException("No transport registered for " + kind);
        }
        return Objects.requireNonNull(supplier.get(), "transport supplier returned null for " + kind);
    }

    public static final class Builder
    {
        private final Map<TransportKind, Supplier<? extends Transport>> suppliers = new EnumMap<>(TransportKind.class);

        public Builder register(TransportKind kind, Supplier<? extends Transport> supplier)
        {
            suppliers.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(supplier, "supplier"));
            return this;
        }

        public TransportFactory build()
        {
            if (suppliers.isEmpty()) {
                throw new IllegalStateException("at least one transport must be registered");
            }
            return new TransportFactory(suppliers);
        }
    }
}

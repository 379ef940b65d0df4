package io.trading.dumper.host;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Lookup of the registered {@link MarketDataSourceProvider}s.
 */
public final class SourceProviders {

    private SourceProviders() {
    }

    /**
     * Names of all providers on the class path.
     */
    public static List<String> available() {
        List<String> names = new ArrayList<>();
        for (MarketDataSourceProvider provider : ServiceLoader.load(MarketDataSourceProvider.class)) {
            names.add(provider.name());
        }
        return names;
    }

    /**
     * Finds a provider by name, ignoring case.
     *
     * @throws IllegalStateException if no provider has that name
     */
    public static MarketDataSourceProvider find(String name) {
        for (MarketDataSourceProvider provider : ServiceLoader.load(MarketDataSourceProvider.class)) {
            if (provider.name().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No market data source provider named '" + name
            + "', available: " + available());
    }
}

package io.trading.dumper.host;

import io.trading.dumper.config.DumperConfig;
import io.trading.marketevent.api.MarketDataSource;

/**
 * Connects the dumper to a charting host.
 *
 * Implementations are discovered with {@link java.util.ServiceLoader} and selected
 * by {@link #name()} through the {@code SOURCE_PROVIDER} setting.
 */
public interface MarketDataSourceProvider {

    /**
     * Name used to select this provider.
     */
    String name();

    /**
     * Opens the host view for the configured charts.
     *
     * @param config   dumper configuration
     * @param notifier receives chart update notifications from the host
     * @return the source every chart engine reads from
     */
    MarketDataSource connect(DumperConfig config, UpdateNotifier notifier);
}

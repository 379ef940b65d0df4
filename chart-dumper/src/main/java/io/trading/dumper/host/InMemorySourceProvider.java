package io.trading.dumper.host;

import io.trading.dumper.config.ChartConfig;
import io.trading.dumper.config.DumperConfig;
import io.trading.marketevent.api.MarketDataSource;
import io.trading.marketevent.source.InMemoryMarketDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provider backed by an {@link InMemoryMarketDataSource} that a host bridge fills.
 * Without a bridge the charts stay empty and connected; pair it with a poll interval
 * to drive the engines.
 */
public class InMemorySourceProvider implements MarketDataSourceProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemorySourceProvider.class);

    public static final String NAME = "memory";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public MarketDataSource connect(DumperConfig config, UpdateNotifier notifier) {
        InMemoryMarketDataSource source = new InMemoryMarketDataSource();
        for (ChartConfig chart : config.charts()) {
            source.setConnected(chart.chart(), true);
        }
        LOGGER.info("In-memory market data source ready for {} chart(s)", config.charts().size());
        return source;
    }
}

package io.trading.dumper.aeron;

import io.aeron.Aeron;
import io.aeron.Publication;
import io.trading.dumper.core.ProcessingTimer;
import io.trading.dumper.metrics.DumperMetrics;
import io.trading.marketevent.emit.EventLogWriter;
import io.trading.marketevent.model.SourceId;
import org.agrona.CloseHelper;
import org.agrona.concurrent.UnsafeBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mirrors every line written to the event log onto an Aeron IPC stream per chart,
 * for consumers that follow the log live.
 *
 * A line is offered once; back-pressure or a missing subscriber drops the live
 * copy only, the file record is already written.
 */
public class AeronEventPublisher implements EventLogWriter.LineObserver, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(AeronEventPublisher.class);
    private static final int BACKPRESSURE_LOG_INTERVAL = 1000;
    private static final String STAGE_PUBLISH = "publish";

    private final Aeron aeron;
    private final DumperMetrics metrics;
    private final Map<Integer, Publication> publications = new ConcurrentHashMap<>();
    private final AtomicLong publishFailures = new AtomicLong(0);
    private final ProcessingTimer processingTimer = new ProcessingTimer();

    public AeronEventPublisher(Aeron aeron, DumperMetrics metrics) {
        this.aeron = aeron;
        this.metrics = metrics;
    }

    @Override
    public void onLine(SourceId source, String line) {
        publish(source, line);
    }

    /**
     * Offers one line to the chart's stream.
     *
     * @return true if the line was accepted by the publication
     */
    public boolean publish(SourceId source, String line) {
        ProcessingTimer.TimingContext timer = processingTimer.start();

        Publication publication = getOrCreatePublication(source.chart());
        byte[] bytes = line.getBytes(StandardCharsets.UTF_8);
        UnsafeBuffer buffer = new UnsafeBuffer(bytes);
        long result = publication.offer(buffer, 0, bytes.length);

        if (result < 0) {
            handleBackpressure(source, result);
            return false;
        }

        processingTimer.record(source.chart(), STAGE_PUBLISH, timer.stop());
        return true;
    }

    private Publication getOrCreatePublication(int chart) {
        return publications.computeIfAbsent(chart, c -> {
            String channel = StreamRegistry.getChannel(c);
            int streamId = StreamRegistry.getStreamId(c);

            LOGGER.info("Creating Aeron publication: channel={}, streamId={}", channel, streamId);
            return aeron.addPublication(channel, streamId);
        });
    }

    private void handleBackpressure(SourceId source, long result) {
        long failures = publishFailures.incrementAndGet();
        if (metrics != null) {
            metrics.recordLivePublishFailure(source);
        }

        if (failures % BACKPRESSURE_LOG_INTERVAL == 1) {
            LOGGER.warn("Aeron live mirror backpressure on {} (count: {}, code: {})", source, failures, result);
        }
    }

    public long getPublishFailureCount() {
        return publishFailures.get();
    }

    public int getPublicationCount() {
        return publications.size();
    }

    public ProcessingTimer getProcessingTimer() {
        return processingTimer;
    }

    @Override
    public void close() {
        publications.values().forEach(CloseHelper::quietClose);
        publications.clear();
    }
}

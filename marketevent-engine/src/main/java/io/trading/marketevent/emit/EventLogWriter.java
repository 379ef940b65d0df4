package io.trading.marketevent.emit;

import io.trading.marketevent.api.EngineListener;
import io.trading.marketevent.api.EventSink;
import io.trading.marketevent.encoder.EventJsonEncoder;
import io.trading.marketevent.model.EmittedEvent;
import io.trading.marketevent.model.SourceId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Appends events to per-chart, per-day JSON-lines files.
 *
 * File layout: {@code <outputDir>/chart_<chart>_<yyyyMMdd>.jsonl}, the day taken
 * from the event timestamp in the configured zone. The directory and files are
 * created on first write. Each line is built fully in memory and flushed before
 * {@link #emit} returns, so a line is either absent or complete.
 *
 * Each chart keeps one writer per day. When an event opens a newer day, writers
 * of days before the previous newest day are closed, so the newest two days stay
 * open across midnight and a late record of an earlier day is appended without
 * retiring the current file. Appends to one chart are serialized; different
 * charts write independently.
 */
public final class EventLogWriter implements EventSink, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventLogWriter.class);

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    /**
     * Receives every line after it reached the file.
     */
    @FunctionalInterface
    public interface LineObserver {
        void onLine(SourceId source, String line);
    }

    private final Path outputDir;
    private final ZoneId zone;
    private final EventJsonEncoder encoder;
    private final EngineListener listener;
    private final LineObserver observer;
    private final Map<Integer, ChartLog> logs = new ConcurrentHashMap<>();
    private final AtomicLong linesWritten = new AtomicLong();
    private final AtomicLong writeFailures = new AtomicLong();

    private volatile boolean closed = false;

    public EventLogWriter(Path outputDir, ZoneId zone, EngineListener listener, LineObserver observer) {
        if (outputDir == null) {
            throw new IllegalArgumentException("outputDir cannot be null");
        }
        if (zone == null) {
            throw new IllegalArgumentException("zone cannot be null");
        }
        this.outputDir = outputDir;
        this.zone = zone;
        this.encoder = EventJsonEncoder.getInstance();
        this.listener = listener != null ? listener : EngineListener.NOOP;
        this.observer = observer;
    }

    public EventLogWriter(Path outputDir, ZoneId zone) {
        this(outputDir, zone, EngineListener.NOOP, null);
    }

    @Override
    public boolean emit(EmittedEvent event) {
        if (closed) {
            LOGGER.warn("Dropping {} event for {}: writer closed", event.type(), event.source());
            return false;
        }

        String line;
        try {
            line = encoder.encode(event);
        } catch (RuntimeException e) {
            return fail(event, e);
        }

        LocalDate day = dayOf(event.timestampMillis());
        ChartLog log = logs.computeIfAbsent(event.source().chart(), ChartLog::new);
        synchronized (log) {
            try {
                BufferedWriter writer = log.writerFor(day);
                writer.write(line);
                writer.write('\n');
                writer.flush();
            } catch (IOException e) {
                log.closeQuietly(day);
                return fail(event, e);
            }
        }
        linesWritten.incrementAndGet();

        if (observer != null) {
            try {
                observer.onLine(event.source(), line);
            } catch (RuntimeException e) {
                LOGGER.error("Line observer failed for {}: {}", event.source(), e.getMessage(), e);
            }
        }
        return true;
    }

    private boolean fail(EmittedEvent event, Exception e) {
        writeFailures.incrementAndGet();
        LOGGER.error("Failed to write {} event for {}: {}", event.type(), event.source(), e.getMessage(), e);
        listener.onWriteFailure(event.source(), event.type());
        return false;
    }

    /**
     * Local day an event timestamp belongs to.
     */
    public LocalDate dayOf(long timestampMillis) {
        return Instant.ofEpochMilli(timestampMillis).atZone(zone).toLocalDate();
    }

    /**
     * Path of the partition file for a chart and day.
     */
    public Path partitionPath(int chart, LocalDate day) {
        return outputDir.resolve("chart_" + chart + "_" + DAY_FORMAT.format(day) + ".jsonl");
    }

    public long getLinesWritten() {
        return linesWritten.get();
    }

    public long getWriteFailures() {
        return writeFailures.get();
    }

    public int getOpenPartitionCount() {
        int open = 0;
        for (ChartLog log : logs.values()) {
            synchronized (log) {
                open += log.writers.size();
            }
        }
        return open;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    @Override
    public void close() {
        closed = true;
        for (ChartLog log : logs.values()) {
            synchronized (log) {
                log.closeQuietly();
            }
        }
        logs.clear();
        LOGGER.info("Event log closed, {} lines written, {} failures", linesWritten.get(), writeFailures.get());
    }

    /**
     * Open partitions of one chart, by day. Guarded by its own monitor.
     */
    private final class ChartLog {
        private final int chart;
        private final TreeMap<LocalDate, BufferedWriter> writers = new TreeMap<>();
        private LocalDate newestDay;

        ChartLog(int chart) {
            this.chart = chart;
        }

        BufferedWriter writerFor(LocalDate eventDay) throws IOException {
            BufferedWriter writer = writers.get(eventDay);
            if (writer != null) {
                return writer;
            }
            if (newestDay == null || eventDay.isAfter(newestDay)) {
                if (newestDay != null) {
                    LOGGER.info("Rolling chart {} log from {} to {}", chart, newestDay, eventDay);
                    retireBefore(newestDay);
                }
                newestDay = eventDay;
            }
            Files.createDirectories(outputDir);
            Path path = partitionPath(chart, eventDay);
            writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            writers.put(eventDay, writer);
            LOGGER.debug("Opened {}", path);
            return writer;
        }

        private void retireBefore(LocalDate keepFrom) {
            Iterator<Map.Entry<LocalDate, BufferedWriter>> it = writers.headMap(keepFrom, false).entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<LocalDate, BufferedWriter> entry = it.next();
                closeWriter(entry.getKey(), entry.getValue());
                it.remove();
            }
        }

        void closeQuietly(LocalDate day) {
            BufferedWriter writer = writers.remove(day);
            if (writer != null) {
                closeWriter(day, writer);
            }
        }

        void closeQuietly() {
            for (Map.Entry<LocalDate, BufferedWriter> entry : writers.entrySet()) {
                closeWriter(entry.getKey(), entry.getValue());
            }
            writers.clear();
            newestDay = null;
        }

        private void closeWriter(LocalDate day, BufferedWriter writer) {
            try {
                writer.close();
            } catch (IOException e) {
                LOGGER.warn("Failed to close chart {} log for {}: {}", chart, day, e.getMessage());
            }
        }
    }
}

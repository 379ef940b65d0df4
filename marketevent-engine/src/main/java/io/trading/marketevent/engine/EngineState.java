package io.trading.marketevent.engine;

import io.trading.marketevent.api.EventSink;
import io.trading.marketevent.dedup.DedupWriter;
import io.trading.marketevent.model.SourceId;
import io.trading.marketevent.model.TimeAndSalesRecord;
import io.trading.marketevent.replay.ReplayCursor;

/**
 * All mutable state of one source pipeline.
 *
 * Owned by exactly one {@link ChartEventEngine} and only touched from that
 * engine's thread. Bar markers hold the last bar index (or bar time) a
 * once-per-bar collector ran for; -1 means never.
 */
public final class EngineState {

    public static final int STUDY_UNRESOLVED = -2;
    public static final int STUDY_NOT_FOUND = -1;

    private final SourceId source;
    private final DedupWriter dedup;
    private final ReplayCursor<TimeAndSalesRecord> cursor;

    private int vwapStudyId = STUDY_UNRESOLVED;
    private int lastValueAreaBar = -1;
    private int lastSessionStatsBar = -1;
    private int lastOrderFlowBar = -1;
    private long lastLevelsBarTime = Long.MIN_VALUE;
    private long updateCount = 0;

    public EngineState(SourceId source, EventSink sink, int probeWindow) {
        this.source = source;
        this.dedup = new DedupWriter(sink);
        this.cursor = new ReplayCursor<>(source + " T&S", probeWindow);
    }

    public SourceId getSource() {
        return source;
    }

    public DedupWriter getDedup() {
        return dedup;
    }

    public ReplayCursor<TimeAndSalesRecord> getCursor() {
        return cursor;
    }

    public int getVwapStudyId() {
        return vwapStudyId;
    }

    public boolean isVwapResolved() {
        return vwapStudyId != STUDY_UNRESOLVED;
    }

    public void setVwapStudyId(int vwapStudyId) {
        this.vwapStudyId = vwapStudyId;
    }

    /**
     * Marks the bar for the value-area export.
     *
     * @return true if the bar was not marked before
     */
    public boolean markValueAreaBar(int bar) {
        if (bar == lastValueAreaBar) {
            return false;
        }
        lastValueAreaBar = bar;
        return true;
    }

    public boolean markSessionStatsBar(int bar) {
        if (bar == lastSessionStatsBar) {
            return false;
        }
        lastSessionStatsBar = bar;
        return true;
    }

    public boolean markOrderFlowBar(int bar) {
        if (bar == lastOrderFlowBar) {
            return false;
        }
        lastOrderFlowBar = bar;
        return true;
    }

    public boolean markLevelsBarTime(long barTime) {
        if (barTime == lastLevelsBarTime) {
            return false;
        }
        lastLevelsBarTime = barTime;
        return true;
    }

    long incrementUpdateCount() {
        return ++updateCount;
    }

    public long getUpdateCount() {
        return updateCount;
    }
}

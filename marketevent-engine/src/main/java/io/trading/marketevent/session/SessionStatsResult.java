package io.trading.marketevent.session;

import java.util.Optional;

/**
 * Outcome of a previous-session computation.
 * Only {@link Status#OK} carries statistics.
 */
public record SessionStatsResult(
    Status status,
    SessionStats stats,
    int droppedSamples
) {
    public enum Status {
        OK("ok"),
        INSUFFICIENT_HISTORY("insufficient_history"),
        NO_VOLUME("no_volume_prev_session");

        private final String diagnostic;

        Status(String diagnostic) {
            this.diagnostic = diagnostic;
        }

        /**
         * Message written to the diagnostic record.
         */
        public String getDiagnostic() {
            return diagnostic;
        }
    }

    public SessionStatsResult {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if ((status == Status.OK) != (stats != null)) {
            throw new IllegalArgumentException("stats must be present exactly when status is OK");
        }
    }

    public static SessionStatsResult ok(SessionStats stats, int droppedSamples) {
        return new SessionStatsResult(Status.OK, stats, droppedSamples);
    }

    public static SessionStatsResult insufficientHistory() {
        return new SessionStatsResult(Status.INSUFFICIENT_HISTORY, null, 0);
    }

    public static SessionStatsResult noVolume(int droppedSamples) {
        return new SessionStatsResult(Status.NO_VOLUME, null, droppedSamples);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public Optional<SessionStats> statsIfPresent() {
        return Optional.ofNullable(stats);
    }
}

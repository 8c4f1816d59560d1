package com.asad.lineup_tracker.model;

/**
 * Whether a player is on the floor. ON_COURT carries the check-in time; OFF_COURT carries nothing.
 */
public abstract class CourtStatus {

    private static final OffCourt OFF = new OffCourt();

    private CourtStatus() {}

    public static CourtStatus offCourt() {
        return OFF;
    }

    public static CourtStatus onCourt(double since) {
        return new OnCourt(since);
    }

    public abstract boolean isOnCourt();

    public static final class OnCourt extends CourtStatus {
        public final double since;

        private OnCourt(double since) {
            this.since = since;
        }

        @Override
        public boolean isOnCourt() {
            return true;
        }

        @Override
        public String toString() {
            return "ON_COURT(since=" + since + ")";
        }
    }

    public static final class OffCourt extends CourtStatus {
        private OffCourt() {}

        @Override
        public boolean isOnCourt() {
            return false;
        }

        @Override
        public String toString() {
            return "OFF_COURT";
        }
    }
}

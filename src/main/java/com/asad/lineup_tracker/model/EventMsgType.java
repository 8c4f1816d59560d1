package com.asad.lineup_tracker.model;

/**
 * Event category codes from the stats play-by-play feed (eventmsgtype column).
 */
public final class EventMsgType {

    public static final int MADE_SHOT = 1;
    public static final int MISSED_SHOT = 2;
    public static final int FREE_THROW = 3;
    public static final int REBOUND = 4;
    public static final int TURNOVER = 5;

    public static final int SUBSTITUTION = 8;
    public static final int PERIOD_END = 13;

    private EventMsgType() {}

    public static boolean isSubstitution(int code) {
        return code == SUBSTITUTION;
    }

    public static boolean isPeriodEnd(int code) {
        return code == PERIOD_END;
    }

    // Shots, free throws, rebounds and turnovers put their participants on the floor.
    public static boolean isPlay(int code) {
        return code <= TURNOVER;
    }
}

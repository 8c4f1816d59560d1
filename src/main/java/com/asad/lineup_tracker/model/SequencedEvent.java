package com.asad.lineup_tracker.model;

/**
 * A play-by-play event with its normalized clock attached.
 */
public record SequencedEvent(PlayByPlayEvent event, GameClock clock) {

    public double gameTimeRemaining() {
        return clock.gameTimeRemaining();
    }

    public double maxPeriodTime() {
        return clock.maxPeriodTime();
    }

    public int period() {
        return event.period();
    }

    public int eventNum() {
        return event.eventNum();
    }

    public int msgType() {
        return event.msgType();
    }
}

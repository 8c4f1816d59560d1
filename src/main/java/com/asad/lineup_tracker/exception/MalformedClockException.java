package com.asad.lineup_tracker.exception;

public class MalformedClockException extends LineupReconstructionException {

    private final String clock;
    private final int period;

    public MalformedClockException(String gameId, String clock, int period, Throwable cause) {
        super(gameId, "Malformed clock '" + clock + "' in period " + period, cause);
        this.clock = clock;
        this.period = period;
    }

    public MalformedClockException(String gameId, String clock, int period) {
        this(gameId, clock, period, null);
    }

    public String getClock() {
        return clock;
    }

    public int getPeriod() {
        return period;
    }

    @Override
    public String errorCode() {
        return "MalformedClock";
    }
}

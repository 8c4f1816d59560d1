package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.exception.MalformedClockException;
import com.asad.lineup_tracker.model.GameClock;

/**
 * Turns a "MM:SS" (or "MM:SS.s") period clock into seconds of game time remaining.
 *
 * Regulation periods are 10 minutes and count the periods still to come. Overtime periods
 * are 5 minutes and are measured on their own: no regulation time is added, so an overtime
 * clock only compares to other overtime clocks.
 */
public final class GameClockNormalizer {

    static final int REGULATION_PERIODS = 4;
    static final int REGULATION_PERIOD_SECONDS = 10 * 60;
    static final int OVERTIME_PERIOD_SECONDS = 5 * 60;

    private GameClockNormalizer() {}

    public static GameClock normalize(String gameId, String clock, int period) {
        if (period < 1) throw new MalformedClockException(gameId, clock, period);

        double left = parseClock(gameId, clock, period);

        if (period <= REGULATION_PERIODS) {
            double periodTime = REGULATION_PERIOD_SECONDS * (REGULATION_PERIODS - period);
            double maxPeriodTime = REGULATION_PERIOD_SECONDS * (REGULATION_PERIODS + 1 - period);
            return new GameClock(periodTime + left, maxPeriodTime);
        }

        return new GameClock(left, OVERTIME_PERIOD_SECONDS);
    }

    static double parseClock(String gameId, String clock, int period) {
        if (clock == null || clock.isBlank()) throw new MalformedClockException(gameId, clock, period);

        String[] t = clock.trim().split(":", -1);
        if (t.length != 2) throw new MalformedClockException(gameId, clock, period);

        int mm;
        double ss;
        try {
            mm = Integer.parseInt(t[0].trim());
            ss = Double.parseDouble(t[1].trim());
        } catch (NumberFormatException ex) {
            throw new MalformedClockException(gameId, clock, period, ex);
        }

        // Double.parseDouble also takes "NaN", "Infinity" and exponents
        if (mm < 0 || !Double.isFinite(ss) || ss < 0 || ss >= 60) {
            throw new MalformedClockException(gameId, clock, period);
        }
        return mm * 60 + ss;
    }
}

package com.asad.lineup_tracker.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.asad.lineup_tracker.exception.MalformedClockException;
import com.asad.lineup_tracker.model.GameClock;
import org.junit.jupiter.api.Test;

final class GameClockNormalizerTest {

    @Test
    void secondPeriodCountsTheTwoPeriodsStillToCome() {
        GameClock c = GameClockNormalizer.normalize("g", "5:30", 2);
        assertEquals(1530.0, c.gameTimeRemaining());
        assertEquals(1800.0, c.maxPeriodTime());
    }

    @Test
    void openingTipIsTheWholeGame() {
        GameClock c = GameClockNormalizer.normalize("g", "10:00", 1);
        assertEquals(2400.0, c.gameTimeRemaining());
        assertEquals(2400.0, c.maxPeriodTime());
    }

    @Test
    void fractionalSecondsAreKept() {
        GameClock c = GameClockNormalizer.normalize("g", "0:24.3", 4);
        assertEquals(24.3, c.gameTimeRemaining(), 1e-9);
        assertEquals(600.0, c.maxPeriodTime());
    }

    @Test
    void overtimeIgnoresRegulation() {
        GameClock c = GameClockNormalizer.normalize("g", "0:00", 6);
        assertEquals(0.0, c.gameTimeRemaining());
        assertEquals(300.0, c.maxPeriodTime());

        GameClock firstOt = GameClockNormalizer.normalize("g", "3:15", 5);
        assertEquals(195.0, firstOt.gameTimeRemaining());
        assertEquals(300.0, firstOt.maxPeriodTime());
    }

    @Test
    void clockResetsAtPeriodBoundary() {
        double endOfFirst = GameClockNormalizer.normalize("g", "0:00", 1).gameTimeRemaining();
        double startOfSecond = GameClockNormalizer.normalize("g", "10:00", 2).gameTimeRemaining();
        assertEquals(endOfFirst, startOfSecond);
    }

    @Test
    void rejectsUnparseableClocks() {
        for (String bad : new String[] {"5-30", "abc:10", "5:", ":30", "1:2:3", "", "5:NaN", "-1:00", "4:75"}) {
            MalformedClockException ex = assertThrows(MalformedClockException.class,
                    () -> GameClockNormalizer.normalize("0021900001", bad, 1), bad);
            assertEquals("0021900001", ex.getGameId());
            assertEquals(bad, ex.getClock());
        }
        assertThrows(MalformedClockException.class, () -> GameClockNormalizer.normalize("g", null, 1));
    }

    @Test
    void rejectsNonPositivePeriod() {
        MalformedClockException ex = assertThrows(MalformedClockException.class,
                () -> GameClockNormalizer.normalize("g", "5:00", 0));
        assertEquals(0, ex.getPeriod());
    }
}

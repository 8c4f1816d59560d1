package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.model.GameClock;
import com.asad.lineup_tracker.model.PlayByPlayEvent;
import com.asad.lineup_tracker.model.SequencedEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Puts a game's events in processing order: time remaining descending, then period
 * ascending, then event number ascending.
 */
public final class EventSequencer {

    public static final Comparator<SequencedEvent> PROCESSING_ORDER =
            Comparator.comparingDouble(SequencedEvent::gameTimeRemaining).reversed()
                    .thenComparingInt(SequencedEvent::period)
                    .thenComparingInt(SequencedEvent::eventNum);

    private EventSequencer() {}

    public static List<SequencedEvent> sequence(String gameId, List<PlayByPlayEvent> events) {
        List<SequencedEvent> out = new ArrayList<>(events.size());
        for (PlayByPlayEvent e : events) {
            GameClock clock = GameClockNormalizer.normalize(gameId, e.clock(), e.period());
            out.add(new SequencedEvent(e, clock));
        }
        out.sort(PROCESSING_ORDER);
        return out;
    }
}

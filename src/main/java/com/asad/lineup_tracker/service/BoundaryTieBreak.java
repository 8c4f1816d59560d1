package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.model.SubstitutionInterval;

import java.util.ArrayList;
import java.util.List;

/**
 * When an event lands exactly on a substitution time, the closed-interval match counts both
 * the player leaving and the player entering. This rule keeps the player who was already on
 * the floor: an interval starting exactly at the query time is dropped.
 */
public final class BoundaryTieBreak {

    private BoundaryTieBreak() {}

    public static List<SubstitutionInterval> preferContinuingPlayers(List<SubstitutionInterval> teamIntervals,
                                                                     double gameTimeRemaining) {
        List<SubstitutionInterval> out = new ArrayList<>();
        for (SubstitutionInterval i : teamIntervals) {
            if (i.timeIn() > gameTimeRemaining && i.timeOut() <= gameTimeRemaining) out.add(i);
        }
        return out;
    }
}

package com.asad.lineup_tracker.model;

import java.util.List;

/**
 * The five home and five visitor players on the floor for one event.
 */
public record LineupRow(String gameId, int eventNum, List<Integer> homePlayers, List<Integer> visitorPlayers) {

    public LineupRow {
        homePlayers = List.copyOf(homePlayers);
        visitorPlayers = List.copyOf(visitorPlayers);
    }
}

package com.asad.lineup_tracker.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Home and visitor player ids for one game. Order is the box-score order and is kept
 * stable so downstream output is deterministic.
 */
public class Roster {

    public final int homeTeamId;
    public final int visitorTeamId;

    private final Set<Integer> home;
    private final Set<Integer> visitor;

    public Roster(int homeTeamId, int visitorTeamId, List<Integer> home, List<Integer> visitor) {
        this.homeTeamId = homeTeamId;
        this.visitorTeamId = visitorTeamId;
        this.home = new LinkedHashSet<>(home);
        this.visitor = new LinkedHashSet<>(visitor);
    }

    public List<Integer> home() {
        return List.copyOf(home);
    }

    public List<Integer> visitor() {
        return List.copyOf(visitor);
    }

    /**
     * True for the values the play-by-play puts in a player slot that is not a player:
     * an empty slot (null or 0) or a team id credited with a team rebound or turnover.
     */
    public boolean isTeamOrEmptySlot(Integer id) {
        return id == null || id == 0 || id == homeTeamId || id == visitorTeamId;
    }

    /**
     * Team id the player is rostered on, or null if the player is on neither roster.
     */
    public Integer teamOf(int playerId) {
        if (isHome(playerId)) return homeTeamId;
        if (isVisitor(playerId)) return visitorTeamId;
        return null;
    }

    private boolean isHome(int playerId) {
        return home.contains(playerId);
    }

    private boolean isVisitor(int playerId) {
        return visitor.contains(playerId);
    }
}

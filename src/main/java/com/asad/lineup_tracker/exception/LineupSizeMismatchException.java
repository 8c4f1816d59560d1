package com.asad.lineup_tracker.exception;

import java.util.List;

public class LineupSizeMismatchException extends LineupReconstructionException {

    private final int teamId;
    private final int eventNum;
    private final List<Integer> players;

    public LineupSizeMismatchException(String gameId, int teamId, int eventNum, List<Integer> players) {
        super(gameId, "Expected 5 players on court for team " + teamId + " at event " + eventNum
                + " but found " + players.size() + ": " + players);
        this.teamId = teamId;
        this.eventNum = eventNum;
        this.players = List.copyOf(players);
    }

    public int getTeamId() {
        return teamId;
    }

    public int getEventNum() {
        return eventNum;
    }

    public List<Integer> getPlayers() {
        return players;
    }

    @Override
    public String errorCode() {
        return "LineupSizeMismatch";
    }
}

package com.asad.lineup_tracker.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One row of the play-by-play log. Participant slots follow the feed layout:
 * for substitutions player1 leaves the floor and player2 enters.
 */
public record PlayByPlayEvent(String gameId,
                              int eventNum,
                              int period,
                              String clock,
                              int msgType,
                              Integer player1Id,
                              Integer player1TeamId,
                              Integer player2Id,
                              Integer player2TeamId,
                              Integer player3Id,
                              Integer player3TeamId) {

    public static PlayByPlayEvent of(String gameId, int eventNum, int period, String clock, int msgType) {
        return new PlayByPlayEvent(gameId, eventNum, period, clock, msgType,
                null, null, null, null, null, null);
    }

    public static PlayByPlayEvent substitution(String gameId, int eventNum, int period, String clock,
                                               int outPlayerId, int inPlayerId, Integer teamId) {
        return new PlayByPlayEvent(gameId, eventNum, period, clock, EventMsgType.SUBSTITUTION,
                outPlayerId, teamId, inPlayerId, teamId, null, null);
    }

    /**
     * Non-null player ids in slot order (player1, player2, player3).
     */
    public List<Integer> participantIds() {
        List<Integer> ids = new ArrayList<>(3);
        if (player1Id != null) ids.add(player1Id);
        if (player2Id != null) ids.add(player2Id);
        if (player3Id != null) ids.add(player3Id);
        return ids;
    }
}

package com.asad.lineup_tracker.exception;

public class UnknownParticipantException extends LineupReconstructionException {

    private final int playerId;
    private final int eventNum;

    public UnknownParticipantException(String gameId, int playerId, int eventNum) {
        super(gameId, "Player " + playerId + " at event " + eventNum + " is on neither roster");
        this.playerId = playerId;
        this.eventNum = eventNum;
    }

    public int getPlayerId() {
        return playerId;
    }

    public int getEventNum() {
        return eventNum;
    }

    @Override
    public String errorCode() {
        return "UnknownParticipant";
    }
}

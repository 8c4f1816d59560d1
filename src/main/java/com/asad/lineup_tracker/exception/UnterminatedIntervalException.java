package com.asad.lineup_tracker.exception;

public class UnterminatedIntervalException extends LineupReconstructionException {

    private final int playerId;

    public UnterminatedIntervalException(String gameId, int playerId, int checkIns, int checkOuts) {
        super(gameId, "Player " + playerId + " still checked in at end of log ("
                + checkIns + " check-ins, " + checkOuts + " check-outs)");
        this.playerId = playerId;
    }

    public int getPlayerId() {
        return playerId;
    }

    @Override
    public String errorCode() {
        return "UnterminatedInterval";
    }
}

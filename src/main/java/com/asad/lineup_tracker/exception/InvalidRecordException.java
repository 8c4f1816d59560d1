package com.asad.lineup_tracker.exception;

/**
 * Tabular input that cannot be turned into records (missing column, non-numeric id, empty game).
 */
public class InvalidRecordException extends LineupReconstructionException {

    public InvalidRecordException(String gameId, String message) {
        super(gameId, message);
    }

    public InvalidRecordException(String gameId, String message, Throwable cause) {
        super(gameId, message, cause);
    }

    @Override
    public String errorCode() {
        return "InvalidRecord";
    }
}

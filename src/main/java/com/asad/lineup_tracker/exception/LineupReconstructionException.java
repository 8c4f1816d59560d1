package com.asad.lineup_tracker.exception;

/**
 * Base for every failure that stops a game from being reconstructed. A game either
 * reconstructs fully or throws one of these; there is no partial lineup table.
 */
public class LineupReconstructionException extends RuntimeException {

    private final String gameId;

    public LineupReconstructionException(String gameId, String message) {
        super(message);
        this.gameId = gameId;
    }

    public LineupReconstructionException(String gameId, String message, Throwable cause) {
        super(message, cause);
        this.gameId = gameId;
    }

    public String getGameId() {
        return gameId;
    }

    /** Short machine-readable name used in API error bodies. */
    public String errorCode() {
        return "LineupReconstruction";
    }
}

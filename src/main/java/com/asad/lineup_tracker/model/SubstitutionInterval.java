package com.asad.lineup_tracker.model;

/**
 * A closed stretch of game time a player spent on the floor. Time runs down, so timeIn >= timeOut.
 */
public record SubstitutionInterval(int playerId, int teamId, double timeIn, double timeOut, int period) {

    public double duration() {
        return timeIn - timeOut;
    }
}

package com.asad.lineup_tracker.model;

// one player line of a box score; only the columns needed for roster building
public record BoxScoreLine(String gameId, int teamId, int playerId) {}

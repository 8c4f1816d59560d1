package com.asad.lineup_tracker.model;

public record GameInfo(String gameId, int homeTeamId, int visitorTeamId) {}

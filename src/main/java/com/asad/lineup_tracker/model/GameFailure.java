package com.asad.lineup_tracker.model;

public record GameFailure(String gameId, String error, String message) {}

package com.asad.lineup_tracker.model;

/**
 * Normalized clock for one event, both values in seconds.
 *
 * @param gameTimeRemaining time left in the game (overtime: in the current overtime period)
 * @param maxPeriodTime     the gameTimeRemaining value at the instant the current period starts
 */
public record GameClock(double gameTimeRemaining, double maxPeriodTime) {}

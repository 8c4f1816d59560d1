package com.asad.lineup_tracker.model;

import java.util.List;
import java.util.Map;

/**
 * Everything reconstructed for one game: processing order, every player's stints,
 * the accrued seconds per player and one lineup row per event.
 */
public record GameLineups(String gameId,
                          Roster roster,
                          List<SequencedEvent> events,
                          List<SubstitutionInterval> intervals,
                          Map<Integer, Double> playingTime,
                          List<LineupRow> rows) {}

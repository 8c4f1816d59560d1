package com.asad.lineup_tracker.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class BatchResult {

    // keyed by game id, in input order
    public final Map<String, GameLineups> games = new LinkedHashMap<>();
    public final List<GameFailure> failures = new ArrayList<>();

    public List<LineupRow> allRows() {
        List<LineupRow> rows = new ArrayList<>();
        for (GameLineups g : games.values()) rows.addAll(g.rows());
        return rows;
    }
}

package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.exception.InvalidRecordException;
import com.asad.lineup_tracker.model.BoxScoreLine;
import com.asad.lineup_tracker.model.GameInfo;
import com.asad.lineup_tracker.model.Roster;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class RosterService {

    /**
     * Splits a box score into home and visitor rosters, keeping box-score order.
     * Lines for other games or other teams are skipped.
     */
    public Roster buildRoster(GameInfo game, List<BoxScoreLine> boxScore) {
        List<Integer> home = new ArrayList<>();
        List<Integer> visitor = new ArrayList<>();

        for (BoxScoreLine line : boxScore) {
            if (line.gameId() != null && !line.gameId().equals(game.gameId())) continue;

            if (line.teamId() == game.homeTeamId()) home.add(line.playerId());
            else if (line.teamId() == game.visitorTeamId()) visitor.add(line.playerId());
        }

        if (home.isEmpty()) {
            throw new InvalidRecordException(game.gameId(), "No box-score lines for home team " + game.homeTeamId());
        }
        if (visitor.isEmpty()) {
            throw new InvalidRecordException(game.gameId(), "No box-score lines for visitor team " + game.visitorTeamId());
        }

        return new Roster(game.homeTeamId(), game.visitorTeamId(), home, visitor);
    }
}

package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.exception.LineupSizeMismatchException;
import com.asad.lineup_tracker.model.EventMsgType;
import com.asad.lineup_tracker.model.LineupRow;
import com.asad.lineup_tracker.model.Roster;
import com.asad.lineup_tracker.model.SequencedEvent;
import com.asad.lineup_tracker.model.SubstitutionInterval;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Maps every event back to the five players per team whose intervals cover its time.
 */
@Service
public class LineupAssignmentService {

    public static final int PLAYERS_ON_COURT = 5;

    public List<LineupRow> assign(String gameId,
                                  Roster roster,
                                  List<SequencedEvent> events,
                                  List<SubstitutionInterval> intervals) {

        List<SubstitutionInterval> home = new ArrayList<>();
        List<SubstitutionInterval> visitor = new ArrayList<>();
        for (SubstitutionInterval i : intervals) {
            if (i.teamId() == roster.homeTeamId) home.add(i);
            else if (i.teamId() == roster.visitorTeamId) visitor.add(i);
        }

        List<LineupRow> rows = new ArrayList<>(events.size());
        for (SequencedEvent e : events) {
            List<Integer> homeFive = lineupFor(gameId, roster.homeTeamId, e, home);
            List<Integer> visitorFive = lineupFor(gameId, roster.visitorTeamId, e, visitor);
            rows.add(new LineupRow(gameId, e.eventNum(), homeFive, visitorFive));
        }
        return rows;
    }

    List<Integer> lineupFor(String gameId, int teamId, SequencedEvent e, List<SubstitutionInterval> teamIntervals) {
        List<SubstitutionInterval> matches = select(e.msgType(), e.gameTimeRemaining(), teamIntervals);

        List<Integer> players = new ArrayList<>(matches.size());
        for (SubstitutionInterval i : matches) players.add(i.playerId());

        if (players.size() != PLAYERS_ON_COURT || new HashSet<>(players).size() != PLAYERS_ON_COURT) {
            throw new LineupSizeMismatchException(gameId, teamId, e.eventNum(), players);
        }
        return players;
    }

    static List<SubstitutionInterval> select(int msgType, double t, List<SubstitutionInterval> teamIntervals) {
        List<SubstitutionInterval> out = new ArrayList<>();

        if (EventMsgType.isPeriodEnd(msgType)) {
            // the stints this very event closed
            for (SubstitutionInterval i : teamIntervals) {
                if (i.timeOut() == t) out.add(i);
            }
            return out;
        }

        if (EventMsgType.isSubstitution(msgType)) {
            // player leaving is out, player entering is in
            for (SubstitutionInterval i : teamIntervals) {
                if (i.timeIn() >= t && i.timeOut() < t) out.add(i);
            }
            return out;
        }

        for (SubstitutionInterval i : teamIntervals) {
            if (i.timeIn() >= t && i.timeOut() <= t) out.add(i);
        }
        if (out.size() > PLAYERS_ON_COURT) {
            return BoundaryTieBreak.preferContinuingPlayers(teamIntervals, t);
        }
        return out;
    }
}

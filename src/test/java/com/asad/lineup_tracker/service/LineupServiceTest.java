package com.asad.lineup_tracker.service;

import static com.asad.lineup_tracker.service.GameFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import com.asad.lineup_tracker.exception.InvalidRecordException;
import com.asad.lineup_tracker.model.*;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.LinkedHashSet;
import org.junit.jupiter.api.Test;

final class LineupServiceTest {

    private final LineupService service =
            new LineupService(new RosterService(), new LineupAssignmentService(), 4, 30);

    @Test
    void reconstructsTheMinimalGame() {
        GameLineups result = service.reconstruct(game(), boxScore(), oneQuarterGame());

        assertEquals(GAME_ID, result.gameId());
        assertEquals(7, result.rows().size());
        assertEquals(7, result.events().size());
        assertEquals(11, result.intervals().size());

        double home = 0;
        double visitor = 0;
        for (int id : HOME_PLAYERS) home += result.playingTime().get(id);
        for (int id : VISITOR_PLAYERS) visitor += result.playingTime().get(id);
        assertEquals(3000.0, home);
        assertEquals(3000.0, visitor);

        for (LineupRow r : result.rows()) {
            assertEquals(5, new LinkedHashSet<>(r.homePlayers()).size());
            assertEquals(5, new LinkedHashSet<>(r.visitorPlayers()).size());
        }
    }

    @Test
    void ignoresEventsFromOtherGames() {
        List<PlayByPlayEvent> events = oneQuarterGame();
        events.add(new PlayByPlayEvent("0021900099", 1, 1, "9:00", EventMsgType.MADE_SHOT,
                999, 300, null, null, null, null));

        assertEquals(7, service.reconstruct(game(), boxScore(), events).rows().size());
    }

    @Test
    void teamReboundRowsFromCsvDoNotBreakTheGame() {
        List<PlayByPlayEvent> events = oneQuarterGame();
        events.add(new PlayByPlayEvent(GAME_ID, 8, 1, "3:00", EventMsgType.REBOUND,
                HOME, null, 0, null, 0, null));
        List<PlayByPlayEvent> parsed = new CsvService(',').readEvents(new StringReader(pbpCsv(events)));

        GameLineups result = service.reconstruct(game(), boxScore(), parsed);

        assertEquals(8, result.rows().size());
        LineupRow rebound = result.rows().get(5);
        assertEquals(8, rebound.eventNum());
        assertEquals(Set.of(1, 2, 3, 4, 6), Set.copyOf(rebound.homePlayers()));
        assertEquals(5, rebound.visitorPlayers().size());
    }

    @Test
    void gameWithoutEventsIsRejected() {
        InvalidRecordException ex = assertThrows(InvalidRecordException.class,
                () -> service.reconstruct(game(), boxScore(), List.of()));
        assertEquals(GAME_ID, ex.getGameId());
    }

    @Test
    void rerunningGivesIdenticalOutput() {
        List<PlayByPlayEvent> shuffled = oneQuarterGame();
        Collections.shuffle(shuffled, new Random(7));

        GameLineups first = service.reconstruct(game(), boxScore(), oneQuarterGame());
        GameLineups second = service.reconstruct(game(), boxScore(), shuffled);

        assertEquals(first.rows(), second.rows());
        assertEquals(first.intervals(), second.intervals());
        assertEquals(first.playingTime(), second.playingTime());
    }

    @Test
    void periodEndLineupMatchesOnCourtSetBeforeIt() {
        List<SequencedEvent> sequenced = EventSequencer.sequence(GAME_ID, oneQuarterGame());
        LineupStateMachine machine = new LineupStateMachine(GAME_ID, roster());
        for (SequencedEvent e : sequenced.subList(0, sequenced.size() - 1)) machine.apply(e);

        Set<Integer> homeBefore = Set.copyOf(machine.onCourt(HOME));
        Set<Integer> visitorBefore = Set.copyOf(machine.onCourt(VISITOR));

        GameLineups result = service.reconstruct(game(), boxScore(), oneQuarterGame());
        LineupRow periodEnd = result.rows().get(result.rows().size() - 1);

        assertEquals(homeBefore, Set.copyOf(periodEnd.homePlayers()));
        assertEquals(visitorBefore, Set.copyOf(periodEnd.visitorPlayers()));
    }

    // -------------------------------
    // Batch
    // -------------------------------

    @Test
    void batchKeepsGoodGamesAndReportsBrokenOnes() {
        String brokenId = "0021900002";
        String emptyId = "0021900003";

        List<BoxScoreLine> box = new ArrayList<>(boxScore());
        for (BoxScoreLine l : boxScore()) {
            box.add(new BoxScoreLine(brokenId, l.teamId(), l.playerId()));
            box.add(new BoxScoreLine(emptyId, l.teamId(), l.playerId()));
        }

        List<PlayByPlayEvent> events = new ArrayList<>(oneQuarterGame());
        for (PlayByPlayEvent e : oneQuarterGame()) {
            if (e.eventNum() == 7) continue; // no period end: someone stays checked in
            events.add(new PlayByPlayEvent(brokenId, e.eventNum(), e.period(), e.clock(), e.msgType(),
                    e.player1Id(), e.player1TeamId(), e.player2Id(), e.player2TeamId(),
                    e.player3Id(), e.player3TeamId()));
        }

        List<GameInfo> games = List.of(
                new GameInfo(brokenId, HOME, VISITOR), game(), new GameInfo(emptyId, HOME, VISITOR));

        BatchResult result = service.reconstructAll(games, box, events);

        assertEquals(Set.of(GAME_ID), result.games.keySet());
        assertEquals(7, result.allRows().size());

        assertEquals(2, result.failures.size());
        assertEquals(brokenId, result.failures.get(0).gameId());
        assertEquals("UnterminatedInterval", result.failures.get(0).error());
        assertEquals(emptyId, result.failures.get(1).gameId());
        assertEquals("InvalidRecord", result.failures.get(1).error());
    }

    @Test
    void emptyBatch() {
        BatchResult result = service.reconstructAll(List.of(), boxScore(), oneQuarterGame());
        assertTrue(result.games.isEmpty());
        assertTrue(result.failures.isEmpty());
    }
}

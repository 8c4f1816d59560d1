package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.exception.InvalidRecordException;
import com.asad.lineup_tracker.exception.LineupReconstructionException;
import com.asad.lineup_tracker.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.*;

/**
 * Runs the whole reconstruction for a game: rosters, clock normalization, sequencing,
 * the time-bank pass and lineup assignment.
 */
@Service
public class LineupService {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineupService.class);

    private final RosterService rosterService;
    private final LineupAssignmentService assignmentService;
    private final int maxThreads;
    private final long gameTimeoutSeconds;

    public LineupService(RosterService rosterService,
                         LineupAssignmentService assignmentService,
                         @Value("${lineup.batch.max-threads:8}") int maxThreads,
                         @Value("${lineup.batch.game-timeout-seconds:30}") long gameTimeoutSeconds) {
        this.rosterService = rosterService;
        this.assignmentService = assignmentService;
        this.maxThreads = Math.max(1, maxThreads);
        this.gameTimeoutSeconds = gameTimeoutSeconds;
    }

    // -------------------------------------------------------
    // Single game
    // -------------------------------------------------------

    public GameLineups reconstruct(GameInfo game, List<BoxScoreLine> boxScore, List<PlayByPlayEvent> events) {
        Roster roster = rosterService.buildRoster(game, boxScore);

        List<PlayByPlayEvent> gameEvents = new ArrayList<>();
        for (PlayByPlayEvent e : events) {
            if (game.gameId().equals(e.gameId())) gameEvents.add(e);
        }
        return reconstruct(game.gameId(), roster, gameEvents);
    }

    public GameLineups reconstruct(String gameId, Roster roster, List<PlayByPlayEvent> events) {
        if (events.isEmpty()) {
            throw new InvalidRecordException(gameId, "No play-by-play events for game " + gameId);
        }

        List<SequencedEvent> sequenced = EventSequencer.sequence(gameId, events);

        LineupStateMachine machine = LineupStateMachine.run(gameId, roster, sequenced);
        List<SubstitutionInterval> intervals = machine.finish();

        // the assignment pass needs every interval closed before it starts
        List<LineupRow> rows = assignmentService.assign(gameId, roster, sequenced, intervals);

        LOGGER.info("Game {}: {} events, {} stints, {} lineup rows",
                gameId, sequenced.size(), intervals.size(), rows.size());

        return new GameLineups(gameId, roster, List.copyOf(sequenced), List.copyOf(intervals),
                Collections.unmodifiableMap(machine.playingTime()), List.copyOf(rows));
    }

    // -------------------------------------------------------
    // Many games
    // -------------------------------------------------------

    /**
     * Reconstructs every game on a bounded pool. Games are independent; a failed game is
     * reported in {@link BatchResult#failures} and contributes no rows.
     */
    public BatchResult reconstructAll(List<GameInfo> games, List<BoxScoreLine> boxScore, List<PlayByPlayEvent> events) {
        BatchResult result = new BatchResult();
        if (games.isEmpty()) return result;

        Map<String, List<PlayByPlayEvent>> eventsByGame = new HashMap<>();
        for (PlayByPlayEvent e : events) {
            eventsByGame.computeIfAbsent(e.gameId(), k -> new ArrayList<>()).add(e);
        }

        int threads = Math.min(maxThreads, games.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CompletionService<GameLineups> cs = new ExecutorCompletionService<>(pool);

        Map<Future<GameLineups>, String> submitted = new HashMap<>();
        Map<String, GameLineups> done = new HashMap<>();
        Map<String, GameFailure> failed = new HashMap<>();
        boolean interrupted = false;

        try {
            for (GameInfo g : games) {
                List<PlayByPlayEvent> gameEvents = eventsByGame.getOrDefault(g.gameId(), List.of());
                submitted.put(cs.submit(() -> reconstruct(g, boxScore, gameEvents)), g.gameId());
            }

            for (int i = 0; i < submitted.size(); i++) {
                Future<GameLineups> f = cs.poll(gameTimeoutSeconds, TimeUnit.SECONDS);
                if (f == null) break;

                String gid = submitted.get(f);
                try {
                    done.put(gid, f.get());
                } catch (ExecutionException ex) {
                    failed.put(gid, failure(gid, ex.getCause()));
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            interrupted = true;
        } finally {
            pool.shutdownNow();
        }

        for (GameInfo g : games) {
            String gid = g.gameId();
            if (done.containsKey(gid)) {
                result.games.put(gid, done.get(gid));
            } else {
                GameFailure f = failed.get(gid);
                if (f == null) {
                    f = interrupted
                            ? new GameFailure(gid, "Interrupted", "Batch was interrupted before the game finished")
                            : new GameFailure(gid, "Timeout", "Game did not finish within " + gameTimeoutSeconds + "s");
                }
                result.failures.add(f);
            }
        }

        LOGGER.info("Batch of {} games: {} reconstructed, {} failed",
                games.size(), result.games.size(), result.failures.size());
        return result;
    }

    private static GameFailure failure(String gameId, Throwable cause) {
        if (cause instanceof LineupReconstructionException lre) {
            LOGGER.warn("Game {} failed: {}", gameId, lre.getMessage());
            return new GameFailure(gameId, lre.errorCode(), lre.getMessage());
        }
        LOGGER.warn("Game {} failed unexpectedly", gameId, cause);
        return new GameFailure(gameId, cause.getClass().getSimpleName(), String.valueOf(cause.getMessage()));
    }
}

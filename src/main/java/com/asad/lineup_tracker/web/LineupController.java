package com.asad.lineup_tracker.web;

import com.asad.lineup_tracker.exception.*;
import com.asad.lineup_tracker.model.*;
import com.asad.lineup_tracker.service.CsvService;
import com.asad.lineup_tracker.service.LineupCsvWriter;
import com.asad.lineup_tracker.service.LineupService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

import java.util.*;

@Controller
public class LineupController {

    private final CsvService csvService;
    private final LineupService lineupService;
    private final LineupCsvWriter lineupCsvWriter;

    public LineupController(CsvService csvService, LineupService lineupService, LineupCsvWriter lineupCsvWriter) {
        this.csvService = csvService;
        this.lineupService = lineupService;
        this.lineupCsvWriter = lineupCsvWriter;
    }

    /**
     * Lineups and stints as JSON for every game in the upload.
     */
    @PostMapping(value = "/lineups", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public LineupResponse lineups(@RequestParam("pbp") MultipartFile pbp,
                                  @RequestParam("boxscore") MultipartFile boxscore,
                                  @RequestParam("games") MultipartFile games) {

        BatchResult result = run(pbp, boxscore, games);

        List<GameResponse> out = new ArrayList<>();
        for (GameLineups g : result.games.values()) {
            out.add(new GameResponse(g.gameId(), g.rows(), g.intervals(), g.playingTime()));
        }
        return new LineupResponse(out, result.failures);
    }

    /**
     * The lineup table as CSV, one row per event of every game that reconstructed.
     */
    @PostMapping(value = "/lineups/csv", produces = "text/csv")
    @ResponseBody
    public ResponseEntity<String> lineupsCsv(@RequestParam("pbp") MultipartFile pbp,
                                             @RequestParam("boxscore") MultipartFile boxscore,
                                             @RequestParam("games") MultipartFile games) {

        BatchResult result = run(pbp, boxscore, games);

        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType("text/csv"))
                .header("X-Failed-Games", String.valueOf(result.failures.size()))
                .body(lineupCsvWriter.toCsv(result.allRows()));
    }

    // A single game is run directly so its failure surfaces with full detail.
    private BatchResult run(MultipartFile pbp, MultipartFile boxscore, MultipartFile games) {
        var events = csvService.parseEvents(pbp);
        var boxScore = csvService.parseBoxScore(boxscore);
        var gameInfos = csvService.parseGames(games);

        if (gameInfos.size() == 1) {
            GameLineups g = lineupService.reconstruct(gameInfos.get(0), boxScore, events);
            BatchResult single = new BatchResult();
            single.games.put(g.gameId(), g);
            return single;
        }
        return lineupService.reconstructAll(gameInfos, boxScore, events);
    }

    // -------------------------------
    // Errors
    // -------------------------------

    @ExceptionHandler(InvalidRecordException.class)
    public ResponseEntity<Map<String, Object>> invalidRecord(InvalidRecordException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorBody(ex));
    }

    @ExceptionHandler(LineupReconstructionException.class)
    public ResponseEntity<Map<String, Object>> reconstructionFailed(LineupReconstructionException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(errorBody(ex));
    }

    static Map<String, Object> errorBody(LineupReconstructionException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", ex.errorCode());
        body.put("message", ex.getMessage());
        if (ex.getGameId() != null) body.put("gameId", ex.getGameId());

        if (ex instanceof LineupSizeMismatchException m) {
            body.put("teamId", m.getTeamId());
            body.put("eventNum", m.getEventNum());
            body.put("players", m.getPlayers());
        } else if (ex instanceof UnknownParticipantException u) {
            body.put("playerId", u.getPlayerId());
            body.put("eventNum", u.getEventNum());
        } else if (ex instanceof UnterminatedIntervalException u) {
            body.put("playerId", u.getPlayerId());
        } else if (ex instanceof MalformedClockException c) {
            body.put("clock", c.getClock());
            body.put("period", c.getPeriod());
        }
        return body;
    }

    public record GameResponse(String gameId,
                               List<LineupRow> rows,
                               List<SubstitutionInterval> intervals,
                               Map<Integer, Double> playingTime) {}

    public record LineupResponse(List<GameResponse> games, List<GameFailure> failures) {}
}

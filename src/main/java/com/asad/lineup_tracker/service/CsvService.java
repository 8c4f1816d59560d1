package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.exception.InvalidRecordException;
import com.asad.lineup_tracker.model.BoxScoreLine;
import com.asad.lineup_tracker.model.GameInfo;
import com.asad.lineup_tracker.model.PlayByPlayEvent;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.function.Function;

/**
 * Reads play-by-play, box-score and game CSV exports. Columns are looked up by header name
 * (case-insensitive), so extra columns and column order do not matter.
 */
@Service
public class CsvService {

    private final char separator;

    public CsvService(@Value("${lineup.csv.separator:,}") char separator) {
        this.separator = separator;
    }

    // -------------------------------
    // Multipart uploads
    // -------------------------------

    public List<PlayByPlayEvent> parseEvents(MultipartFile file) {
        return withReader(file, this::readEvents);
    }

    public List<BoxScoreLine> parseBoxScore(MultipartFile file) {
        return withReader(file, this::readBoxScore);
    }

    public List<GameInfo> parseGames(MultipartFile file) {
        return withReader(file, this::readGames);
    }

    private <T> List<T> withReader(MultipartFile file, Function<Reader, List<T>> parser) {
        try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8)) {
            return parser.apply(reader);
        } catch (IOException ex) {
            throw new InvalidRecordException(null, "Could not read upload " + file.getOriginalFilename(), ex);
        }
    }

    // -------------------------------
    // Readers
    // -------------------------------

    public List<PlayByPlayEvent> readEvents(Reader in) {
        List<PlayByPlayEvent> out = new ArrayList<>();
        Table table = readTable(in, "game_id", "eventnum", "period", "pctimestring", "eventmsgtype",
                "player1_id", "player1_team_id", "player2_id", "player2_team_id", "player3_id", "player3_team_id");

        for (String[] row : table.rows) {
            String gameId = table.gameId(row);
            out.add(new PlayByPlayEvent(
                    gameId,
                    table.requiredInt(row, "eventnum", gameId),
                    table.requiredInt(row, "period", gameId),
                    table.get(row, "pctimestring"),
                    table.requiredInt(row, "eventmsgtype", gameId),
                    table.optionalInt(row, "player1_id", gameId),
                    table.optionalInt(row, "player1_team_id", gameId),
                    table.optionalInt(row, "player2_id", gameId),
                    table.optionalInt(row, "player2_team_id", gameId),
                    table.optionalInt(row, "player3_id", gameId),
                    table.optionalInt(row, "player3_team_id", gameId)
            ));
        }
        return out;
    }

    public List<BoxScoreLine> readBoxScore(Reader in) {
        List<BoxScoreLine> out = new ArrayList<>();
        Table table = readTable(in, "game_id", "team_id", "player_id");

        for (String[] row : table.rows) {
            String gameId = table.gameId(row);
            out.add(new BoxScoreLine(
                    gameId,
                    table.requiredInt(row, "team_id", gameId),
                    table.requiredInt(row, "player_id", gameId)
            ));
        }
        return out;
    }

    public List<GameInfo> readGames(Reader in) {
        List<GameInfo> out = new ArrayList<>();
        Table table = readTable(in, "game_id", "home_team_id", "visitor_team_id");

        for (String[] row : table.rows) {
            String gameId = table.gameId(row);
            out.add(new GameInfo(
                    gameId,
                    table.requiredInt(row, "home_team_id", gameId),
                    table.requiredInt(row, "visitor_team_id", gameId)
            ));
        }
        return out;
    }

    private Table readTable(Reader in, String... requiredColumns) {
        CSVReader reader = new CSVReaderBuilder(in)
                .withCSVParser(new CSVParserBuilder().withSeparator(separator).build())
                .build();
        try (reader) {
            String[] header = reader.readNext();
            if (header == null) throw new InvalidRecordException(null, "CSV is empty");

            Map<String, Integer> columns = new HashMap<>();
            for (int i = 0; i < header.length; i++) {
                columns.put(header[i].trim().toLowerCase(Locale.ROOT), i);
            }
            for (String c : requiredColumns) {
                if (!columns.containsKey(c)) throw new InvalidRecordException(null, "Missing column " + c);
            }

            List<String[]> rows = new ArrayList<>();
            String[] row;
            while ((row = reader.readNext()) != null) {
                if (row.length == 1 && row[0].isBlank()) continue;
                rows.add(row);
            }
            return new Table(columns, rows);
        } catch (IOException | CsvException ex) {
            throw new InvalidRecordException(null, "CSV parse failed: " + ex.getMessage(), ex);
        }
    }

    /**
     * Normalize to 10 digits (stats feed format).
     * Example: 21900001 -> 0021900001
     */
    static String normalizeGameId(String gameId) {
        if (gameId == null) return null;
        String id = gameId.trim();
        if (id.matches("\\d+") && id.length() < 10) {
            return String.format("%10s", id).replace(' ', '0');
        }
        return id;
    }

    private static final class Table {
        final Map<String, Integer> columns;
        final List<String[]> rows;

        Table(Map<String, Integer> columns, List<String[]> rows) {
            this.columns = columns;
            this.rows = rows;
        }

        String get(String[] row, String column) {
            Integer idx = columns.get(column);
            if (idx == null) throw new InvalidRecordException(null, "Missing column " + column);
            if (idx >= row.length) return null;
            String v = row[idx].trim();
            return v.isEmpty() ? null : v;
        }

        String gameId(String[] row) {
            String id = normalizeGameId(get(row, "game_id"));
            if (id == null) throw new InvalidRecordException(null, "Row without game_id");
            return id;
        }

        int requiredInt(String[] row, String column, String gameId) {
            Integer v = optionalInt(row, column, gameId);
            if (v == null) throw new InvalidRecordException(gameId, "Empty value in column " + column);
            return v;
        }

        // Ids exported through floating-point columns come out as "203507.0"
        Integer optionalInt(String[] row, String column, String gameId) {
            String v = get(row, column);
            if (v == null) return null;
            try {
                return new BigDecimal(v).intValueExact();
            } catch (NumberFormatException | ArithmeticException ex) {
                throw new InvalidRecordException(gameId, "Not an integer in column " + column + ": " + v, ex);
            }
        }
    }
}

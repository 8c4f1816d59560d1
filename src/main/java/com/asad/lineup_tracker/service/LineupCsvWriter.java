package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.model.LineupRow;
import com.opencsv.CSVWriter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

@Service
public class LineupCsvWriter {

    static final String[] HEADER = {
            "game_id", "eventnum",
            "home_player_1", "home_player_2", "home_player_3", "home_player_4", "home_player_5",
            "visitor_player_1", "visitor_player_2", "visitor_player_3", "visitor_player_4", "visitor_player_5"
    };

    private final char separator;

    public LineupCsvWriter(@Value("${lineup.csv.separator:,}") char separator) {
        this.separator = separator;
    }

    public void write(List<LineupRow> rows, Writer out) {
        CSVWriter writer = new CSVWriter(out, separator, CSVWriter.NO_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER, "\n");
        writer.writeNext(HEADER, false);
        for (LineupRow r : rows) writer.writeNext(toLine(r), false);
        try {
            writer.flush();
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public String toCsv(List<LineupRow> rows) {
        StringWriter sw = new StringWriter();
        write(rows, sw);
        return sw.toString();
    }

    private static String[] toLine(LineupRow r) {
        List<String> cells = new ArrayList<>(HEADER.length);
        cells.add(r.gameId());
        cells.add(String.valueOf(r.eventNum()));
        for (Integer id : r.homePlayers()) cells.add(String.valueOf(id));
        for (Integer id : r.visitorPlayers()) cells.add(String.valueOf(id));
        return cells.toArray(new String[0]);
    }
}

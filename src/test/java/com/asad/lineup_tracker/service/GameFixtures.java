package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.model.BoxScoreLine;
import com.asad.lineup_tracker.model.EventMsgType;
import com.asad.lineup_tracker.model.GameInfo;
import com.asad.lineup_tracker.model.PlayByPlayEvent;
import com.asad.lineup_tracker.model.Roster;

import java.util.ArrayList;
import java.util.List;

/**
 * A one-period game: ten starters show up in the first plays, home player 5 is subbed out
 * for 6 at 5:00, and the period ends at 0:00.
 */
public final class GameFixtures {

    public static final String GAME_ID = "0021900001";
    public static final int HOME = 100;
    public static final int VISITOR = 200;

    public static final List<Integer> HOME_PLAYERS = List.of(1, 2, 3, 4, 5, 6);
    public static final List<Integer> VISITOR_PLAYERS = List.of(11, 12, 13, 14, 15);

    private GameFixtures() {}

    public static Roster roster() {
        return new Roster(HOME, VISITOR, HOME_PLAYERS, VISITOR_PLAYERS);
    }

    public static GameInfo game() {
        return new GameInfo(GAME_ID, HOME, VISITOR);
    }

    public static List<BoxScoreLine> boxScore() {
        List<BoxScoreLine> lines = new ArrayList<>();
        for (int id : HOME_PLAYERS) lines.add(new BoxScoreLine(GAME_ID, HOME, id));
        for (int id : VISITOR_PLAYERS) lines.add(new BoxScoreLine(GAME_ID, VISITOR, id));
        return lines;
    }

    public static PlayByPlayEvent play(int eventNum, int period, String clock, int type,
                                       Integer p1, Integer p2, Integer p3) {
        return new PlayByPlayEvent(GAME_ID, eventNum, period, clock, type,
                p1, teamOf(p1), p2, teamOf(p2), p3, teamOf(p3));
    }

    public static PlayByPlayEvent sub(int eventNum, int period, String clock, int out, int in) {
        return PlayByPlayEvent.substitution(GAME_ID, eventNum, period, clock, out, in, teamOf(out));
    }

    public static PlayByPlayEvent periodEnd(int eventNum, int period) {
        return PlayByPlayEvent.of(GAME_ID, eventNum, period, "0:00", EventMsgType.PERIOD_END);
    }

    public static List<PlayByPlayEvent> oneQuarterGame() {
        return new ArrayList<>(List.of(
                play(1, 1, "9:30", EventMsgType.MADE_SHOT, 1, 2, 11),
                play(2, 1, "9:00", EventMsgType.MISSED_SHOT, 3, 12, 13),
                play(3, 1, "8:30", EventMsgType.REBOUND, 4, 5, 14),
                play(4, 1, "8:00", EventMsgType.TURNOVER, 15, null, null),
                sub(5, 1, "5:00", 5, 6),
                play(6, 1, "2:00", EventMsgType.MADE_SHOT, 6, 1, null),
                periodEnd(7, 1)
        ));
    }

    private static Integer teamOf(Integer playerId) {
        if (playerId == null) return null;
        return playerId < 10 ? HOME : VISITOR;
    }

    // -------------------------------
    // CSV renderings
    // -------------------------------

    public static String pbpCsv(List<PlayByPlayEvent> events) {
        StringBuilder sb = new StringBuilder("game_id,eventnum,eventmsgtype,period,pctimestring,"
                + "player1_id,player1_team_id,player2_id,player2_team_id,player3_id,player3_team_id\n");
        for (PlayByPlayEvent e : events) {
            sb.append(e.gameId()).append(',')
                    .append(e.eventNum()).append(',')
                    .append(e.msgType()).append(',')
                    .append(e.period()).append(',')
                    .append(e.clock()).append(',')
                    .append(cell(e.player1Id())).append(',')
                    .append(cell(e.player1TeamId())).append(',')
                    .append(cell(e.player2Id())).append(',')
                    .append(cell(e.player2TeamId())).append(',')
                    .append(cell(e.player3Id())).append(',')
                    .append(cell(e.player3TeamId())).append('\n');
        }
        return sb.toString();
    }

    public static String boxScoreCsv(List<BoxScoreLine> lines) {
        StringBuilder sb = new StringBuilder("game_id,team_id,player_id\n");
        for (BoxScoreLine l : lines) {
            sb.append(l.gameId()).append(',').append(l.teamId()).append(',').append(l.playerId()).append('\n');
        }
        return sb.toString();
    }

    public static String gamesCsv(List<GameInfo> games) {
        StringBuilder sb = new StringBuilder("game_id,home_team_id,visitor_team_id\n");
        for (GameInfo g : games) {
            sb.append(g.gameId()).append(',').append(g.homeTeamId()).append(',').append(g.visitorTeamId()).append('\n');
        }
        return sb.toString();
    }

    private static String cell(Integer v) {
        return v == null ? "" : String.valueOf(v);
    }
}

package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.exception.InvalidRecordException;
import com.asad.lineup_tracker.exception.UnknownParticipantException;
import com.asad.lineup_tracker.exception.UnterminatedIntervalException;
import com.asad.lineup_tracker.model.EventMsgType;
import com.asad.lineup_tracker.model.PlayByPlayEvent;
import com.asad.lineup_tracker.model.PlayerTimeRecord;
import com.asad.lineup_tracker.model.Roster;
import com.asad.lineup_tracker.model.SequencedEvent;
import com.asad.lineup_tracker.model.SubstitutionInterval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Single forward pass over one game's sequenced events, tracking who is on the floor and
 * banking every player's time. One instance per game, driven from one thread.
 */
public class LineupStateMachine {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineupStateMachine.class);

    private final String gameId;
    private final Roster roster;

    private final Set<Integer> homeOnCourt = new LinkedHashSet<>();
    private final Set<Integer> visitorOnCourt = new LinkedHashSet<>();

    // roster order: home first, then visitor
    private final Map<Integer, PlayerTimeRecord> timeBank = new LinkedHashMap<>();

    private int period = 1;
    private boolean finished = false;

    public LineupStateMachine(String gameId, Roster roster) {
        this.gameId = gameId;
        this.roster = roster;
        for (int id : roster.home()) timeBank.put(id, new PlayerTimeRecord(id, roster.homeTeamId));
        for (int id : roster.visitor()) timeBank.putIfAbsent(id, new PlayerTimeRecord(id, roster.visitorTeamId));
    }

    /**
     * Feeds every event, in order, through a fresh machine. Call {@link #finish()} on the result.
     */
    public static LineupStateMachine run(String gameId, Roster roster, List<SequencedEvent> events) {
        LineupStateMachine machine = new LineupStateMachine(gameId, roster);
        for (SequencedEvent e : events) machine.apply(e);
        return machine;
    }

    public void apply(SequencedEvent e) {
        if (finished) throw new IllegalStateException("game " + gameId + " already finished");

        int type = e.msgType();
        if (EventMsgType.isSubstitution(type)) {
            substitute(e);
        } else if (EventMsgType.isPeriodEnd(type)) {
            endPeriod(e);
        } else if (EventMsgType.isPlay(type)) {
            discoverParticipants(e);
        }
        // everything else (fouls, timeouts, jump balls, ...) leaves the lineup alone
    }

    private void substitute(SequencedEvent e) {
        PlayByPlayEvent ev = e.event();
        if (roster.isTeamOrEmptySlot(ev.player1Id()) || roster.isTeamOrEmptySlot(ev.player2Id())) {
            throw new InvalidRecordException(gameId,
                    "Substitution at event " + ev.eventNum() + " needs both an outgoing and an incoming player");
        }

        int outId = ev.player1Id();
        int inId = ev.player2Id();
        PlayerTimeRecord out = recordOf(outId, ev.eventNum());
        PlayerTimeRecord in = recordOf(inId, ev.eventNum());

        int teamId = substitutionTeam(ev, outId, inId);
        Set<Integer> five = onCourtFor(teamId);
        five.remove(outId);
        five.add(inId);

        double t = e.gameTimeRemaining();
        double accrued = out.checkOut(t, e.maxPeriodTime(), period);
        in.checkIn(t);

        LOGGER.debug("Game {} event {}: subbing {} in for {} (team {}, {}s banked)",
                gameId, ev.eventNum(), inId, outId, teamId, accrued);
    }

    private void endPeriod(SequencedEvent e) {
        double t = e.gameTimeRemaining();

        List<Integer> onCourt = new ArrayList<>(homeOnCourt);
        onCourt.addAll(visitorOnCourt);

        for (int id : onCourt) {
            PlayerTimeRecord r = timeBank.get(id);
            if (!r.isOnCourt()) {
                throw new InvalidRecordException(gameId,
                        "Player " + id + " is on the floor without a check-in at event " + e.eventNum());
            }
            r.checkOut(t, e.maxPeriodTime(), period);
        }

        LOGGER.debug("Game {} event {}: end of period {}, closed {} stints",
                gameId, e.eventNum(), period, onCourt.size());

        homeOnCourt.clear();
        visitorOnCourt.clear();
        period++;
    }

    // The log never lists who opens a period, so a player's first action in a period
    // checks them in as of the period start.
    private void discoverParticipants(SequencedEvent e) {
        for (int id : e.event().participantIds()) {
            if (roster.isTeamOrEmptySlot(id)) continue;
            Integer teamId = roster.teamOf(id);
            if (teamId == null) throw new UnknownParticipantException(gameId, id, e.eventNum());

            if (onCourtFor(teamId).add(id)) {
                timeBank.get(id).checkIn(e.maxPeriodTime());
            }
        }
    }

    /**
     * Closes out the pass. Every player must have as many check-outs as check-ins.
     */
    public List<SubstitutionInterval> finish() {
        finished = true;

        List<SubstitutionInterval> intervals = new ArrayList<>();
        for (PlayerTimeRecord r : timeBank.values()) {
            if (!r.isBalanced()) {
                throw new UnterminatedIntervalException(gameId, r.playerId, r.timeIns().size(), r.timeOuts().size());
            }
            intervals.addAll(r.toIntervals());
        }
        return intervals;
    }

    // The roster decides the side; a team tag that disagrees with it is only logged.
    private int substitutionTeam(PlayByPlayEvent ev, int outId, int inId) {
        int teamId = roster.teamOf(outId);
        if (roster.teamOf(inId) != teamId) {
            throw new InvalidRecordException(gameId, "Substitution at event " + ev.eventNum()
                    + " swaps player " + outId + " for player " + inId + " of the other team");
        }
        Integer tag = ev.player1TeamId();
        if (tag != null && tag != teamId) {
            LOGGER.warn("Game {} event {}: substitution tagged team {} but player {} is rostered on team {}",
                    gameId, ev.eventNum(), tag, outId, teamId);
        }
        return teamId;
    }

    private PlayerTimeRecord recordOf(int playerId, int eventNum) {
        PlayerTimeRecord r = timeBank.get(playerId);
        if (r == null) throw new UnknownParticipantException(gameId, playerId, eventNum);
        return r;
    }

    private Set<Integer> onCourtFor(int teamId) {
        return teamId == roster.homeTeamId ? homeOnCourt : visitorOnCourt;
    }

    public Set<Integer> onCourt(int teamId) {
        return Collections.unmodifiableSet(onCourtFor(teamId));
    }

    public PlayerTimeRecord record(int playerId) {
        return timeBank.get(playerId);
    }

    public int currentPeriod() {
        return period;
    }

    /**
     * Seconds accrued per player, in roster order.
     */
    public Map<Integer, Double> playingTime() {
        Map<Integer, Double> out = new LinkedHashMap<>();
        for (PlayerTimeRecord r : timeBank.values()) out.put(r.playerId, r.playingTime());
        return out;
    }
}

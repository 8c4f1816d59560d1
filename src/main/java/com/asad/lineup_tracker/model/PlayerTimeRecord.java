package com.asad.lineup_tracker.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Time bank for one player. timeIns and timeOuts are parallel; while the player is on the
 * floor timeIns holds exactly one more entry than timeOuts.
 */
public class PlayerTimeRecord {

    public final int playerId;
    public final int teamId;

    private double playingTime = 0;
    private CourtStatus status = CourtStatus.offCourt();

    private final List<Double> timeIns = new ArrayList<>();
    private final List<Double> timeOuts = new ArrayList<>();
    private final List<Integer> periods = new ArrayList<>();

    public PlayerTimeRecord(int playerId, int teamId) {
        this.playerId = playerId;
        this.teamId = teamId;
    }

    public void checkIn(double gameTimeRemaining) {
        status = CourtStatus.onCourt(gameTimeRemaining);
        timeIns.add(gameTimeRemaining);
    }

    /**
     * Closes the current stint. A player with no recorded check-in has been on the floor
     * since the period opened, so the stint is backdated to maxPeriodTime.
     *
     * @return seconds accrued by this stint
     */
    public double checkOut(double gameTimeRemaining, double maxPeriodTime, int period) {
        double accrued;
        if (status instanceof CourtStatus.OnCourt on) {
            accrued = on.since - gameTimeRemaining;
        } else {
            accrued = maxPeriodTime - gameTimeRemaining;
            timeIns.add(maxPeriodTime);
        }

        playingTime += accrued;
        status = CourtStatus.offCourt();
        timeOuts.add(gameTimeRemaining);
        periods.add(period);
        return accrued;
    }

    public boolean isOnCourt() {
        return status.isOnCourt();
    }

    public CourtStatus status() {
        return status;
    }

    public double playingTime() {
        return playingTime;
    }

    public boolean isBalanced() {
        return timeIns.size() == timeOuts.size();
    }

    public List<Double> timeIns() {
        return List.copyOf(timeIns);
    }

    public List<Double> timeOuts() {
        return List.copyOf(timeOuts);
    }

    public List<Integer> periods() {
        return List.copyOf(periods);
    }

    /**
     * Pairs check-ins with check-outs. Only valid once the record is balanced.
     */
    public List<SubstitutionInterval> toIntervals() {
        if (!isBalanced()) {
            throw new IllegalStateException("player " + playerId + " has " + timeIns.size()
                    + " check-ins but " + timeOuts.size() + " check-outs");
        }
        List<SubstitutionInterval> out = new ArrayList<>(timeIns.size());
        for (int i = 0; i < timeIns.size(); i++) {
            out.add(new SubstitutionInterval(playerId, teamId, timeIns.get(i), timeOuts.get(i), periods.get(i)));
        }
        return out;
    }
}

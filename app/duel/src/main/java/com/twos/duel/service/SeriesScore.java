package com.twos.duel.service;

import com.twos.duel.model.MatchRecord;

public record SeriesScore(int winsA, int winsB, int draws, int gamesPlayed, int gamesPlanned) {

    public static SeriesScore of(MatchRecord match) {
        return new SeriesScore(
                match.winsA(), match.winsB(), match.draws(), match.gamesPlayed(), match.gamesPlanned());
    }
}

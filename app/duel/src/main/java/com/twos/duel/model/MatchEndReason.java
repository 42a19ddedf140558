package com.twos.duel.model;

public enum MatchEndReason {
    ALL_ROUNDS_PLAYED,
    FORFEIT,
    ABANDONED
}

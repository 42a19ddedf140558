package com.twos.duel.model;

public enum MatchStatus {
    IN_PROGRESS,
    COMPLETED,
    ABANDONED
}

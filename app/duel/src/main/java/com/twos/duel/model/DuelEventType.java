package com.twos.duel.model;

public enum DuelEventType {
    OPPONENT_FOUND,
    CONFIRMATION_REQUIRED,
    CONFIRMATION_EXPIRED,
    ROUND_STARTED,
    ROUND_RESULT,
    OPPONENT_FORFEITED,
    SERIES_COMPLETED
}

package com.twos.duel.model;

// いずれも total_deals を 1 増やし、DUEL_COMPLETED のみ completed_deals も増やす
public enum ReliabilityEvent {
    MISSED_CONFIRMATION,
    DUEL_COMPLETED,
    DROPPED_BEFORE_MIN_GAMES
}

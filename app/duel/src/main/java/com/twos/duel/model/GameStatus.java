package com.twos.duel.model;

public enum GameStatus {
    AWAITING_SUBMISSIONS,
    FINISHED
}

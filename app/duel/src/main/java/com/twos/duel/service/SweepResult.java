package com.twos.duel.service;

/** 1 回の掃除で処理した件数。 */
public record SweepResult(int confirmationsExpired, int roundsResolved, int failures) {

    public boolean isEmpty() {
        return confirmationsExpired == 0 && roundsResolved == 0 && failures == 0;
    }
}

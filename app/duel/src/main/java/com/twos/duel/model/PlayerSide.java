package com.twos.duel.model;

public enum PlayerSide {
    A,
    B;

    public PlayerSide opponent() {
        return this == A ? B : A;
    }
}

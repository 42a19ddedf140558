package com.twos.duel.fairness;

public record PlayerNumber(String playerId, int number) {}

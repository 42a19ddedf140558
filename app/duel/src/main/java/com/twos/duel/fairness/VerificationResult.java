package com.twos.duel.fairness;

public record VerificationResult(
    boolean valid, int randomNumber, int distanceA, int distanceB, int winnerIndex, boolean draw) {}

package com.twos.duel.api;

public class InsufficientBalanceException extends RuntimeException {

    public InsufficientBalanceException(String userId, long requiredPoints) {
        super("insufficient balance userId=" + userId + " required=" + requiredPoints);
    }
}

package com.twos.duel.api;

public class ConcurrentStateChangeException extends DuelStateConflictException {

    public ConcurrentStateChangeException(String detail) {
        super(ApiErrorCode.CONCURRENT_UPDATE, "state changed concurrently: " + detail);
    }
}

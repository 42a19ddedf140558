package com.twos.duel.api;

public class SelfJoinException extends DuelStateConflictException {

    public SelfJoinException(String detail) {
        super(ApiErrorCode.SELF_JOIN, "cannot join own order: " + detail);
    }
}

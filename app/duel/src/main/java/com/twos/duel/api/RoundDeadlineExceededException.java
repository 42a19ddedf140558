package com.twos.duel.api;

public class RoundDeadlineExceededException extends DuelStateConflictException {

    public RoundDeadlineExceededException(String detail) {
        super(ApiErrorCode.ROUND_DEADLINE_EXCEEDED, "round deadline has passed: " + detail);
    }
}

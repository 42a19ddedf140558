package com.twos.duel.api;

public class AlreadySubmittedException extends DuelStateConflictException {

    public AlreadySubmittedException(String detail) {
        super(ApiErrorCode.ALREADY_SUBMITTED, "number already submitted for this round: " + detail);
    }
}

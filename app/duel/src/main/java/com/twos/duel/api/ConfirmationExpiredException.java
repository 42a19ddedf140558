package com.twos.duel.api;

public class ConfirmationExpiredException extends DuelStateConflictException {

    public ConfirmationExpiredException(String detail) {
        super(ApiErrorCode.CONFIRMATION_EXPIRED, "confirmation deadline has passed: " + detail);
    }
}

package com.twos.duel.api;

public class OrderNotAvailableException extends DuelStateConflictException {

    public OrderNotAvailableException(String detail) {
        super(ApiErrorCode.ORDER_NOT_AVAILABLE, "order is not open for joining: " + detail);
    }
}

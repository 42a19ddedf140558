/*
 * どこで: Duel API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.twos.duel.api;

public enum ApiErrorCode {
    BAD_REQUEST,
    VERIFICATION_FAILED,
    NOT_FOUND,
    FORBIDDEN,
    INSUFFICIENT_BALANCE,
    ORDER_NOT_AVAILABLE,
    SELF_JOIN,
    ORDER_STATE_CONFLICT,
    CONFIRMATION_EXPIRED,
    ROUND_NOT_OPEN,
    ALREADY_SUBMITTED,
    ROUND_DEADLINE_EXCEEDED,
    CONCURRENT_UPDATE,
    INTERNAL_ERROR
}

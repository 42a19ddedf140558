/*
 * どこで: Duel API
 * 何を: 状態遷移の衝突(409)を表す例外を定義する
 * なぜ: 注文/ラウンドの現在状態では受け付けられない操作をコード付きで返すため
 */
package com.twos.duel.api;

public class DuelStateConflictException extends RuntimeException {

    private final ApiErrorCode code;

    public DuelStateConflictException(ApiErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ApiErrorCode code() {
        return code;
    }
}

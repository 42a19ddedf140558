/*
 * どこで: Duel API
 * 何を: 入力値の検証エラー(400)を表す例外を定義する
 * なぜ: 状態を変更する前に不正な入力を弾いたことを明示するため
 */
package com.twos.duel.api;

public class InvalidDuelRequestException extends RuntimeException {

    public InvalidDuelRequestException(String message) {
        super(message);
    }
}

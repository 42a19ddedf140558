package com.twos.duel.api;

// 検証用の seed_slice が 8 桁の 16 進数でない場合の例外
public class SeedSliceFormatException extends RuntimeException {

    public SeedSliceFormatException(String message) {
        super(message);
    }
}

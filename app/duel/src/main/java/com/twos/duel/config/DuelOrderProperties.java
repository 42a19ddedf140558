/*
 * どこで: Duel アプリの設定バインド
 * 何を: 注文の確認期限と試合数の範囲を保持する
 * なぜ: 確認待ちの期限や失効回数を環境ごとに調整できるようにするため
 */
package com.twos.duel.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "duel.order")
public record DuelOrderProperties(
        @NotNull Duration confirmationTimeout,
        @Min(1) int maxMissedConfirmations,
        @Min(2) int minGamesPlanned,
        @Min(2) int maxGamesPlanned,
        @Min(1) int listLimit) {
}

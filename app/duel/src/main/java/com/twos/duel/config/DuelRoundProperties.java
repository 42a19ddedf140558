/*
 * どこで: Duel アプリの設定バインド
 * 何を: ラウンドの上限時間と初回提出後の入力猶予を保持する
 * なぜ: 片側だけ提出したラウンドを短時間で確定させるため
 */
package com.twos.duel.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "duel.round")
public record DuelRoundProperties(@NotNull Duration ceiling, @NotNull Duration submissionWindow) {
}

/*
 * どこで: Duel アプリの設定バインド
 * 何を: 対戦通知の publish 先 subject と JetStream stream 設定を保持する
 * なぜ: publish と重複排除の前提となる stream を環境で揃えるため
 */
package com.twos.duel.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "duel.nats")
public record DuelNatsProperties(
        @NotBlank String subject,
        @NotBlank String stream,
        @NotNull Duration duplicateWindow) {

    // イベント種別ごとに subject を分け、購読側が必要な種別だけ受け取れるようにする
    public String subjectFor(String eventType) {
        return subject + "." + eventType.toLowerCase(Locale.ROOT);
    }

    public String subjectWildcard() {
        return subject + ".>";
    }
}

/*
 * どこで: Duel アプリの設定バインド
 * 何を: 公平性エンジンの HMAC 鍵を保持する
 * なぜ: 鍵が未設定のまま起動して推測可能な乱数を出すことを起動時に防ぐため
 */
package com.twos.duel.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "duel.fairness")
public record FairnessProperties(
        @NotBlank(message = "duel.fairness.platform-secret must be set")
        @Size(min = 16, message = "duel.fairness.platform-secret must be at least 16 characters")
        String platformSecret) {

    @Override
    public String toString() {
        return "FairnessProperties[platformSecret=***]";
    }
}

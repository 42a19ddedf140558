/*
 * どこで: Duel アプリの設定バインド
 * 何を: 期限切れ掃除ワーカーのポーリング設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.twos.duel.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "duel.sweep")
public record DuelSweepProperties(boolean enabled, Duration pollInterval, int batchSize) {}

package com.twos.duel.config;

import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

// 初回登録時に付与するポイント。0 なら付与も台帳記録も行わない。
@Validated
@ConfigurationProperties(prefix = "duel.account")
public record DuelAccountProperties(@PositiveOrZero long initialBalance) {}

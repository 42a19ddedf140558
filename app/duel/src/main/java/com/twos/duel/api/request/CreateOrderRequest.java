/*
 * どこで: Duel API
 * 何を: 注文作成リクエストの入力を保持する
 * なぜ: JSON からのバインドと検証を明確にするため
 */
package com.twos.duel.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateOrderRequest(
    @NotBlank(message = "chip_type is required") String chipType,
    @NotNull(message = "games_planned is required") Integer gamesPlanned) {}

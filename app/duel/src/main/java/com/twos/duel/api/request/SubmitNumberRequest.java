package com.twos.duel.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;

// player_number の範囲は公平性エンジン側で検証する
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubmitNumberRequest(
    @NotNull(message = "round_number is required") Integer roundNumber,
    @NotNull(message = "player_number is required") Integer playerNumber) {}

/*
 * どこで: Duel API
 * 何を: 1 ラウンドの提出状況と確定結果を返す
 * なぜ: 確定前は提出値を伏せ、確定後は検証に必要な値をすべて公開するため
 */
package com.twos.duel.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.twos.duel.model.GameOutcome;
import com.twos.duel.model.GameStatus;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoundResponse(
    int roundNumber,
    GameStatus status,
    Instant deadline,
    @JsonProperty("player_a_submitted") boolean playerASubmitted,
    @JsonProperty("player_b_submitted") boolean playerBSubmitted,
    @JsonProperty("player_a_number") Integer playerANumber,
    @JsonProperty("player_b_number") Integer playerBNumber,
    GameOutcome outcome,
    String winnerId,
    Long timeSlot,
    String seedSlice,
    Integer randomNumber,
    Integer distanceA,
    Integer distanceB,
    String formula,
    Instant finishedAt) {}

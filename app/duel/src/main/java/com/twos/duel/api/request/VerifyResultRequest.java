package com.twos.duel.api.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record VerifyResultRequest(
    @NotBlank(message = "seed_slice is required") String seedSlice,
    @JsonProperty("player_a_number") @NotNull(message = "player_a_number is required") Integer playerANumber,
    @JsonProperty("player_b_number") @NotNull(message = "player_b_number is required") Integer playerBNumber,
    @NotNull(message = "claimed_winner_index is required") Integer claimedWinnerIndex) {}

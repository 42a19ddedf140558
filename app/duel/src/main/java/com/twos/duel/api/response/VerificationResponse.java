package com.twos.duel.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record VerificationResponse(
    boolean valid,
    int randomNumber,
    int distanceA,
    int distanceB,
    int winnerIndex,
    boolean draw,
    String formula) {}

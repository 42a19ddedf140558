package com.twos.duel.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PointsGrantRequest(
    String username,
    @NotNull(message = "amount is required") @Positive(message = "amount must be positive")
        Long amount,
    @NotBlank(message = "reason is required")
        @Size(max = 256, message = "reason must be at most 256 characters")
        String reason) {}

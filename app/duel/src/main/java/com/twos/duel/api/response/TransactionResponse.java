package com.twos.duel.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.twos.duel.model.TransactionType;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TransactionResponse(
    UUID transactionId,
    TransactionType type,
    long amountPoints,
    UUID relatedOrderId,
    UUID relatedMatchId,
    String description,
    Instant createdAt) {}

/*
 * どこで: Duel API
 * 何を: 注文の状態と作成者の信頼度を返す
 * なぜ: 参加前に賭け額と相手の信頼度を一度に確認できるようにするため
 */
package com.twos.duel.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.twos.duel.model.ChipType;
import com.twos.duel.model.OrderStatus;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderResponse(
    UUID orderId,
    String ownerId,
    ChipType chipType,
    long stakePerGame,
    int gamesPlanned,
    long totalStake,
    OrderStatus status,
    String opponentId,
    Instant confirmationDeadline,
    int missedConfirmations,
    UUID matchId,
    Instant createdAt,
    Instant updatedAt,
    ReliabilityResponse ownerReliability) {}

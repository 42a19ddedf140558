/*
 * どこで: Duel API
 * 何を: 利用者の信頼度指標と段階評価を返す
 * なぜ: 対戦相手を選ぶ前に約束を守る相手かを判断できるようにするため
 */
package com.twos.duel.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.twos.duel.model.ReliabilityRank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReliabilityResponse(
    String userId,
    String username,
    int totalDeals,
    int completedDeals,
    int missedConfirmations,
    int droppedBeforeMinGames,
    double reliabilityCoefficient,
    int reliabilityPercent,
    ReliabilityRank rank,
    boolean warning) {}

package com.twos.duel.api.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.twos.duel.model.MatchEndReason;
import com.twos.duel.model.MatchStatus;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchResponse(
    UUID matchId,
    UUID orderId,
    @JsonProperty("player_a_id") String playerAId,
    @JsonProperty("player_b_id") String playerBId,
    long stakePerGame,
    int gamesPlanned,
    int gamesPlayed,
    int winsA,
    int winsB,
    int draws,
    MatchStatus status,
    String winnerId,
    MatchEndReason endReason,
    Instant completedAt,
    List<RoundResponse> rounds) {}

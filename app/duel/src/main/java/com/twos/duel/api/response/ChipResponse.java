package com.twos.duel.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ChipResponse(
    String chipType, long pointsPerGame, int minGamesPlanned, int maxGamesPlanned) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Catalogue(List<ChipResponse> items) {}
}

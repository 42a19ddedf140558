package com.twos.duel.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.twos.duel.api.response.ReliabilityResponse;
import com.twos.duel.model.ReliabilityRank;
import com.twos.duel.service.ReliabilityTracker;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ReliabilityController.class)
@Import(ApiExceptionHandler.class)
@ActiveProfiles("test")
class ReliabilityControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private ReliabilityTracker reliabilityTracker;

  @Test
  void getReturnsSnapshotWithWarning() throws Exception {
    when(reliabilityTracker.snapshot("carol"))
        .thenReturn(
            new ReliabilityResponse(
                "carol", "Carol", 10, 2, 6, 2, 0.2d, 20, ReliabilityRank.UNRELIABLE, true));

    mockMvc
        .perform(get("/v1/users/{user_id}/reliability", "carol"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.reliability_percent").value(20))
        .andExpect(jsonPath("$.rank").value("UNRELIABLE"))
        .andExpect(jsonPath("$.warning").value(true));
  }

  @Test
  void leaderboardUsesDefaultLimit() throws Exception {
    when(reliabilityTracker.leaderboard(20))
        .thenReturn(
            List.of(
                new ReliabilityResponse(
                    "alice", "Alice", 4, 4, 0, 0, 1.0d, 100, ReliabilityRank.TRUSTED, false)));

    mockMvc
        .perform(get("/v1/reliability/leaderboard"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items[0].user_id").value("alice"));
  }

  @Test
  void leaderboardRejectsOutOfRangeLimit() throws Exception {
    when(reliabilityTracker.leaderboard(0))
        .thenThrow(new InvalidDuelRequestException("limit must be between 1 and 100"));

    mockMvc
        .perform(get("/v1/reliability/leaderboard").param("limit", "0"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("limit must be between 1 and 100"));
  }

  @Test
  void getReturnsNotFoundForUnknownUser() throws Exception {
    when(reliabilityTracker.snapshot("ghost"))
        .thenThrow(new DuelResourceNotFoundException("user", "ghost"));

    mockMvc
        .perform(get("/v1/users/{user_id}/reliability", "ghost"))
        .andExpect(status().isNotFound());
  }
}

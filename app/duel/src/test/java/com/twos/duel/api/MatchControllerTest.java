package com.twos.duel.api;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.twos.duel.api.response.MatchResponse;
import com.twos.duel.api.response.RoundResponse;
import com.twos.duel.api.response.SubmissionResponse;
import com.twos.duel.model.GameStatus;
import com.twos.duel.model.MatchStatus;
import com.twos.duel.service.MatchOrchestrator;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(MatchController.class)
@Import(ApiExceptionHandler.class)
@ActiveProfiles("test")
class MatchControllerTest {

  private static final UUID MATCH_ID = UUID.fromString("22222222-2222-2222-2222-222222222222");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private MatchOrchestrator matchOrchestrator;

  @Test
  void submitReturnsSubmissionState() throws Exception {
    when(matchOrchestrator.submitPlayerNumber(MATCH_ID, 1, "alice", 123456))
        .thenReturn(new SubmissionResponse(true, false, 123456));

    mockMvc
        .perform(
            post("/v1/matches/{match_id}/submissions", MATCH_ID)
                .header("X-User-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"round_number": 1, "player_number": 123456}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.submitted").value(true))
        .andExpect(jsonPath("$.both_ready").value(false))
        .andExpect(jsonPath("$.my_number").value(123456));
  }

  @Test
  void submitReturnsBadRequestWhenNumberMissing() throws Exception {
    mockMvc
        .perform(
            post("/v1/matches/{match_id}/submissions", MATCH_ID)
                .header("X-User-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"round_number": 1}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("player_number is required"));
    verifyNoInteractions(matchOrchestrator);
  }

  @Test
  void submitReturnsConflictWhenAlreadySubmitted() throws Exception {
    when(matchOrchestrator.submitPlayerNumber(MATCH_ID, 1, "alice", 5))
        .thenThrow(new AlreadySubmittedException(MATCH_ID + "/1"));

    mockMvc
        .perform(
            post("/v1/matches/{match_id}/submissions", MATCH_ID)
                .header("X-User-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"round_number": 1, "player_number": 5}
                    """))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("ALREADY_SUBMITTED"));
  }

  @Test
  void submitReturnsBadRequestWhenNumberOutOfRange() throws Exception {
    when(matchOrchestrator.submitPlayerNumber(MATCH_ID, 1, "alice", 1_000_000))
        .thenThrow(new InvalidDuelRequestException("player_number must be between 0 and 999999"));

    mockMvc
        .perform(
            post("/v1/matches/{match_id}/submissions", MATCH_ID)
                .header("X-User-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"round_number": 1, "player_number": 1000000}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
  }

  @Test
  void getOmitsNumbersOfOpenRound() throws Exception {
    final Instant deadline = Instant.parse("2026-03-01T12:05:00Z");
    final RoundResponse open =
        new RoundResponse(
            1,
            GameStatus.AWAITING_SUBMISSIONS,
            deadline,
            true,
            false,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null);
    when(matchOrchestrator.getMatch(MATCH_ID))
        .thenReturn(
            new MatchResponse(
                MATCH_ID,
                UUID.randomUUID(),
                "alice",
                "bob",
                10L,
                3,
                0,
                0,
                0,
                0,
                MatchStatus.IN_PROGRESS,
                null,
                null,
                null,
                List.of(open)));

    mockMvc
        .perform(get("/v1/matches/{match_id}", MATCH_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.player_a_id").value("alice"))
        .andExpect(jsonPath("$.rounds[0].player_a_submitted").value(true))
        .andExpect(jsonPath("$.rounds[0].player_a_number").doesNotExist())
        .andExpect(jsonPath("$.rounds[0].seed_slice").doesNotExist());
  }
}

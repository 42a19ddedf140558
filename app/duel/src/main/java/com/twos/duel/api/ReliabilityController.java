package com.twos.duel.api;

import com.twos.duel.api.response.LeaderboardResponse;
import com.twos.duel.api.response.ReliabilityResponse;
import com.twos.duel.service.ReliabilityTracker;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class ReliabilityController {

    private final ReliabilityTracker reliabilityTracker;

    @GetMapping("/users/{user_id}/reliability")
    public ReliabilityResponse get(
            @PathVariable("user_id") @NotBlank(message = "user_id is required") String userId) {
        return reliabilityTracker.snapshot(userId);
    }

    @GetMapping("/reliability/leaderboard")
    public LeaderboardResponse leaderboard(@RequestParam(value = "limit", defaultValue = "20") int limit) {
        return new LeaderboardResponse(reliabilityTracker.leaderboard(limit));
    }
}

/*
 * どこで: Duel API
 * 何を: 試合の参照とラウンドへの数値提出のエンドポイントを提供する
 * なぜ: 参加者がラウンドを進め、結果を確認できるようにするため
 */
package com.twos.duel.api;

import com.twos.duel.api.request.SubmitNumberRequest;
import com.twos.duel.api.response.MatchResponse;
import com.twos.duel.api.response.SubmissionResponse;
import com.twos.duel.service.MatchOrchestrator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/matches")
@RequiredArgsConstructor
@Validated
public class MatchController {

    private final MatchOrchestrator matchOrchestrator;

    @GetMapping("/{match_id}")
    public MatchResponse get(@PathVariable("match_id") UUID matchId) {
        return matchOrchestrator.getMatch(matchId);
    }

    @PostMapping("/{match_id}/submissions")
    public SubmissionResponse submit(
            @PathVariable("match_id") UUID matchId,
            @RequestHeader(OrderController.HEADER_USER_ID)
            @NotBlank(message = "X-User-Id is required")
            String userId,
            @Valid @RequestBody SubmitNumberRequest request) {
        return matchOrchestrator.submitPlayerNumber(
                matchId, request.roundNumber(), userId, request.playerNumber());
    }
}

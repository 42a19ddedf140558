/*
 * どこで: Duel API
 * 何を: 公開済みの seed_slice からラウンド結果を検証するエンドポイントを提供する
 * なぜ: 鍵を持たない第三者でも勝敗を再計算できるようにするため
 */
package com.twos.duel.api;

import com.twos.duel.api.request.VerifyResultRequest;
import com.twos.duel.api.response.VerificationResponse;
import com.twos.duel.fairness.FairnessEngine;
import com.twos.duel.fairness.VerificationResult;
import jakarta.validation.Valid;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/fairness")
@RequiredArgsConstructor
public class FairnessController {

  private final FairnessEngine fairnessEngine;

  @PostMapping("/verifications")
  public VerificationResponse verify(@Valid @RequestBody VerifyResultRequest request) {
    final VerificationResult result =
        fairnessEngine.verifyResult(
            request.seedSlice(),
            request.playerANumber(),
            request.playerBNumber(),
            request.claimedWinnerIndex());
    return new VerificationResponse(
        result.valid(),
        result.randomNumber(),
        result.distanceA(),
        result.distanceB(),
        result.winnerIndex(),
        result.draw(),
        FairnessEngine.formula(
            request.seedSlice().toLowerCase(Locale.ROOT),
            result.randomNumber(),
            request.playerANumber(),
            result.distanceA(),
            request.playerBNumber(),
            result.distanceB()));
  }
}

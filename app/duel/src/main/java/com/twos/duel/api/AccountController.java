/*
 * どこで: Duel API
 * 何を: ポイント残高・台帳の参照と、取引所連携からのポイント付与を提供する
 * なぜ: 拘束/返却/配当の履歴を利用者と運用が追えるようにするため
 */
package com.twos.duel.api;

import com.twos.duel.api.request.PointsGrantRequest;
import com.twos.duel.api.response.AccountResponse;
import com.twos.duel.api.response.TransactionsResponse;
import com.twos.duel.service.PointsLedgerService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class AccountController {

    private final PointsLedgerService pointsLedgerService;

    @GetMapping("/users/{user_id}/account")
    public AccountResponse account(
            @PathVariable("user_id") @NotBlank(message = "user_id is required") String userId) {
        return pointsLedgerService.account(userId);
    }

    @GetMapping("/users/{user_id}/transactions")
    public TransactionsResponse transactions(
            @PathVariable("user_id") @NotBlank(message = "user_id is required") String userId,
            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        return pointsLedgerService.listTransactions(userId, limit);
    }

    // 取引所側の連携サービスからのみ呼ばれる想定 (経路の保護はゲートウェイ側)
    @PostMapping("/internal/users/{user_id}/points-grants")
    public AccountResponse grantPoints(
            @PathVariable("user_id") @NotBlank(message = "user_id is required") String userId,
            @Valid @RequestBody PointsGrantRequest request) {
        return pointsLedgerService.grantPoints(userId, request);
    }
}

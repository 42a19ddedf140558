/*
 * どこで: Duel API
 * 何を: チップ一覧と注文の作成/参加/確認/取消/参照のエンドポイントを提供する
 * なぜ: 注文の状態遷移をクライアントから操作できるようにするため
 */
package com.twos.duel.api;

import com.twos.duel.api.request.CreateOrderRequest;
import com.twos.duel.api.response.ChipResponse;
import com.twos.duel.api.response.ConfirmOrderResponse;
import com.twos.duel.api.response.OrderResponse;
import com.twos.duel.api.response.OrdersResponse;
import com.twos.duel.service.OrderMatchingService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class OrderController {

    static final String HEADER_USER_ID = "X-User-Id";
    static final String HEADER_USER_NAME = "X-User-Name";

    private final OrderMatchingService orderMatchingService;

    @GetMapping("/chips")
    public ChipResponse.Catalogue chips() {
        return orderMatchingService.chips();
    }

    @PostMapping("/orders")
    public ResponseEntity<OrderResponse> create(
            @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId,
            @RequestHeader(value = HEADER_USER_NAME, required = false) String username,
            @Valid @RequestBody CreateOrderRequest request) {
        OrderResponse response = orderMatchingService.create(userId, username, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/orders")
    public OrdersResponse listOpen() {
        return orderMatchingService.listOpen();
    }

    @GetMapping("/orders/{order_id}")
    public OrderResponse get(@PathVariable("order_id") UUID orderId) {
        return orderMatchingService.getOrder(orderId);
    }

    @GetMapping("/users/{user_id}/orders")
    public OrdersResponse listByUser(
            @PathVariable("user_id") @NotBlank(message = "user_id is required") String userId) {
        return orderMatchingService.listByParticipant(userId);
    }

    @PostMapping("/orders/{order_id}/join")
    public OrderResponse join(
            @PathVariable("order_id") UUID orderId,
            @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId,
            @RequestHeader(value = HEADER_USER_NAME, required = false) String username) {
        return orderMatchingService.join(orderId, userId, username);
    }

    @PostMapping("/orders/{order_id}/confirm")
    public ConfirmOrderResponse confirm(
            @PathVariable("order_id") UUID orderId,
            @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId) {
        return orderMatchingService.confirm(orderId, userId);
    }

    @DeleteMapping("/orders/{order_id}")
    public OrderResponse cancel(
            @PathVariable("order_id") UUID orderId,
            @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId) {
        return orderMatchingService.cancel(orderId, userId);
    }
}

/*
 * どこで: Duel サービス層
 * 何を: 注文の作成・参加・作成者確認・取消と確認期限切れの処理を担う
 * なぜ: 注文の状態遷移と賭けポイントの拘束/返却を同じトランザクションで行うため
 */
package com.twos.duel.service;

import com.twos.duel.api.ApiErrorCode;
import com.twos.duel.api.ConcurrentStateChangeException;
import com.twos.duel.api.ConfirmationExpiredException;
import com.twos.duel.api.DuelAccessDeniedException;
import com.twos.duel.api.DuelResourceNotFoundException;
import com.twos.duel.api.DuelStateConflictException;
import com.twos.duel.api.InvalidDuelRequestException;
import com.twos.duel.api.OrderNotAvailableException;
import com.twos.duel.api.SelfJoinException;
import com.twos.duel.api.request.CreateOrderRequest;
import com.twos.duel.api.response.ChipResponse;
import com.twos.duel.api.response.ConfirmOrderResponse;
import com.twos.duel.api.response.OrderResponse;
import com.twos.duel.api.response.OrdersResponse;
import com.twos.duel.api.response.ReliabilityResponse;
import com.twos.duel.config.DuelOrderProperties;
import com.twos.duel.model.ChipType;
import com.twos.duel.model.DuelEventType;
import com.twos.duel.model.OrderRecord;
import com.twos.duel.model.OrderStatus;
import com.twos.duel.model.ReliabilityEvent;
import com.twos.duel.model.TransactionType;
import com.twos.duel.repository.OrderRepository;
import com.twos.duel.repository.UserAccountRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class OrderMatchingService {

    private static final Logger logger = LoggerFactory.getLogger(OrderMatchingService.class);

    private final OrderRepository orderRepository;
    private final UserAccountRepository userAccountRepository;
    private final PointsLedgerService pointsLedgerService;
    private final ReliabilityTracker reliabilityTracker;
    private final MatchOrchestrator matchOrchestrator;
    private final DuelNotificationDispatcher notificationDispatcher;
    private final DuelMetrics metrics;
    private final DuelOrderProperties orderProperties;
    private final Clock clock;

    public ChipResponse.Catalogue chips() {
        return new ChipResponse.Catalogue(Arrays.stream(ChipType.values())
                .map(chip -> new ChipResponse(
                        chip.name(),
                        chip.pointsPerGame(),
                        orderProperties.minGamesPlanned(),
                        orderProperties.maxGamesPlanned()))
                .toList());
    }

    /**
     * 役割: 注文を作成し、作成者の賭けポイント (チップ額 x 試合数) を拘束する。
     * 動作: 残高不足の場合は注文も作られずに全体がロールバックされる。
     */
    @Transactional
    public OrderResponse create(String ownerId, String username, CreateOrderRequest request) {
        requireUserId(ownerId);
        ChipType chipType = parseChipType(request.chipType());
        int gamesPlanned = request.gamesPlanned();
        if (gamesPlanned < orderProperties.minGamesPlanned() || gamesPlanned > orderProperties.maxGamesPlanned()) {
            throw new InvalidDuelRequestException("games_planned must be between "
                    + orderProperties.minGamesPlanned() + " and " + orderProperties.maxGamesPlanned());
        }
        Instant now = Instant.now(clock);
        pointsLedgerService.ensureAccount(ownerId, username);
        OrderRecord order = orderRepository.insert(UUID.randomUUID(), ownerId, chipType, gamesPlanned, now);
        pointsLedgerService.debitStake(ownerId, order.totalStake(), order.orderId());
        metrics.recordOrderCommand("create", "success");
        logger.info("order created orderId={} ownerId={} chipType={} gamesPlanned={} totalStake={}",
                order.orderId(), ownerId, chipType, gamesPlanned, order.totalStake());
        return toResponse(order);
    }

    /**
     * 役割: OPEN の注文に参加し、作成者の確認待ちにする。
     * 動作: 条件付き UPDATE で参加者を確保するため、同時参加では 1 人だけが成功する。
     */
    @Transactional
    public OrderResponse join(UUID orderId, String joinerId, String username) {
        requireUserId(joinerId);
        OrderRecord order = orderRepository.findById(orderId)
                .orElseThrow(() -> new DuelResourceNotFoundException("order", orderId));
        if (order.status() != OrderStatus.OPEN) {
            metrics.recordOrderCommand("join", "not_available");
            throw new OrderNotAvailableException(orderId + " status=" + order.status());
        }
        if (order.ownerId().equals(joinerId)) {
            metrics.recordOrderCommand("join", "self_join");
            throw new SelfJoinException(orderId.toString());
        }
        pointsLedgerService.ensureAccount(joinerId, username);
        Instant now = Instant.now(clock);
        Instant deadline = now.plus(orderProperties.confirmationTimeout());
        OrderRecord reserved = orderRepository.reserveForJoin(orderId, joinerId, deadline, now)
                .orElseThrow(() -> {
                    metrics.recordOrderCommand("join", "lost_race");
                    return new OrderNotAvailableException(orderId.toString());
                });
        pointsLedgerService.debitStake(joinerId, reserved.totalStake(), orderId);
        notificationDispatcher.notify(DuelEventType.CONFIRMATION_REQUIRED, reserved.ownerId(), orderId, null, null,
                Map.of("opponent_id", joinerId, "confirmation_deadline", deadline.toString()));
        notificationDispatcher.notify(DuelEventType.OPPONENT_FOUND, joinerId, orderId, null, null,
                Map.of("owner_id", reserved.ownerId(), "confirmation_deadline", deadline.toString()));
        metrics.recordOrderCommand("join", "success");
        logger.info("order joined orderId={} ownerId={} joinerId={} confirmationDeadline={}",
                orderId, reserved.ownerId(), joinerId, deadline);
        return toResponse(reserved);
    }

    // 期限切れの場合は解放処理をコミットしてから 409 を返す
    @Transactional(noRollbackFor = ConfirmationExpiredException.class)
    public ConfirmOrderResponse confirm(UUID orderId, String ownerId) {
        requireUserId(ownerId);
        OrderRecord order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new DuelResourceNotFoundException("order", orderId));
        if (!order.ownerId().equals(ownerId)) {
            throw new DuelAccessDeniedException("only the order owner can confirm order " + orderId);
        }
        if (order.status() != OrderStatus.WAITING_CREATOR_CONFIRM) {
            throw new DuelStateConflictException(ApiErrorCode.ORDER_STATE_CONFLICT,
                    "order is not awaiting confirmation: " + orderId + " status=" + order.status());
        }
        Instant now = Instant.now(clock);
        if (!now.isBefore(order.confirmationDeadline())) {
            expireConfirmation(order, now);
            metrics.recordOrderCommand("confirm", "expired");
            throw new ConfirmationExpiredException(orderId.toString());
        }
        UUID matchId = UUID.randomUUID();
        OrderRecord matched = orderRepository.markMatched(orderId, matchId, now)
                .orElseThrow(() -> new ConcurrentStateChangeException("order " + orderId));
        matchOrchestrator.startSeries(matched, matchId, now);
        metrics.recordOrderCommand("confirm", "success");
        logger.info("order confirmed orderId={} matchId={}", orderId, matchId);
        OrderRecord current = orderRepository.findById(orderId)
                .orElseThrow(() -> new IllegalStateException("order vanished orderId=" + orderId));
        return new ConfirmOrderResponse(toResponse(current), matchOrchestrator.getMatch(matchId));
    }

    @Transactional
    public OrderResponse cancel(UUID orderId, String ownerId) {
        requireUserId(ownerId);
        OrderRecord order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new DuelResourceNotFoundException("order", orderId));
        if (!order.ownerId().equals(ownerId)) {
            throw new DuelAccessDeniedException("only the order owner can cancel order " + orderId);
        }
        if (order.status() != OrderStatus.OPEN) {
            throw new DuelStateConflictException(ApiErrorCode.ORDER_STATE_CONFLICT,
                    "only OPEN orders can be cancelled: " + orderId + " status=" + order.status());
        }
        Instant now = Instant.now(clock);
        OrderRecord cancelled = orderRepository.transition(orderId, OrderStatus.OPEN, OrderStatus.CANCELLED, now)
                .orElseThrow(() -> new ConcurrentStateChangeException("order " + orderId));
        pointsLedgerService.credit(ownerId, order.totalStake(), TransactionType.STAKE_REFUND, orderId, null,
                "order cancelled");
        metrics.recordOrderCommand("cancel", "success");
        logger.info("order cancelled orderId={} ownerId={} refunded={}", orderId, ownerId, order.totalStake());
        return toResponse(cancelled);
    }

    /**
     * 役割: 作成者の確認期限を過ぎた注文を解放する (タイムアウト掃除用)。
     * 動作: 他で処理中の行は飛ばし、ロック後に状態と期限を再確認する。処理しなかった場合は false。
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean expireConfirmationIfDue(UUID orderId, Instant now) {
        Optional<OrderRecord> locked = orderRepository.findByIdForUpdateSkipLocked(orderId);
        if (locked.isEmpty()) {
            return false;
        }
        OrderRecord order = locked.get();
        if (order.status() != OrderStatus.WAITING_CREATOR_CONFIRM
                || order.confirmationDeadline() == null
                || now.isBefore(order.confirmationDeadline())) {
            return false;
        }
        expireConfirmation(order, now);
        return true;
    }

    public OrderResponse getOrder(UUID orderId) {
        return orderRepository.findById(orderId)
                .map(this::toResponse)
                .orElseThrow(() -> new DuelResourceNotFoundException("order", orderId));
    }

    public OrdersResponse listOpen() {
        return new OrdersResponse(orderRepository.findOpen(orderProperties.listLimit()).stream()
                .map(this::toResponse)
                .toList());
    }

    public OrdersResponse listByParticipant(String userId) {
        return new OrdersResponse(orderRepository.findByParticipant(userId, orderProperties.listLimit()).stream()
                .map(this::toResponse)
                .toList());
    }

    // 参加者の拘束分を返し、作成者の確認漏れを記録する。上限回数に達した注文は失効させ作成者分も返す
    private void expireConfirmation(OrderRecord order, Instant now) {
        String joinerId = order.opponentId();
        boolean exhausted = order.missedConfirmations() + 1 >= orderProperties.maxMissedConfirmations();
        OrderStatus nextStatus = exhausted ? OrderStatus.EXPIRED : OrderStatus.OPEN;
        pointsLedgerService.lockAccounts(List.of(order.ownerId(), joinerId));
        OrderRecord released = orderRepository.releaseAfterMissedConfirmation(order.orderId(), nextStatus, now)
                .orElseThrow(() -> new ConcurrentStateChangeException("order " + order.orderId()));
        pointsLedgerService.credit(joinerId, order.totalStake(), TransactionType.STAKE_REFUND, order.orderId(), null,
                "creator missed confirmation");
        reliabilityTracker.record(order.ownerId(), ReliabilityEvent.MISSED_CONFIRMATION);
        if (exhausted) {
            pointsLedgerService.credit(order.ownerId(), order.totalStake(), TransactionType.STAKE_REFUND,
                    order.orderId(), null, "order expired after missed confirmations");
        }
        Map<String, Object> attributes = Map.of(
                "status", released.status().name(),
                "missed_confirmations", released.missedConfirmations());
        notificationDispatcher.notify(DuelEventType.CONFIRMATION_EXPIRED, joinerId, order.orderId(), null, null,
                attributes);
        notificationDispatcher.notify(DuelEventType.CONFIRMATION_EXPIRED, order.ownerId(), order.orderId(), null, null,
                attributes);
        metrics.recordTimeout("confirmation", nextStatus.name().toLowerCase(Locale.ROOT));
        logger.info("confirmation expired orderId={} ownerId={} joinerId={} missed={} nextStatus={}",
                order.orderId(), order.ownerId(), joinerId, released.missedConfirmations(), nextStatus);
    }

    private OrderResponse toResponse(OrderRecord order) {
        ReliabilityResponse ownerReliability = userAccountRepository.findById(order.ownerId())
                .map(ReliabilityTracker::toResponse)
                .orElse(null);
        return new OrderResponse(
                order.orderId(),
                order.ownerId(),
                order.chipType(),
                order.stakePerGame(),
                order.gamesPlanned(),
                order.totalStake(),
                order.status(),
                order.opponentId(),
                order.confirmationDeadline(),
                order.missedConfirmations(),
                order.matchId(),
                order.createdAt(),
                order.updatedAt(),
                ownerReliability);
    }

    private static ChipType parseChipType(String value) {
        try {
            return ChipType.fromValue(value);
        } catch (IllegalArgumentException ex) {
            throw new InvalidDuelRequestException(ex.getMessage());
        }
    }

    private static void requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new InvalidDuelRequestException("X-User-Id is required");
        }
    }
}

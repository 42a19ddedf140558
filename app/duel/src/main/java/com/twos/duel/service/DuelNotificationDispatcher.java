/*
 * どこで: Duel 通知
 * 何を: 対戦イベントを組み立て、トランザクション確定後に配信する
 * なぜ: ロールバックした状態変更を通知せず、配信の遅延や失敗で対戦処理を止めないため
 */
package com.twos.duel.service;

import com.google.common.annotations.VisibleForTesting;
import com.twos.common.TraceIds;
import com.twos.duel.model.DuelEvent;
import com.twos.duel.model.DuelEventType;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

@Component
@RequiredArgsConstructor
public class DuelNotificationDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(DuelNotificationDispatcher.class);

    private final DuelEventPublisher publisher;
    private final DuelMetrics metrics;
    private final Clock clock;

    public void notify(
            DuelEventType eventType,
            String recipientUserId,
            UUID orderId,
            UUID matchId,
            Integer roundNumber,
            Map<String, Object> attributes) {
        DuelEvent event = new DuelEvent(
                UUID.randomUUID().toString(),
                eventType,
                Instant.now(clock).toString(),
                recipientUserId,
                orderId == null ? null : orderId.toString(),
                matchId == null ? null : matchId.toString(),
                roundNumber,
                Collections.unmodifiableMap(new LinkedHashMap<>(attributes)),
                TraceIds.currentOrNew());
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            // コミット前に送ると、ロールバックされた遷移を利用者に見せてしまう
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    dispatch(event);
                }
            });
            return;
        }
        dispatch(event);
    }

    @VisibleForTesting
    void dispatch(DuelEvent event) {
        try {
            publisher.publish(event).whenComplete((ignored, ex) -> {
                if (ex != null) {
                    recordFailure(event, ex);
                }
            });
        } catch (RuntimeException ex) {
            recordFailure(event, ex);
        }
    }

    private void recordFailure(DuelEvent event, Throwable ex) {
        metrics.recordNotificationFailure(event.eventType().name());
        logger.warn("duel notification dropped eventId={} type={} recipient={}",
                event.eventId(),
                event.eventType(),
                event.recipientUserId(),
                ex);
    }
}

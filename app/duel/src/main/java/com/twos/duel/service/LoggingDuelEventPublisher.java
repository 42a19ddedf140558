/*
 * どこで: Duel 通知
 * 何を: NATS 無効時に対戦イベントをログへ出力する
 * なぜ: ローカル環境やテストで外部配信なしに通知内容を確認するため
 */
package com.twos.duel.service;

import com.twos.duel.model.DuelEvent;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class LoggingDuelEventPublisher implements DuelEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(LoggingDuelEventPublisher.class);

    @Override
    public CompletableFuture<Void> publish(DuelEvent event) {
        logger.info("duel event simulated publish eventId={} type={} recipient={} matchId={} round={}",
                event.eventId(),
                event.eventType(),
                event.recipientUserId(),
                event.matchId(),
                event.roundNumber());
        return CompletableFuture.completedFuture(null);
    }
}

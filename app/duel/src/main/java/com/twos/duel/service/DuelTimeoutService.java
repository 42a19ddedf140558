/*
 * どこで: Duel サービス層
 * 何を: 確認期限とラウンド締切を過ぎた行を拾い、1 件ずつ期限切れ処理を行う
 * なぜ: 利用者が再アクセスしなくても拘束ポイントの返却や不戦判定を進めるため
 */
package com.twos.duel.service;

import com.twos.duel.config.DuelSweepProperties;
import com.twos.duel.repository.GameRepository;
import com.twos.duel.repository.OrderRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class DuelTimeoutService {

    private static final Logger logger = LoggerFactory.getLogger(DuelTimeoutService.class);

    private final OrderRepository orderRepository;
    private final GameRepository gameRepository;
    private final OrderMatchingService orderMatchingService;
    private final MatchOrchestrator matchOrchestrator;
    private final DuelSweepProperties properties;
    private final DuelMetrics metrics;
    private final Clock clock;
    private final PlatformTransactionManager transactionManager;

    public SweepResult sweep() {
        long startedNanos = System.nanoTime();
        Instant now = Instant.now(clock);
        // 1 件ごとに別トランザクションにし、失敗した行が他の行の処理を巻き戻さないようにする
        TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
        int confirmations = 0;
        int rounds = 0;
        int failures = 0;
        for (UUID orderId : orderRepository.findDueConfirmationIds(now, properties.batchSize())) {
            try {
                Boolean expired = transactionTemplate.execute(
                        status -> orderMatchingService.expireConfirmationIfDue(orderId, now));
                if (Boolean.TRUE.equals(expired)) {
                    confirmations++;
                }
            } catch (RuntimeException ex) {
                failures++;
                metrics.recordTimeout("confirmation", "failed");
                logger.warn("confirmation timeout failed orderId={}", orderId, ex);
            }
        }
        for (UUID gameId : gameRepository.findDueIds(now, properties.batchSize())) {
            try {
                Boolean resolved = transactionTemplate.execute(
                        status -> matchOrchestrator.resolveRoundTimeoutIfDue(gameId, now));
                if (Boolean.TRUE.equals(resolved)) {
                    rounds++;
                }
            } catch (RuntimeException ex) {
                failures++;
                metrics.recordTimeout("round", "failed");
                logger.warn("round timeout failed gameId={}", gameId, ex);
            }
        }
        metrics.recordSweepDuration(Duration.ofNanos(System.nanoTime() - startedNanos));
        SweepResult result = new SweepResult(confirmations, rounds, failures);
        if (!result.isEmpty()) {
            logger.info("timeout sweep finished confirmationsExpired={} roundsResolved={} failures={}",
                    confirmations, rounds, failures);
        }
        return result;
    }
}

/*
 * どこで: 期限切れ掃除サービスのユニットテスト
 * 何を: 1 件ずつのトランザクション処理と失敗時の継続を検証する
 * なぜ: 1 件の失敗で残りの期限切れ処理が止まらないことを担保するため
 */
package com.twos.duel.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.twos.duel.config.DuelSweepProperties;
import com.twos.duel.repository.GameRepository;
import com.twos.duel.repository.OrderRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;

@ExtendWith(MockitoExtension.class)
class DuelTimeoutServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final DuelSweepProperties PROPERTIES =
      new DuelSweepProperties(true, Duration.ofSeconds(1), 50);

  @Mock private OrderRepository orderRepository;
  @Mock private GameRepository gameRepository;
  @Mock private OrderMatchingService orderMatchingService;
  @Mock private MatchOrchestrator matchOrchestrator;
  @Mock private DuelMetrics metrics;

  private DuelTimeoutService service;

  @BeforeEach
  void setUp() {
    service =
        new DuelTimeoutService(
            orderRepository,
            gameRepository,
            orderMatchingService,
            matchOrchestrator,
            PROPERTIES,
            metrics,
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC),
            new NoOpTransactionManager());
  }

  @Test
  void sweepProcessesDueConfirmationsAndRounds() {
    final UUID orderId = UUID.randomUUID();
    final UUID gameId = UUID.randomUUID();
    when(orderRepository.findDueConfirmationIds(FIXED_NOW, 50)).thenReturn(List.of(orderId));
    when(gameRepository.findDueIds(FIXED_NOW, 50)).thenReturn(List.of(gameId));
    when(orderMatchingService.expireConfirmationIfDue(orderId, FIXED_NOW)).thenReturn(true);
    when(matchOrchestrator.resolveRoundTimeoutIfDue(gameId, FIXED_NOW)).thenReturn(true);

    final SweepResult result = service.sweep();

    assertThat(result).isEqualTo(new SweepResult(1, 1, 0));
    verify(metrics).recordSweepDuration(any(Duration.class));
  }

  @Test
  void sweepContinuesAfterSingleRowFailure() {
    // 1 件目の失敗で 2 件目が処理されなくなるとポイントが拘束されたままになる
    final UUID failing = UUID.randomUUID();
    final UUID healthy = UUID.randomUUID();
    when(orderRepository.findDueConfirmationIds(FIXED_NOW, 50))
        .thenReturn(List.of(failing, healthy));
    when(gameRepository.findDueIds(FIXED_NOW, 50)).thenReturn(List.of());
    when(orderMatchingService.expireConfirmationIfDue(failing, FIXED_NOW))
        .thenThrow(new IllegalStateException("boom"));
    when(orderMatchingService.expireConfirmationIfDue(healthy, FIXED_NOW)).thenReturn(true);

    final SweepResult result = service.sweep();

    assertThat(result.confirmationsExpired()).isEqualTo(1);
    assertThat(result.failures()).isEqualTo(1);
    verify(metrics).recordTimeout("confirmation", "failed");
  }

  @Test
  void sweepDoesNotCountRowsHandledElsewhere() {
    final UUID gameId = UUID.randomUUID();
    when(orderRepository.findDueConfirmationIds(FIXED_NOW, 50)).thenReturn(List.of());
    when(gameRepository.findDueIds(FIXED_NOW, 50)).thenReturn(List.of(gameId));
    when(matchOrchestrator.resolveRoundTimeoutIfDue(gameId, FIXED_NOW)).thenReturn(false);

    final SweepResult result = service.sweep();

    assertThat(result.isEmpty()).isTrue();
    verify(metrics, never()).recordTimeout(any(), any());
  }

  private static class NoOpTransactionManager implements PlatformTransactionManager {

    @Override
    public TransactionStatus getTransaction(TransactionDefinition definition) {
      return new SimpleTransactionStatus();
    }

    @Override
    public void commit(TransactionStatus status) {}

    @Override
    public void rollback(TransactionStatus status) {}
  }
}

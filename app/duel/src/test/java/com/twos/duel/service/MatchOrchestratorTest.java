/*
 * どこで: 試合進行オーケストレータのユニットテスト
 * 何を: 提出受付・ラウンド確定・締切処理・シリーズ精算の分岐を検証する
 * なぜ: 不戦/放棄/通常終了のどの経路でも拘束額がちょうど 1 回払い出されることを担保するため
 */
package com.twos.duel.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.twos.duel.api.AlreadySubmittedException;
import com.twos.duel.api.ApiErrorCode;
import com.twos.duel.api.DuelAccessDeniedException;
import com.twos.duel.api.DuelStateConflictException;
import com.twos.duel.api.InvalidDuelRequestException;
import com.twos.duel.api.RoundDeadlineExceededException;
import com.twos.duel.api.response.MatchResponse;
import com.twos.duel.api.response.RoundResponse;
import com.twos.duel.api.response.SubmissionResponse;
import com.twos.duel.config.DuelRoundProperties;
import com.twos.duel.config.FairnessProperties;
import com.twos.duel.fairness.FairnessEngine;
import com.twos.duel.fairness.PlayerNumber;
import com.twos.duel.fairness.RoundOutcome;
import com.twos.duel.model.ChipType;
import com.twos.duel.model.DuelEventType;
import com.twos.duel.model.GameOutcome;
import com.twos.duel.model.GameRecord;
import com.twos.duel.model.GameStatus;
import com.twos.duel.model.MatchEndReason;
import com.twos.duel.model.MatchRecord;
import com.twos.duel.model.MatchStatus;
import com.twos.duel.model.OrderRecord;
import com.twos.duel.model.OrderStatus;
import com.twos.duel.model.PlayerSide;
import com.twos.duel.model.ReliabilityEvent;
import com.twos.duel.model.TransactionType;
import com.twos.duel.repository.GameRepository;
import com.twos.duel.repository.MatchRepository;
import com.twos.duel.repository.OrderRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MatchOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final UUID MATCH_ID = UUID.fromString("22222222-2222-2222-2222-222222222222");
    private static final UUID ORDER_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");
    private static final UUID GAME_ID = UUID.fromString("33333333-3333-3333-3333-333333333333");
    private static final String ALICE = "alice";
    private static final String BOB = "bob";
    private static final Duration CEILING = Duration.ofMinutes(5);
    private static final Duration WINDOW = Duration.ofSeconds(10);

    @Mock
    private MatchRepository matchRepository;

    @Mock
    private GameRepository gameRepository;

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private PointsLedgerService pointsLedgerService;

    @Mock
    private ReliabilityTracker reliabilityTracker;

    @Mock
    private DuelNotificationDispatcher notificationDispatcher;

    @Mock
    private DuelMetrics metrics;

    private final FairnessEngine fairnessEngine =
            new FairnessEngine(new FairnessProperties("orchestrator-test-secret-0001"));

    private MatchOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new MatchOrchestrator(
                matchRepository,
                gameRepository,
                orderRepository,
                fairnessEngine,
                new RewardCalculator(),
                pointsLedgerService,
                reliabilityTracker,
                notificationDispatcher,
                metrics,
                new DuelRoundProperties(CEILING, WINDOW),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void startSeriesCreatesMatchAndFirstRound() {
        OrderRecord matched = new OrderRecord(ORDER_ID, ALICE, ChipType.HEART, 10L, 3, OrderStatus.MATCHED, BOB,
                null, 0, MATCH_ID, 2L, NOW, NOW);
        when(matchRepository.insert(MATCH_ID, matched, NOW)).thenReturn(match(0, 0, 0, 0, 3));
        when(orderRepository.transition(ORDER_ID, OrderStatus.MATCHED, OrderStatus.IN_PROGRESS, NOW))
                .thenReturn(Optional.of(matched));

        orchestrator.startSeries(matched, MATCH_ID, NOW);

        verify(gameRepository).insert(any(UUID.class), eq(MATCH_ID), eq(1), eq(NOW), eq(NOW.plus(CEILING)));
        verify(notificationDispatcher).notify(
                eq(DuelEventType.ROUND_STARTED), eq(ALICE), eq(ORDER_ID), eq(MATCH_ID), eq(1), anyMap());
        verify(notificationDispatcher).notify(
                eq(DuelEventType.ROUND_STARTED), eq(BOB), eq(ORDER_ID), eq(MATCH_ID), eq(1), anyMap());
    }

    @Test
    void firstSubmissionShortensDeadlineToWindow() {
        GameRecord open = game(1, null, null, NOW.plus(CEILING));
        when(matchRepository.findById(MATCH_ID)).thenReturn(Optional.of(match(0, 0, 0, 0, 3)));
        when(gameRepository.findByMatchAndRoundForUpdate(MATCH_ID, 1)).thenReturn(Optional.of(open));
        when(gameRepository.recordSubmission(GAME_ID, PlayerSide.A, 123, NOW, NOW.plus(WINDOW)))
                .thenReturn(Optional.of(game(1, 123, null, NOW.plus(WINDOW))));

        SubmissionResponse response = orchestrator.submitPlayerNumber(MATCH_ID, 1, ALICE, 123);

        assertThat(response.submitted()).isTrue();
        assertThat(response.bothReady()).isFalse();
        assertThat(response.myNumber()).isEqualTo(123);
        verify(gameRepository, never()).finishWithResult(any(), any(), any(), any());
    }

    @Test
    void secondSubmissionResolvesRoundOnceAndStartsNextRound() {
        GameRecord halfSubmitted = game(1, 400000, null, NOW.plus(WINDOW));
        GameRecord bothSubmitted = game(1, 400000, 600000, NOW.plus(WINDOW));
        when(matchRepository.findById(MATCH_ID)).thenReturn(Optional.of(match(0, 0, 0, 0, 3)));
        when(gameRepository.findByMatchAndRoundForUpdate(MATCH_ID, 1)).thenReturn(Optional.of(halfSubmitted));
        when(gameRepository.recordSubmission(GAME_ID, PlayerSide.B, 600000, NOW, NOW.plus(WINDOW)))
                .thenReturn(Optional.of(bothSubmitted));
        when(matchRepository.findByIdForUpdate(MATCH_ID)).thenReturn(Optional.of(match(0, 0, 0, 0, 3)));
        when(gameRepository.finishWithResult(eq(GAME_ID), any(), any(), eq(NOW)))
                .thenReturn(Optional.of(bothSubmitted));
        when(matchRepository.applyRoundResult(eq(MATCH_ID), eq(1L), anyInt(), anyInt(), anyInt(), eq(NOW)))
                .thenReturn(Optional.of(match(1, 1, 0, 0, 3)));

        SubmissionResponse response = orchestrator.submitPlayerNumber(MATCH_ID, 1, BOB, 600000);

        assertThat(response.bothReady()).isTrue();
        RoundOutcome expected = fairnessEngine.determineWinner(MATCH_ID.toString(), 1,
                FairnessEngine.timeSlotOf(NOW), new PlayerNumber(ALICE, 400000), new PlayerNumber(BOB, 600000));
        ArgumentCaptor<RoundOutcome> outcome = ArgumentCaptor.forClass(RoundOutcome.class);
        ArgumentCaptor<GameOutcome> gameOutcome = ArgumentCaptor.forClass(GameOutcome.class);
        verify(gameRepository).finishWithResult(eq(GAME_ID), gameOutcome.capture(), outcome.capture(), eq(NOW));
        assertThat(outcome.getValue()).isEqualTo(expected);
        if (expected.draw()) {
            assertThat(gameOutcome.getValue()).isEqualTo(GameOutcome.DRAW);
        } else {
            assertThat(gameOutcome.getValue())
                    .isEqualTo(expected.winnerIndex() == 0 ? GameOutcome.A_WINS : GameOutcome.B_WINS);
        }
        verify(gameRepository).insert(any(UUID.class), eq(MATCH_ID), eq(2), eq(NOW), eq(NOW.plus(CEILING)));
        verify(matchRepository, never()).finish(any(), anyLong(), any(), any(), any(), any());
    }

    @Test
    void finalRoundSettlesSeriesForWinner() {
        GameRecord halfSubmitted = game(2, 10, null, NOW.plus(WINDOW));
        GameRecord bothSubmitted = game(2, 10, 20, NOW.plus(WINDOW));
        MatchRecord afterRound = match(2, 2, 0, 0, 2);
        when(matchRepository.findById(MATCH_ID)).thenReturn(Optional.of(match(1, 1, 0, 0, 2)));
        when(gameRepository.findByMatchAndRoundForUpdate(MATCH_ID, 2)).thenReturn(Optional.of(halfSubmitted));
        when(gameRepository.recordSubmission(GAME_ID, PlayerSide.B, 20, NOW, NOW.plus(WINDOW)))
                .thenReturn(Optional.of(bothSubmitted));
        when(matchRepository.findByIdForUpdate(MATCH_ID)).thenReturn(Optional.of(match(1, 1, 0, 0, 2)));
        when(gameRepository.finishWithResult(eq(GAME_ID), any(), any(), eq(NOW)))
                .thenReturn(Optional.of(bothSubmitted));
        when(matchRepository.applyRoundResult(eq(MATCH_ID), eq(1L), anyInt(), anyInt(), anyInt(), eq(NOW)))
                .thenReturn(Optional.of(afterRound));
        when(matchRepository.finish(MATCH_ID, afterRound.version(), MatchStatus.COMPLETED, ALICE,
                MatchEndReason.ALL_ROUNDS_PLAYED, NOW))
                .thenReturn(Optional.of(finished(afterRound, MatchStatus.COMPLETED, ALICE,
                        MatchEndReason.ALL_ROUNDS_PLAYED)));
        when(orderRepository.transition(ORDER_ID, OrderStatus.IN_PROGRESS, OrderStatus.COMPLETED, NOW))
                .thenReturn(Optional.of(new OrderRecord(ORDER_ID, ALICE, ChipType.HEART, 10L, 2,
                        OrderStatus.COMPLETED, BOB, null, 0, MATCH_ID, 4L, NOW, NOW)));

        orchestrator.submitPlayerNumber(MATCH_ID, 2, BOB, 20);

        InOrder settlementOrder = inOrder(pointsLedgerService, reliabilityTracker);
        settlementOrder.verify(pointsLedgerService).lockAccounts(List.of(ALICE, BOB));
        settlementOrder.verify(pointsLedgerService).credit(
                eq(ALICE), eq(40L), eq(TransactionType.DUEL_WIN), eq(ORDER_ID), eq(MATCH_ID), anyString());
        verify(reliabilityTracker).record(ALICE, ReliabilityEvent.DUEL_COMPLETED);
        verify(reliabilityTracker).record(BOB, ReliabilityEvent.DUEL_COMPLETED);
        verify(metrics).recordSeriesCompleted(MatchEndReason.ALL_ROUNDS_PLAYED.name());
        verify(gameRepository, never()).insert(any(), any(), anyInt(), any(), any());
    }

    @Test
    void lateSubmissionForfeitsSeriesBeforeMinimumGames() {
        GameRecord expired = game(1, 500, null, NOW.minusSeconds(1));
        MatchRecord afterRound = match(1, 1, 0, 0, 3);
        when(matchRepository.findById(MATCH_ID)).thenReturn(Optional.of(match(0, 0, 0, 0, 3)));
        when(gameRepository.findByMatchAndRoundForUpdate(MATCH_ID, 1)).thenReturn(Optional.of(expired));
        when(matchRepository.findByIdForUpdate(MATCH_ID)).thenReturn(Optional.of(match(0, 0, 0, 0, 3)));
        when(gameRepository.finishWithoutDraw(GAME_ID, GameOutcome.FORFEITED_B, ALICE, NOW))
                .thenReturn(Optional.of(expired));
        when(matchRepository.applyRoundResult(MATCH_ID, 1L, 1, 0, 0, NOW)).thenReturn(Optional.of(afterRound));
        when(matchRepository.finish(MATCH_ID, afterRound.version(), MatchStatus.COMPLETED, ALICE,
                MatchEndReason.FORFEIT, NOW))
                .thenReturn(Optional.of(finished(afterRound, MatchStatus.COMPLETED, ALICE, MatchEndReason.FORFEIT)));
        when(orderRepository.transition(ORDER_ID, OrderStatus.IN_PROGRESS, OrderStatus.COMPLETED, NOW))
                .thenReturn(Optional.of(new OrderRecord(ORDER_ID, ALICE, ChipType.HEART, 10L, 3,
                        OrderStatus.COMPLETED, BOB, null, 0, MATCH_ID, 4L, NOW, NOW)));

        assertThatThrownBy(() -> orchestrator.submitPlayerNumber(MATCH_ID, 1, BOB, 700))
                .isInstanceOf(RoundDeadlineExceededException.class);

        verify(pointsLedgerService).credit(
                eq(ALICE), eq(60L), eq(TransactionType.FORFEIT_AWARD), eq(ORDER_ID), eq(MATCH_ID), anyString());
        verify(reliabilityTracker).record(BOB, ReliabilityEvent.DROPPED_BEFORE_MIN_GAMES);
        verify(reliabilityTracker).record(ALICE, ReliabilityEvent.DUEL_COMPLETED);
        verify(notificationDispatcher).notify(
                eq(DuelEventType.OPPONENT_FORFEITED), eq(ALICE), eq(ORDER_ID), eq(MATCH_ID), eq(1), anyMap());
        verify(gameRepository, never()).recordSubmission(any(), any(), anyInt(), any(), any());
    }

    @Test
    void missedRoundAfterMinimumGamesCountsAsWinAndContinues() {
        GameRecord expired = game(3, null, 42, NOW.minusSeconds(1));
        when(gameRepository.findByIdForUpdateSkipLocked(GAME_ID)).thenReturn(Optional.of(expired));
        when(matchRepository.findByIdForUpdate(MATCH_ID)).thenReturn(Optional.of(match(2, 1, 1, 0, 4)));
        when(gameRepository.finishWithoutDraw(GAME_ID, GameOutcome.FORFEITED_A, BOB, NOW))
                .thenReturn(Optional.of(expired));
        when(matchRepository.applyRoundResult(MATCH_ID, 1L, 0, 1, 0, NOW))
                .thenReturn(Optional.of(match(3, 1, 2, 0, 4)));

        boolean resolved = orchestrator.resolveRoundTimeoutIfDue(GAME_ID, NOW);

        assertThat(resolved).isTrue();
        verify(gameRepository).insert(any(UUID.class), eq(MATCH_ID), eq(4), eq(NOW), eq(NOW.plus(CEILING)));
        verify(reliabilityTracker, never()).record(anyString(), any());
        verifyNoInteractions(pointsLedgerService);
    }

    @Test
    void roundWithoutSubmissionsBeforeMinimumGamesAbandonsSeries() {
        GameRecord expired = game(1, null, null, NOW.minusSeconds(1));
        MatchRecord afterRound = match(1, 0, 0, 1, 3);
        when(gameRepository.findByIdForUpdateSkipLocked(GAME_ID)).thenReturn(Optional.of(expired));
        when(matchRepository.findByIdForUpdate(MATCH_ID)).thenReturn(Optional.of(match(0, 0, 0, 0, 3)));
        when(gameRepository.finishWithoutDraw(GAME_ID, GameOutcome.ABANDONED, null, NOW))
                .thenReturn(Optional.of(expired));
        when(matchRepository.applyRoundResult(MATCH_ID, 1L, 0, 0, 1, NOW)).thenReturn(Optional.of(afterRound));
        when(matchRepository.finish(MATCH_ID, afterRound.version(), MatchStatus.ABANDONED, null,
                MatchEndReason.ABANDONED, NOW))
                .thenReturn(Optional.of(finished(afterRound, MatchStatus.ABANDONED, null, MatchEndReason.ABANDONED)));
        when(orderRepository.transition(ORDER_ID, OrderStatus.IN_PROGRESS, OrderStatus.CANCELLED, NOW))
                .thenReturn(Optional.of(new OrderRecord(ORDER_ID, ALICE, ChipType.HEART, 10L, 3,
                        OrderStatus.CANCELLED, BOB, null, 0, MATCH_ID, 4L, NOW, NOW)));

        assertThat(orchestrator.resolveRoundTimeoutIfDue(GAME_ID, NOW)).isTrue();

        InOrder settlementOrder = inOrder(pointsLedgerService, reliabilityTracker);
        settlementOrder.verify(pointsLedgerService).lockAccounts(List.of(ALICE, BOB));
        settlementOrder.verify(reliabilityTracker).record(ALICE, ReliabilityEvent.DROPPED_BEFORE_MIN_GAMES);
        verify(pointsLedgerService).credit(
                eq(ALICE), eq(30L), eq(TransactionType.STAKE_REFUND), eq(ORDER_ID), eq(MATCH_ID), anyString());
        verify(pointsLedgerService).credit(
                eq(BOB), eq(30L), eq(TransactionType.STAKE_REFUND), eq(ORDER_ID), eq(MATCH_ID), anyString());
        verify(reliabilityTracker).record(ALICE, ReliabilityEvent.DROPPED_BEFORE_MIN_GAMES);
        verify(reliabilityTracker).record(BOB, ReliabilityEvent.DROPPED_BEFORE_MIN_GAMES);
    }

    @Test
    void timeoutResolutionSkipsRowsNotDue() {
        when(gameRepository.findByIdForUpdateSkipLocked(GAME_ID))
                .thenReturn(Optional.of(game(1, null, null, NOW.plusSeconds(30))));

        assertThat(orchestrator.resolveRoundTimeoutIfDue(GAME_ID, NOW)).isFalse();
        verify(matchRepository, never()).findByIdForUpdate(any());
    }

    @Test
    void submitRejectsOutOfRangeNumberBeforeLoading() {
        assertThatThrownBy(() -> orchestrator.submitPlayerNumber(MATCH_ID, 1, ALICE, 1_000_000))
                .isInstanceOf(InvalidDuelRequestException.class);
        verifyNoInteractions(matchRepository, gameRepository);
    }

    @Test
    void submitRejectsNonParticipant() {
        when(matchRepository.findById(MATCH_ID)).thenReturn(Optional.of(match(0, 0, 0, 0, 3)));

        assertThatThrownBy(() -> orchestrator.submitPlayerNumber(MATCH_ID, 1, "mallory", 5))
                .isInstanceOf(DuelAccessDeniedException.class);
    }

    @Test
    void submitRejectsSecondSubmissionBySamePlayer() {
        when(matchRepository.findById(MATCH_ID)).thenReturn(Optional.of(match(0, 0, 0, 0, 3)));
        when(gameRepository.findByMatchAndRoundForUpdate(MATCH_ID, 1))
                .thenReturn(Optional.of(game(1, 5, null, NOW.plus(WINDOW))));

        assertThatThrownBy(() -> orchestrator.submitPlayerNumber(MATCH_ID, 1, ALICE, 6))
                .isInstanceOf(AlreadySubmittedException.class);
    }

    @Test
    void submitRejectsFinishedRound() {
        GameRecord forfeited = new GameRecord(GAME_ID, MATCH_ID, 1, GameStatus.FINISHED, NOW, NOW, 1, NOW, null,
                null, GameOutcome.FORFEITED_B, null, null, null, null, null, ALICE, NOW, 3L);
        when(matchRepository.findById(MATCH_ID)).thenReturn(Optional.of(match(1, 1, 0, 0, 3)));
        when(gameRepository.findByMatchAndRoundForUpdate(MATCH_ID, 1)).thenReturn(Optional.of(forfeited));

        assertThatThrownBy(() -> orchestrator.submitPlayerNumber(MATCH_ID, 1, BOB, 6))
                .isInstanceOfSatisfying(DuelStateConflictException.class,
                        ex -> assertThat(ex.code()).isEqualTo(ApiErrorCode.ROUND_NOT_OPEN));
    }

    @Test
    void resubmissionAfterRoundFinishedIsReportedAsAlreadySubmitted() {
        GameRecord done = new GameRecord(GAME_ID, MATCH_ID, 1, GameStatus.FINISHED, NOW, NOW, 1, NOW, 2, NOW,
                GameOutcome.A_WINS, 1L, "00000000", 0, 1, 2, ALICE, NOW, 3L);
        when(matchRepository.findById(MATCH_ID)).thenReturn(Optional.of(match(1, 1, 0, 0, 3)));
        when(gameRepository.findByMatchAndRoundForUpdate(MATCH_ID, 1)).thenReturn(Optional.of(done));

        assertThatThrownBy(() -> orchestrator.submitPlayerNumber(MATCH_ID, 1, BOB, 6))
                .isInstanceOf(AlreadySubmittedException.class);
        verify(gameRepository, never()).recordSubmission(any(), any(), anyInt(), any(), any());
    }

    @Test
    void matchViewHidesNumbersOfUnfinishedRounds() {
        GameRecord done = new GameRecord(GAME_ID, MATCH_ID, 1, GameStatus.FINISHED, NOW, NOW, 500000, NOW,
                500010, NOW, GameOutcome.A_WINS, 1000L, "e49adc86", 354246, 145754, 145764, ALICE, NOW, 3L);
        GameRecord open = new GameRecord(UUID.randomUUID(), MATCH_ID, 2, GameStatus.AWAITING_SUBMISSIONS, NOW,
                NOW.plus(WINDOW), 77, NOW, null, null, null, null, null, null, null, null, null, null, 1L);
        when(matchRepository.findById(MATCH_ID)).thenReturn(Optional.of(match(1, 1, 0, 0, 3)));
        when(gameRepository.findByMatchId(MATCH_ID)).thenReturn(List.of(done, open));

        MatchResponse response = orchestrator.getMatch(MATCH_ID);

        RoundResponse first = response.rounds().get(0);
        RoundResponse second = response.rounds().get(1);
        assertThat(first.playerANumber()).isEqualTo(500000);
        assertThat(first.formula()).isEqualTo(
                "0xe49adc86 mod 1000000 = 354246; |500000 - 354246| = 145754; "
                        + "|500010 - 354246| = 145764; player A wins");
        assertThat(second.playerASubmitted()).isTrue();
        assertThat(second.playerBSubmitted()).isFalse();
        assertThat(second.playerANumber()).isNull();
        assertThat(second.formula()).isNull();
        assertThat(response.winsA()).isEqualTo(1);
    }

    private static MatchRecord match(int played, int winsA, int winsB, int draws, int planned) {
        return new MatchRecord(MATCH_ID, ORDER_ID, ALICE, BOB, 10L, planned, played, winsA, winsB, draws,
                MatchStatus.IN_PROGRESS, null, null, 1L, NOW, NOW, null);
    }

    private static MatchRecord finished(MatchRecord match, MatchStatus status, String winnerId,
            MatchEndReason endReason) {
        return new MatchRecord(match.matchId(), match.orderId(), match.playerAId(), match.playerBId(),
                match.stakePerGame(), match.gamesPlanned(), match.gamesPlayed(), match.winsA(), match.winsB(),
                match.draws(), status, winnerId, endReason, match.version() + 1, NOW, NOW, NOW);
    }

    private static GameRecord game(int round, Integer aNumber, Integer bNumber, Instant deadline) {
        return new GameRecord(GAME_ID, MATCH_ID, round, GameStatus.AWAITING_SUBMISSIONS, NOW.minusSeconds(60),
                deadline, aNumber, aNumber == null ? null : NOW.minusSeconds(5), bNumber,
                bNumber == null ? null : NOW.minusSeconds(5), null, null, null, null, null, null, null, null, 1L);
    }
}

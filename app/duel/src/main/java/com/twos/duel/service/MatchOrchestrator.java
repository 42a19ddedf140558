/*
 * どこで: Duel サービス層
 * 何を: シリーズ (複数ラウンド) の開始・提出受付・ラウンド確定・期限切れ処理・精算を順に進める
 * なぜ: ラウンドを 1 つずつ確定させ、終わり方に関わらず拘束ポイントを 1 回だけ精算するため
 */
package com.twos.duel.service;

import com.twos.duel.api.AlreadySubmittedException;
import com.twos.duel.api.ApiErrorCode;
import com.twos.duel.api.ConcurrentStateChangeException;
import com.twos.duel.api.DuelAccessDeniedException;
import com.twos.duel.api.DuelResourceNotFoundException;
import com.twos.duel.api.DuelStateConflictException;
import com.twos.duel.api.InvalidDuelRequestException;
import com.twos.duel.api.RoundDeadlineExceededException;
import com.twos.duel.api.response.MatchResponse;
import com.twos.duel.api.response.RoundResponse;
import com.twos.duel.api.response.SubmissionResponse;
import com.twos.duel.config.DuelRoundProperties;
import com.twos.duel.fairness.FairnessEngine;
import com.twos.duel.fairness.PlayerNumber;
import com.twos.duel.fairness.RoundOutcome;
import com.twos.duel.model.DuelEventType;
import com.twos.duel.model.GameOutcome;
import com.twos.duel.model.GameRecord;
import com.twos.duel.model.MatchEndReason;
import com.twos.duel.model.MatchRecord;
import com.twos.duel.model.MatchStatus;
import com.twos.duel.model.OrderRecord;
import com.twos.duel.model.OrderStatus;
import com.twos.duel.model.PlayerSide;
import com.twos.duel.model.ReliabilityEvent;
import com.twos.duel.repository.GameRepository;
import com.twos.duel.repository.MatchRepository;
import com.twos.duel.repository.OrderRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
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
public class MatchOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(MatchOrchestrator.class);

    private final MatchRepository matchRepository;
    private final GameRepository gameRepository;
    private final OrderRepository orderRepository;
    private final FairnessEngine fairnessEngine;
    private final RewardCalculator rewardCalculator;
    private final PointsLedgerService pointsLedgerService;
    private final ReliabilityTracker reliabilityTracker;
    private final DuelNotificationDispatcher notificationDispatcher;
    private final DuelMetrics metrics;
    private final DuelRoundProperties roundProperties;
    private final Clock clock;

    /**
     * 役割: 確認済み (MATCHED) の注文からシリーズを作成し、第 1 ラウンドを開始する。
     * 前提: 呼び出し元のトランザクション内で注文行をロック済みであること。
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public MatchRecord startSeries(OrderRecord order, UUID matchId, Instant now) {
        if (order.status() != OrderStatus.MATCHED || order.opponentId() == null) {
            throw new IllegalStateException("order is not matched orderId=" + order.orderId());
        }
        MatchRecord match = matchRepository.insert(matchId, order, now);
        orderRepository.transition(order.orderId(), OrderStatus.MATCHED, OrderStatus.IN_PROGRESS, now)
                .orElseThrow(() -> new ConcurrentStateChangeException("order " + order.orderId()));
        startRound(match, 1, now);
        logger.info("series started matchId={} orderId={} playerA={} playerB={} gamesPlanned={}",
                match.matchId(),
                match.orderId(),
                match.playerAId(),
                match.playerBId(),
                match.gamesPlanned());
        return match;
    }

    // 期限切れの場合は期限切れ処理をコミットしたうえで呼び出し元へ 409 を返す
    @Transactional(noRollbackFor = RoundDeadlineExceededException.class)
    public SubmissionResponse submitPlayerNumber(UUID matchId, int roundNumber, String playerId, int number) {
        if (playerId == null || playerId.isBlank()) {
            throw new InvalidDuelRequestException("X-User-Id is required");
        }
        if (roundNumber < 1) {
            throw new InvalidDuelRequestException("round_number must be positive");
        }
        FairnessEngine.validateNumber("player_number", number);
        MatchRecord match = matchRepository.findById(matchId)
                .orElseThrow(() -> new DuelResourceNotFoundException("match", matchId));
        if (!match.isParticipant(playerId)) {
            throw new DuelAccessDeniedException("user is not a participant of match " + matchId);
        }
        PlayerSide side = match.sideOf(playerId);
        GameRecord game = gameRepository.findByMatchAndRoundForUpdate(matchId, roundNumber)
                .orElseThrow(() -> new DuelResourceNotFoundException("round", matchId + "/" + roundNumber));
        // 提出済みの再送は、ラウンド確定後や締切後でも AlreadySubmitted として返す
        if (game.hasSubmitted(side)) {
            throw new AlreadySubmittedException(matchId + "/" + roundNumber);
        }
        if (game.isFinished()) {
            throw new DuelStateConflictException(ApiErrorCode.ROUND_NOT_OPEN,
                    "round already finished: " + matchId + "/" + roundNumber);
        }
        Instant now = Instant.now(clock);
        if (!now.isBefore(game.deadline())) {
            applyRoundTimeout(game, now);
            throw new RoundDeadlineExceededException(matchId + "/" + roundNumber);
        }
        Instant deadline = game.deadline();
        if (!game.hasSubmitted(side.opponent())) {
            // 先に提出した側を長く待たせないよう、相手の入力猶予を短縮する
            Instant windowEnd = now.plus(roundProperties.submissionWindow());
            deadline = windowEnd.isBefore(deadline) ? windowEnd : deadline;
        }
        GameRecord updated = gameRepository.recordSubmission(game.gameId(), side, number, now, deadline)
                .orElseThrow(() -> new ConcurrentStateChangeException("round " + matchId + "/" + roundNumber));
        boolean bothReady = updated.hasSubmitted(PlayerSide.A) && updated.hasSubmitted(PlayerSide.B);
        logger.info("number submitted matchId={} round={} playerId={} bothReady={}",
                matchId, roundNumber, playerId, bothReady);
        if (bothReady) {
            finishRound(updated, now);
        }
        return new SubmissionResponse(true, bothReady, number);
    }

    /**
     * 役割: 締切を過ぎたラウンドを確定させる (タイムアウト掃除用)。
     * 動作: 他で処理中の行は飛ばし、ロック取得後に状態と締切を再確認する。処理しなかった場合は false。
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean resolveRoundTimeoutIfDue(UUID gameId, Instant now) {
        Optional<GameRecord> locked = gameRepository.findByIdForUpdateSkipLocked(gameId);
        if (locked.isEmpty()) {
            return false;
        }
        GameRecord game = locked.get();
        if (game.isFinished() || now.isBefore(game.deadline())) {
            return false;
        }
        applyRoundTimeout(game, now);
        return true;
    }

    public MatchResponse getMatch(UUID matchId) {
        MatchRecord match = matchRepository.findById(matchId)
                .orElseThrow(() -> new DuelResourceNotFoundException("match", matchId));
        List<RoundResponse> rounds = gameRepository.findByMatchId(matchId).stream()
                .map(this::toRoundResponse)
                .toList();
        return new MatchResponse(
                match.matchId(),
                match.orderId(),
                match.playerAId(),
                match.playerBId(),
                match.stakePerGame(),
                match.gamesPlanned(),
                match.gamesPlayed(),
                match.winsA(),
                match.winsB(),
                match.draws(),
                match.status(),
                match.winnerId(),
                match.endReason(),
                match.completedAt(),
                rounds);
    }

    private GameRecord startRound(MatchRecord match, int roundNumber, Instant now) {
        Instant deadline = now.plus(roundProperties.ceiling());
        GameRecord game = gameRepository.insert(UUID.randomUUID(), match.matchId(), roundNumber, now, deadline);
        notifyBoth(match, DuelEventType.ROUND_STARTED, roundNumber, Map.of("deadline", deadline.toString()));
        return game;
    }

    // 両者の提出が揃ったラウンドを公平性エンジンで 1 回だけ判定し、確定させる
    private void finishRound(GameRecord game, Instant now) {
        MatchRecord match = lockMatch(game.matchId());
        RoundOutcome outcome = fairnessEngine.determineWinner(
                match.matchId().toString(),
                game.roundNumber(),
                FairnessEngine.timeSlotOf(now),
                new PlayerNumber(match.playerAId(), game.playerANumber()),
                new PlayerNumber(match.playerBId(), game.playerBNumber()));
        GameOutcome gameOutcome;
        if (outcome.draw()) {
            gameOutcome = GameOutcome.DRAW;
        } else {
            gameOutcome = outcome.winnerIndex() == 0 ? GameOutcome.A_WINS : GameOutcome.B_WINS;
        }
        gameRepository.finishWithResult(game.gameId(), gameOutcome, outcome, now)
                .orElseThrow(() -> new ConcurrentStateChangeException("round " + game.gameId()));
        MatchRecord updated = applyRoundToMatch(match, gameOutcome, now);
        metrics.recordRoundResolved(gameOutcome.name());
        logger.info("round finished matchId={} round={} outcome={} randomNumber={} seedSlice={}",
                match.matchId(),
                game.roundNumber(),
                gameOutcome,
                outcome.randomNumber(),
                outcome.seedSlice());
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("outcome", gameOutcome.name());
        attributes.put("winner_id", outcome.winnerId());
        attributes.put("seed_slice", outcome.seedSlice());
        attributes.put("random_number", outcome.randomNumber());
        notifyBoth(match, DuelEventType.ROUND_RESULT, game.roundNumber(), attributes);
        advanceSeries(updated, now);
    }

    private void applyRoundTimeout(GameRecord game, Instant now) {
        boolean aSubmitted = game.hasSubmitted(PlayerSide.A);
        boolean bSubmitted = game.hasSubmitted(PlayerSide.B);
        if (aSubmitted && bSubmitted) {
            finishRound(game, now);
            return;
        }
        MatchRecord match = lockMatch(game.matchId());
        int completedBefore = match.gamesPlayed();
        if (aSubmitted || bSubmitted) {
            PlayerSide forfeiter = aSubmitted ? PlayerSide.B : PlayerSide.A;
            GameOutcome outcome = forfeiter == PlayerSide.A ? GameOutcome.FORFEITED_A : GameOutcome.FORFEITED_B;
            String winnerId = match.playerId(forfeiter.opponent());
            gameRepository.finishWithoutDraw(game.gameId(), outcome, winnerId, now)
                    .orElseThrow(() -> new ConcurrentStateChangeException("round " + game.gameId()));
            MatchRecord updated = applyRoundToMatch(match, outcome, now);
            metrics.recordRoundResolved(outcome.name());
            metrics.recordTimeout("round", "forfeit");
            logger.info("round forfeited matchId={} round={} forfeiter={} completedBefore={}",
                    match.matchId(), game.roundNumber(), match.playerId(forfeiter), completedBefore);
            notificationDispatcher.notify(DuelEventType.OPPONENT_FORFEITED, winnerId, match.orderId(),
                    match.matchId(), game.roundNumber(), Map.of("forfeiter_id", match.playerId(forfeiter)));
            if (!RewardCalculator.meetsMinimumGames(completedBefore)) {
                terminateByForfeit(updated, forfeiter, now);
                return;
            }
            notifyRoundClosed(match, game.roundNumber(), outcome, winnerId);
            advanceSeries(updated, now);
            return;
        }
        gameRepository.finishWithoutDraw(game.gameId(), GameOutcome.ABANDONED, null, now)
                .orElseThrow(() -> new ConcurrentStateChangeException("round " + game.gameId()));
        MatchRecord updated = applyRoundToMatch(match, GameOutcome.ABANDONED, now);
        metrics.recordRoundResolved(GameOutcome.ABANDONED.name());
        metrics.recordTimeout("round", "abandoned");
        logger.info("round abandoned matchId={} round={} completedBefore={}",
                match.matchId(), game.roundNumber(), completedBefore);
        if (!RewardCalculator.meetsMinimumGames(completedBefore)) {
            terminateByAbandonment(updated, now);
            return;
        }
        notifyRoundClosed(match, game.roundNumber(), GameOutcome.ABANDONED, null);
        advanceSeries(updated, now);
    }

    private void advanceSeries(MatchRecord match, Instant now) {
        if (match.gamesPlayed() >= match.gamesPlanned()) {
            completeSeries(match, now);
            return;
        }
        startRound(match, match.gamesPlayed() + 1, now);
    }

    private void completeSeries(MatchRecord match, Instant now) {
        SeriesSettlement settlement = rewardCalculator.settleSeries(SeriesScore.of(match), match.stakePerGame());
        if (settlement.kind() == SeriesSettlement.Kind.NOT_RELEASED) {
            throw new IllegalStateException("series finished below minimum games matchId=" + match.matchId());
        }
        applyPayouts(match, settlement, "series " + settlement.kind().name().toLowerCase(Locale.ROOT));
        String winnerId = settlement.winner() == null ? null : match.playerId(settlement.winner());
        MatchRecord finished = finishMatch(match, MatchStatus.COMPLETED, winnerId, MatchEndReason.ALL_ROUNDS_PLAYED,
                OrderStatus.COMPLETED, now);
        reliabilityTracker.record(match.playerAId(), ReliabilityEvent.DUEL_COMPLETED);
        reliabilityTracker.record(match.playerBId(), ReliabilityEvent.DUEL_COMPLETED);
        notifySeriesCompleted(finished);
    }

    private void terminateByForfeit(MatchRecord match, PlayerSide forfeiter, Instant now) {
        SeriesSettlement settlement = rewardCalculator.settleForfeit(
                forfeiter, match.stakePerGame(), match.gamesPlanned());
        applyPayouts(match, settlement, "forfeit award");
        String winnerId = match.playerId(settlement.winner());
        MatchRecord finished = finishMatch(match, MatchStatus.COMPLETED, winnerId, MatchEndReason.FORFEIT,
                OrderStatus.COMPLETED, now);
        reliabilityTracker.record(match.playerId(forfeiter), ReliabilityEvent.DROPPED_BEFORE_MIN_GAMES);
        reliabilityTracker.record(winnerId, ReliabilityEvent.DUEL_COMPLETED);
        notifySeriesCompleted(finished);
    }

    private void terminateByAbandonment(MatchRecord match, Instant now) {
        SeriesSettlement settlement = rewardCalculator.settleAbandonment(match.stakePerGame(), match.gamesPlanned());
        applyPayouts(match, settlement, "series abandoned");
        MatchRecord finished = finishMatch(match, MatchStatus.ABANDONED, null, MatchEndReason.ABANDONED,
                OrderStatus.CANCELLED, now);
        reliabilityTracker.record(match.playerAId(), ReliabilityEvent.DROPPED_BEFORE_MIN_GAMES);
        reliabilityTracker.record(match.playerBId(), ReliabilityEvent.DROPPED_BEFORE_MIN_GAMES);
        notifySeriesCompleted(finished);
    }

    private void applyPayouts(MatchRecord match, SeriesSettlement settlement, String description) {
        if (settlement.totalPaidOut() != match.totalPool()) {
            throw new IllegalStateException("settlement does not match pool matchId=" + match.matchId()
                    + " paid=" + settlement.totalPaidOut() + " pool=" + match.totalPool());
        }
        // 以降の払い出しと信頼度更新は両者の行ロック取得後に行う
        pointsLedgerService.lockAccounts(List.of(match.playerAId(), match.playerBId()));
        for (SeriesSettlement.Payout payout : settlement.payouts()) {
            pointsLedgerService.credit(
                    match.playerId(payout.side()),
                    payout.amount(),
                    payout.type(),
                    match.orderId(),
                    match.matchId(),
                    description);
        }
    }

    private MatchRecord finishMatch(
            MatchRecord match,
            MatchStatus status,
            String winnerId,
            MatchEndReason endReason,
            OrderStatus orderStatus,
            Instant now) {
        MatchRecord finished = matchRepository.finish(match.matchId(), match.version(), status, winnerId, endReason, now)
                .orElseThrow(() -> new ConcurrentStateChangeException("match " + match.matchId()));
        orderRepository.transition(match.orderId(), OrderStatus.IN_PROGRESS, orderStatus, now)
                .orElseThrow(() -> new ConcurrentStateChangeException("order " + match.orderId()));
        metrics.recordSeriesCompleted(endReason.name());
        logger.info("series finished matchId={} status={} endReason={} winnerId={} winsA={} winsB={} draws={}",
                finished.matchId(),
                status,
                endReason,
                winnerId,
                finished.winsA(),
                finished.winsB(),
                finished.draws());
        return finished;
    }

    private MatchRecord applyRoundToMatch(MatchRecord match, GameOutcome outcome, Instant now) {
        return matchRepository.applyRoundResult(
                        match.matchId(),
                        match.version(),
                        outcome.countsAsWinFor(PlayerSide.A) ? 1 : 0,
                        outcome.countsAsWinFor(PlayerSide.B) ? 1 : 0,
                        outcome.countsAsDraw() ? 1 : 0,
                        now)
                .orElseThrow(() -> new ConcurrentStateChangeException("match " + match.matchId()));
    }

    private MatchRecord lockMatch(UUID matchId) {
        MatchRecord match = matchRepository.findByIdForUpdate(matchId)
                .orElseThrow(() -> new IllegalStateException("match missing for round matchId=" + matchId));
        if (match.status() != MatchStatus.IN_PROGRESS) {
            throw new DuelStateConflictException(ApiErrorCode.ROUND_NOT_OPEN, "match already finished: " + matchId);
        }
        return match;
    }

    private void notifyRoundClosed(MatchRecord match, int roundNumber, GameOutcome outcome, String winnerId) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("outcome", outcome.name());
        attributes.put("winner_id", winnerId);
        notifyBoth(match, DuelEventType.ROUND_RESULT, roundNumber, attributes);
    }

    private void notifySeriesCompleted(MatchRecord match) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("status", match.status().name());
        attributes.put("end_reason", match.endReason() == null ? null : match.endReason().name());
        attributes.put("winner_id", match.winnerId());
        attributes.put("wins_a", match.winsA());
        attributes.put("wins_b", match.winsB());
        attributes.put("draws", match.draws());
        notifyBoth(match, DuelEventType.SERIES_COMPLETED, null, attributes);
    }

    private void notifyBoth(MatchRecord match, DuelEventType type, Integer roundNumber, Map<String, Object> attributes) {
        for (String playerId : List.of(match.playerAId(), match.playerBId())) {
            notificationDispatcher.notify(type, playerId, match.orderId(), match.matchId(), roundNumber, attributes);
        }
    }

    // 確定前は提出値を伏せ、確定後は保存済みの値だけで計算式を組み立てる (再計算しない)
    private RoundResponse toRoundResponse(GameRecord game) {
        boolean finished = game.isFinished();
        String formula = null;
        if (finished && game.seedSlice() != null) {
            formula = FairnessEngine.formula(
                    game.seedSlice(),
                    game.randomNumber(),
                    game.playerANumber(),
                    game.distanceA(),
                    game.playerBNumber(),
                    game.distanceB());
        }
        return new RoundResponse(
                game.roundNumber(),
                game.status(),
                game.deadline(),
                game.hasSubmitted(PlayerSide.A),
                game.hasSubmitted(PlayerSide.B),
                finished ? game.playerANumber() : null,
                finished ? game.playerBNumber() : null,
                game.outcome(),
                game.winnerId(),
                game.timeSlot(),
                game.seedSlice(),
                game.randomNumber(),
                game.distanceA(),
                game.distanceB(),
                formula,
                game.finishedAt());
    }
}

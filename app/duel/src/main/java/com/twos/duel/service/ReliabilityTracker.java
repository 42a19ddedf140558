/*
 * どこで: Duel サービス層
 * 何を: 取引ごとの信頼度イベントを記録し、係数と段階評価を算出する
 * なぜ: 確認を放置したり途中離脱する利用者を対戦相手が事前に見分けられるようにするため
 */
package com.twos.duel.service;

import com.twos.duel.api.DuelResourceNotFoundException;
import com.twos.duel.api.InvalidDuelRequestException;
import com.twos.duel.api.response.ReliabilityResponse;
import com.twos.duel.model.ReliabilityEvent;
import com.twos.duel.model.ReliabilityRank;
import com.twos.duel.model.UserAccountRecord;
import com.twos.duel.repository.UserAccountRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class ReliabilityTracker {

    static final int MAX_LEADERBOARD_LIMIT = 100;
    private static final Logger logger = LoggerFactory.getLogger(ReliabilityTracker.class);

    private final UserAccountRepository userAccountRepository;
    private final Clock clock;

    /** 取引が 1 件もない利用者は 1.0 (最上位) として扱う。内部では丸めない。 */
    public static double coefficient(int totalDeals, int completedDeals) {
        if (totalDeals <= 0) {
            return 1.0d;
        }
        return (double) completedDeals / totalDeals;
    }

    public static ReliabilityResponse toResponse(UserAccountRecord account) {
        double coefficient = coefficient(account.totalDeals(), account.completedDeals());
        ReliabilityRank rank = ReliabilityRank.fromCoefficient(coefficient);
        return new ReliabilityResponse(
                account.userId(),
                account.username(),
                account.totalDeals(),
                account.completedDeals(),
                account.missedConfirmations(),
                account.droppedBeforeMinGames(),
                coefficient,
                (int) Math.round(coefficient * 100),
                rank,
                rank.isWarning());
    }

    // 呼び出し元の状態遷移と同じトランザクションで加算する
    @Transactional(propagation = Propagation.MANDATORY)
    public void record(String userId, ReliabilityEvent event) {
        int updated = userAccountRepository.incrementReliability(userId, event, Instant.now(clock));
        if (updated == 0) {
            throw new IllegalStateException("reliability target is not registered userId=" + userId);
        }
        logger.info("reliability event recorded userId={} event={}", userId, event);
    }

    public ReliabilityResponse snapshot(String userId) {
        return userAccountRepository.findById(userId)
                .map(ReliabilityTracker::toResponse)
                .orElseThrow(() -> new DuelResourceNotFoundException("user", userId));
    }

    public List<ReliabilityResponse> leaderboard(int limit) {
        if (limit < 1 || limit > MAX_LEADERBOARD_LIMIT) {
            throw new InvalidDuelRequestException("limit must be between 1 and " + MAX_LEADERBOARD_LIMIT);
        }
        return userAccountRepository.findLeaderboard(limit).stream()
                .map(ReliabilityTracker::toResponse)
                .toList();
    }
}

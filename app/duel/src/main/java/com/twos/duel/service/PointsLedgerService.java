/*
 * どこで: Duel サービス層
 * 何を: ポイント残高の増減と台帳記録を 1 組で行う
 * なぜ: 残高変更が必ず 1 件の台帳行を伴い、呼び出し元の状態遷移と同時にコミットされるようにするため
 */
package com.twos.duel.service;

import com.twos.duel.api.DuelResourceNotFoundException;
import com.twos.duel.api.InsufficientBalanceException;
import com.twos.duel.api.InvalidDuelRequestException;
import com.twos.duel.api.request.PointsGrantRequest;
import com.twos.duel.api.response.AccountResponse;
import com.twos.duel.api.response.TransactionResponse;
import com.twos.duel.api.response.TransactionsResponse;
import com.twos.duel.config.DuelAccountProperties;
import com.twos.duel.model.LedgerEntryRecord;
import com.twos.duel.model.TransactionType;
import com.twos.duel.model.UserAccountRecord;
import com.twos.duel.repository.LedgerRepository;
import com.twos.duel.repository.UserAccountRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.TreeSet;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class PointsLedgerService {

    static final int MAX_TRANSACTIONS_LIMIT = 200;
    private static final Logger logger = LoggerFactory.getLogger(PointsLedgerService.class);

    private final UserAccountRepository userAccountRepository;
    private final LedgerRepository ledgerRepository;
    private final DuelAccountProperties accountProperties;
    private final Clock clock;

    /** 初回アクセス時に利用者を登録し、設定があれば初期ポイントを台帳付きで付与する。 */
    @Transactional(propagation = Propagation.MANDATORY)
    public void ensureAccount(String userId, String username) {
        Instant now = Instant.now(clock);
        String resolvedName = username == null || username.isBlank() ? userId : username;
        long initialBalance = accountProperties.initialBalance();
        boolean created = userAccountRepository.registerIfAbsent(userId, resolvedName, initialBalance, now);
        if (created && initialBalance > 0) {
            ledgerRepository.insert(new LedgerEntryRecord(
                    UUID.randomUUID(),
                    userId,
                    TransactionType.INITIAL_BALANCE,
                    initialBalance,
                    null,
                    null,
                    "initial balance",
                    now));
        }
        if (created) {
            logger.info("duel user registered userId={} initialBalance={}", userId, initialBalance);
        }
    }

    /**
     * 複数利用者の残高を動かす前に、行ロックを user_id の昇順で取得する。
     * 同じ 2 人が役割を入れ替えた対戦を同時に精算しても、ロック待ちが循環しない。
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void lockAccounts(Collection<String> userIds) {
        for (String userId : new TreeSet<>(userIds)) {
            if (userAccountRepository.lockForUpdate(userId) == 0) {
                throw new IllegalStateException("account is not registered userId=" + userId);
            }
        }
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void debitStake(String userId, long amount, UUID orderId) {
        requirePositive(amount);
        Instant now = Instant.now(clock);
        // 残高チェックと減算を 1 文で行い、同時の引き落としでも負残高にしない
        if (userAccountRepository.debitIfSufficient(userId, amount, now) == 0) {
            throw new InsufficientBalanceException(userId, amount);
        }
        ledgerRepository.insert(new LedgerEntryRecord(
                UUID.randomUUID(),
                userId,
                TransactionType.STAKE_LOCK,
                -amount,
                orderId,
                null,
                "stake locked for order " + orderId,
                now));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void credit(
            String userId,
            long amount,
            TransactionType type,
            UUID orderId,
            UUID matchId,
            String description) {
        requirePositive(amount);
        Instant now = Instant.now(clock);
        if (userAccountRepository.credit(userId, amount, now) == 0) {
            throw new IllegalStateException("credit target is not registered userId=" + userId);
        }
        ledgerRepository.insert(new LedgerEntryRecord(
                UUID.randomUUID(), userId, type, amount, orderId, matchId, description, now));
    }

    @Transactional
    public AccountResponse grantPoints(String userId, PointsGrantRequest request) {
        ensureAccount(userId, request.username());
        credit(userId, request.amount(), TransactionType.POINTS_GRANT, null, null, request.reason());
        logger.info("points granted userId={} amount={}", userId, request.amount());
        return account(userId);
    }

    public AccountResponse account(String userId) {
        UserAccountRecord account = userAccountRepository.findById(userId)
                .orElseThrow(() -> new DuelResourceNotFoundException("user", userId));
        return new AccountResponse(
                account.userId(),
                account.username(),
                account.pointsBalance(),
                ReliabilityTracker.toResponse(account));
    }

    public TransactionsResponse listTransactions(String userId, int limit) {
        if (limit < 1 || limit > MAX_TRANSACTIONS_LIMIT) {
            throw new InvalidDuelRequestException("limit must be between 1 and " + MAX_TRANSACTIONS_LIMIT);
        }
        return new TransactionsResponse(userId, ledgerRepository.findByUserId(userId, limit).stream()
                .map(entry -> new TransactionResponse(
                        entry.transactionId(),
                        entry.type(),
                        entry.amountPoints(),
                        entry.relatedOrderId(),
                        entry.relatedMatchId(),
                        entry.description(),
                        entry.createdAt()))
                .toList());
    }

    private void requirePositive(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
    }
}

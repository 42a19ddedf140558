/*
 * どこで: Duel ドメインモデル
 * 何を: duel_transactions テーブルの 1 行を表す
 * なぜ: 残高変更ごとの台帳記録を追記専用で扱うため
 */
package com.twos.duel.model;

import java.time.Instant;
import java.util.UUID;

// amountPoints は符号付き (引き落としは負数)
public record LedgerEntryRecord(
        UUID transactionId,
        String userId,
        TransactionType type,
        long amountPoints,
        UUID relatedOrderId,
        UUID relatedMatchId,
        String description,
        Instant createdAt) {
}

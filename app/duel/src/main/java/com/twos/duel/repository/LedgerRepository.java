/*
 * どこで: Duel データアクセス
 * 何を: duel_transactions への追記と参照を行う
 * なぜ: 残高変更の根拠を追記専用の台帳として残すため
 */
package com.twos.duel.repository;

import static com.twos.common.JdbcTimestampUtils.getInstant;
import static com.twos.common.JdbcTimestampUtils.toTimestamp;

import com.twos.duel.model.LedgerEntryRecord;
import com.twos.duel.model.TransactionType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class LedgerRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(LedgerEntryRecord entry) {
    final String sql =
        """
        INSERT INTO duel_transactions (
          transaction_id,
          user_id,
          type,
          amount_points,
          related_order_id,
          related_match_id,
          description,
          created_at
        ) VALUES (
          :transactionId,
          :userId,
          :type,
          :amountPoints,
          :relatedOrderId,
          :relatedMatchId,
          :description,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("transactionId", entry.transactionId())
            .addValue("userId", entry.userId())
            .addValue("type", entry.type().name())
            .addValue("amountPoints", entry.amountPoints())
            .addValue("relatedOrderId", entry.relatedOrderId())
            .addValue("relatedMatchId", entry.relatedMatchId())
            .addValue("description", entry.description())
            .addValue("createdAt", toTimestamp(entry.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  public List<LedgerEntryRecord> findByUserId(String userId, int limit) {
    final String sql =
        """
        SELECT transaction_id, user_id, type, amount_points, related_order_id,
               related_match_id, description, created_at
        FROM duel_transactions
        WHERE user_id = :userId
        ORDER BY created_at DESC, transaction_id
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<LedgerEntryRecord> findByRelatedOrderId(UUID orderId) {
    final String sql =
        """
        SELECT transaction_id, user_id, type, amount_points, related_order_id,
               related_match_id, description, created_at
        FROM duel_transactions
        WHERE related_order_id = :orderId
        ORDER BY created_at, transaction_id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("orderId", orderId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private LedgerEntryRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new LedgerEntryRecord(
        rs.getObject("transaction_id", UUID.class),
        rs.getString("user_id"),
        TransactionType.valueOf(rs.getString("type")),
        rs.getLong("amount_points"),
        rs.getObject("related_order_id", UUID.class),
        rs.getObject("related_match_id", UUID.class),
        rs.getString("description"),
        getInstant(rs, "created_at"));
  }
}

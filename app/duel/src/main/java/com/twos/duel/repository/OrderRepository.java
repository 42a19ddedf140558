/*
 * どこで: Duel データアクセス
 * 何を: duel_orders の登録/状態遷移/参照を行う
 * なぜ: 状態遷移を「期待状態を WHERE に含む条件付き UPDATE」に限定し、同時操作で二重遷移させないため
 */
package com.twos.duel.repository;

import static com.twos.common.JdbcTimestampUtils.getInstant;
import static com.twos.common.JdbcTimestampUtils.toTimestamp;

import com.twos.duel.model.ChipType;
import com.twos.duel.model.OrderRecord;
import com.twos.duel.model.OrderStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class OrderRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT order_id, owner_id, chip_type, stake_per_game, games_planned, status, opponent_id,
             confirmation_deadline, missed_confirmations, match_id, version, created_at, updated_at
      FROM duel_orders
      """;
  private static final String RETURNING_COLUMNS =
      """
      RETURNING order_id, owner_id, chip_type, stake_per_game, games_planned, status, opponent_id,
                confirmation_deadline, missed_confirmations, match_id, version, created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public OrderRecord insert(
      UUID orderId, String ownerId, ChipType chipType, int gamesPlanned, Instant now) {
    final String sql =
        """
        INSERT INTO duel_orders (
          order_id,
          owner_id,
          chip_type,
          stake_per_game,
          games_planned,
          status,
          missed_confirmations,
          version,
          created_at,
          updated_at
        ) VALUES (
          :orderId,
          :ownerId,
          :chipType,
          :stakePerGame,
          :gamesPlanned,
          'OPEN',
          0,
          0,
          :now,
          :now
        )
        """
            + RETURNING_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("orderId", orderId)
            .addValue("ownerId", ownerId)
            .addValue("chipType", chipType.name())
            .addValue("stakePerGame", chipType.pointsPerGame())
            .addValue("gamesPlanned", gamesPlanned)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<OrderRecord> findById(UUID orderId) {
    final String sql = SELECT_COLUMNS + "WHERE order_id = :orderId";
    return jdbcTemplate.query(sql, idParams(orderId), this::mapRow).stream().findFirst();
  }

  public Optional<OrderRecord> findByIdForUpdate(UUID orderId) {
    final String sql = SELECT_COLUMNS + "WHERE order_id = :orderId FOR UPDATE";
    return jdbcTemplate.query(sql, idParams(orderId), this::mapRow).stream().findFirst();
  }

  // 他ワーカーが処理中の行は待たずに飛ばす
  public Optional<OrderRecord> findByIdForUpdateSkipLocked(UUID orderId) {
    final String sql = SELECT_COLUMNS + "WHERE order_id = :orderId FOR UPDATE SKIP LOCKED";
    return jdbcTemplate.query(sql, idParams(orderId), this::mapRow).stream().findFirst();
  }

  public List<OrderRecord> findOpen(int limit) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE status = 'OPEN'
            ORDER BY created_at DESC, order_id
            LIMIT :limit
            """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource("limit", limit), this::mapRow);
  }

  public List<OrderRecord> findByParticipant(String userId, int limit) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE owner_id = :userId OR opponent_id = :userId
            ORDER BY created_at DESC, order_id
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<UUID> findDueConfirmationIds(Instant now, int limit) {
    final String sql =
        """
        SELECT order_id
        FROM duel_orders
        WHERE status = 'WAITING_CREATOR_CONFIRM'
          AND confirmation_deadline <= :now
        ORDER BY confirmation_deadline
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getObject("order_id", UUID.class));
  }

  /** OPEN の場合のみ参加者を確保する。同時参加は 1 件だけが行を返す。 */
  public Optional<OrderRecord> reserveForJoin(
      UUID orderId, String joinerId, Instant confirmationDeadline, Instant now) {
    final String sql =
        """
        UPDATE duel_orders
        SET status = 'WAITING_CREATOR_CONFIRM',
            opponent_id = :joinerId,
            confirmation_deadline = :deadline,
            version = version + 1,
            updated_at = :now
        WHERE order_id = :orderId
          AND status = 'OPEN'
          AND owner_id <> :joinerId
        """
            + RETURNING_COLUMNS;
    final MapSqlParameterSource params =
        idParams(orderId)
            .addValue("joinerId", joinerId)
            .addValue("deadline", toTimestamp(confirmationDeadline))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<OrderRecord> markMatched(UUID orderId, UUID matchId, Instant now) {
    final String sql =
        """
        UPDATE duel_orders
        SET status = 'MATCHED',
            match_id = :matchId,
            confirmation_deadline = NULL,
            version = version + 1,
            updated_at = :now
        WHERE order_id = :orderId
          AND status = 'WAITING_CREATOR_CONFIRM'
        """
            + RETURNING_COLUMNS;
    final MapSqlParameterSource params =
        idParams(orderId).addValue("matchId", matchId).addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * 役割: 作成者の確認期限切れを記録する。
   * 動作: 参加者と期限をクリアし missed_confirmations を加算して nextStatus (OPEN / EXPIRED) へ戻す。
   */
  public Optional<OrderRecord> releaseAfterMissedConfirmation(
      UUID orderId, OrderStatus nextStatus, Instant now) {
    final String sql =
        """
        UPDATE duel_orders
        SET status = :nextStatus,
            opponent_id = NULL,
            confirmation_deadline = NULL,
            missed_confirmations = missed_confirmations + 1,
            version = version + 1,
            updated_at = :now
        WHERE order_id = :orderId
          AND status = 'WAITING_CREATOR_CONFIRM'
        """
            + RETURNING_COLUMNS;
    final MapSqlParameterSource params =
        idParams(orderId)
            .addValue("nextStatus", nextStatus.name())
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<OrderRecord> transition(
      UUID orderId, OrderStatus expected, OrderStatus next, Instant now) {
    final String sql =
        """
        UPDATE duel_orders
        SET status = :next,
            version = version + 1,
            updated_at = :now
        WHERE order_id = :orderId
          AND status = :expected
        """
            + RETURNING_COLUMNS;
    final MapSqlParameterSource params =
        idParams(orderId)
            .addValue("expected", expected.name())
            .addValue("next", next.name())
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private MapSqlParameterSource idParams(UUID orderId) {
    return new MapSqlParameterSource().addValue("orderId", orderId);
  }

  private OrderRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new OrderRecord(
        rs.getObject("order_id", UUID.class),
        rs.getString("owner_id"),
        ChipType.valueOf(rs.getString("chip_type")),
        rs.getLong("stake_per_game"),
        rs.getInt("games_planned"),
        OrderStatus.valueOf(rs.getString("status")),
        rs.getString("opponent_id"),
        getInstant(rs, "confirmation_deadline"),
        rs.getInt("missed_confirmations"),
        rs.getObject("match_id", UUID.class),
        rs.getLong("version"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));
  }
}

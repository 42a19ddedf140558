/*
 * どこで: Duel データアクセス
 * 何を: duel_users の登録/残高更新/信頼度カウンタ更新を行う
 * なぜ: 残高とカウンタの更新を単一の条件付き SQL に閉じ込め、同時実行でも不整合を起こさないため
 */
package com.twos.duel.repository;

import static com.twos.common.JdbcTimestampUtils.getInstant;
import static com.twos.common.JdbcTimestampUtils.toTimestamp;

import com.twos.duel.model.ReliabilityEvent;
import com.twos.duel.model.UserAccountRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserAccountRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT user_id, username, points_balance, total_deals, completed_deals,
             missed_confirmations, dropped_before_min_games, version, created_at, updated_at
      FROM duel_users
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 未登録なら作成して true を返す。既存ユーザーの残高や名前は変更しない。 */
  public boolean registerIfAbsent(
      String userId, String username, long initialBalance, Instant now) {
    final String sql =
        """
        INSERT INTO duel_users (
          user_id,
          username,
          points_balance,
          total_deals,
          completed_deals,
          missed_confirmations,
          dropped_before_min_games,
          version,
          created_at,
          updated_at
        ) VALUES (
          :userId,
          :username,
          :initialBalance,
          0,
          0,
          0,
          0,
          0,
          :now,
          :now
        )
        ON CONFLICT (user_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("username", username)
            .addValue("initialBalance", initialBalance)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params) == 1;
  }

  public Optional<UserAccountRecord> findById(String userId) {
    final String sql = SELECT_COLUMNS + "WHERE user_id = :userId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** 行ロックのみを取得する。戻り値はロックした行数。 */
  public int lockForUpdate(String userId) {
    final String sql = "SELECT user_id FROM duel_users WHERE user_id = :userId FOR UPDATE";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.queryForList(sql, params, String.class).size();
  }

  /** 残高が足りる場合のみ減算する。0 行なら残高不足かユーザー不在。 */
  public int debitIfSufficient(String userId, long amount, Instant now) {
    final String sql =
        """
        UPDATE duel_users
        SET points_balance = points_balance - :amount,
            version = version + 1,
            updated_at = :now
        WHERE user_id = :userId
          AND points_balance >= :amount
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("amount", amount)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int credit(String userId, long amount, Instant now) {
    final String sql =
        """
        UPDATE duel_users
        SET points_balance = points_balance + :amount,
            version = version + 1,
            updated_at = :now
        WHERE user_id = :userId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("amount", amount)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  // カウンタは加算のみ。読み出してから書き戻すと同時更新で取りこぼすため SQL 側で加算する
  public int incrementReliability(String userId, ReliabilityEvent event, Instant now) {
    final String sql =
        """
        UPDATE duel_users
        SET total_deals = total_deals + 1,
            completed_deals = completed_deals + :completedDelta,
            missed_confirmations = missed_confirmations + :missedDelta,
            dropped_before_min_games = dropped_before_min_games + :droppedDelta,
            version = version + 1,
            updated_at = :now
        WHERE user_id = :userId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("completedDelta", event == ReliabilityEvent.DUEL_COMPLETED ? 1 : 0)
            .addValue("missedDelta", event == ReliabilityEvent.MISSED_CONFIRMATION ? 1 : 0)
            .addValue("droppedDelta", event == ReliabilityEvent.DROPPED_BEFORE_MIN_GAMES ? 1 : 0)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public List<UserAccountRecord> findLeaderboard(int limit) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE total_deals > 0
            ORDER BY completed_deals::numeric / total_deals DESC, total_deals DESC, user_id
            LIMIT :limit
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private UserAccountRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserAccountRecord(
        rs.getString("user_id"),
        rs.getString("username"),
        rs.getLong("points_balance"),
        rs.getInt("total_deals"),
        rs.getInt("completed_deals"),
        rs.getInt("missed_confirmations"),
        rs.getInt("dropped_before_min_games"),
        rs.getLong("version"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));
  }
}

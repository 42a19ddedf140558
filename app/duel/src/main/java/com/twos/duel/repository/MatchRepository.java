/*
 * どこで: Duel データアクセス
 * 何を: duel_matches の作成/集計更新/終了処理を行う
 * なぜ: シリーズの集計を version 付き UPDATE で更新し、取りこぼしを検出するため
 */
package com.twos.duel.repository;

import static com.twos.common.JdbcTimestampUtils.getInstant;
import static com.twos.common.JdbcTimestampUtils.toTimestamp;

import com.twos.duel.model.MatchEndReason;
import com.twos.duel.model.MatchRecord;
import com.twos.duel.model.MatchStatus;
import com.twos.duel.model.OrderRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class MatchRepository {

  private static final String COLUMNS =
      """
      match_id, order_id, player_a_id, player_b_id, stake_per_game, games_planned, games_played,
      wins_a, wins_b, draws, status, winner_id, end_reason, version, created_at, updated_at,
      completed_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  // player A は注文作成者、player B は参加者
  public MatchRecord insert(UUID matchId, OrderRecord order, Instant now) {
    final String sql =
        """
        INSERT INTO duel_matches (
          match_id,
          order_id,
          player_a_id,
          player_b_id,
          stake_per_game,
          games_planned,
          games_played,
          wins_a,
          wins_b,
          draws,
          status,
          version,
          created_at,
          updated_at
        ) VALUES (
          :matchId,
          :orderId,
          :playerAId,
          :playerBId,
          :stakePerGame,
          :gamesPlanned,
          0,
          0,
          0,
          0,
          'IN_PROGRESS',
          0,
          :now,
          :now
        )
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("matchId", matchId)
            .addValue("orderId", order.orderId())
            .addValue("playerAId", order.ownerId())
            .addValue("playerBId", order.opponentId())
            .addValue("stakePerGame", order.stakePerGame())
            .addValue("gamesPlanned", order.gamesPlanned())
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<MatchRecord> findById(UUID matchId) {
    final String sql = "SELECT " + COLUMNS + " FROM duel_matches WHERE match_id = :matchId";
    return jdbcTemplate.query(sql, idParams(matchId), this::mapRow).stream().findFirst();
  }

  public Optional<MatchRecord> findByIdForUpdate(UUID matchId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM duel_matches WHERE match_id = :matchId FOR UPDATE";
    return jdbcTemplate.query(sql, idParams(matchId), this::mapRow).stream().findFirst();
  }

  /** 1 ラウンド分の結果を加算する。version が一致しない場合は空を返す。 */
  public Optional<MatchRecord> applyRoundResult(
      UUID matchId,
      long expectedVersion,
      int winsADelta,
      int winsBDelta,
      int drawsDelta,
      Instant now) {
    final String sql =
        """
        UPDATE duel_matches
        SET games_played = games_played + 1,
            wins_a = wins_a + :winsADelta,
            wins_b = wins_b + :winsBDelta,
            draws = draws + :drawsDelta,
            version = version + 1,
            updated_at = :now
        WHERE match_id = :matchId
          AND version = :expectedVersion
          AND status = 'IN_PROGRESS'
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        idParams(matchId)
            .addValue("expectedVersion", expectedVersion)
            .addValue("winsADelta", winsADelta)
            .addValue("winsBDelta", winsBDelta)
            .addValue("drawsDelta", drawsDelta)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<MatchRecord> finish(
      UUID matchId,
      long expectedVersion,
      MatchStatus status,
      String winnerId,
      MatchEndReason endReason,
      Instant now) {
    final String sql =
        """
        UPDATE duel_matches
        SET status = :status,
            winner_id = :winnerId,
            end_reason = :endReason,
            version = version + 1,
            updated_at = :now,
            completed_at = :now
        WHERE match_id = :matchId
          AND version = :expectedVersion
          AND status = 'IN_PROGRESS'
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        idParams(matchId)
            .addValue("expectedVersion", expectedVersion)
            .addValue("status", status.name())
            .addValue("winnerId", winnerId)
            .addValue("endReason", endReason.name())
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private MapSqlParameterSource idParams(UUID matchId) {
    return new MapSqlParameterSource().addValue("matchId", matchId);
  }

  private MatchRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String endReason = rs.getString("end_reason");
    return new MatchRecord(
        rs.getObject("match_id", UUID.class),
        rs.getObject("order_id", UUID.class),
        rs.getString("player_a_id"),
        rs.getString("player_b_id"),
        rs.getLong("stake_per_game"),
        rs.getInt("games_planned"),
        rs.getInt("games_played"),
        rs.getInt("wins_a"),
        rs.getInt("wins_b"),
        rs.getInt("draws"),
        MatchStatus.valueOf(rs.getString("status")),
        rs.getString("winner_id"),
        endReason == null ? null : MatchEndReason.valueOf(endReason),
        rs.getLong("version"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"),
        getInstant(rs, "completed_at"));
  }
}

/*
 * どこで: Duel データアクセス
 * 何を: duel_games (ラウンド) の作成/提出記録/確定を行う
 * なぜ: ラウンドの確定を status 条件付き UPDATE に限定し、結果を一度だけ書き込むため
 */
package com.twos.duel.repository;

import static com.twos.common.JdbcTimestampUtils.getInstant;
import static com.twos.common.JdbcTimestampUtils.getNullableInt;
import static com.twos.common.JdbcTimestampUtils.getNullableLong;
import static com.twos.common.JdbcTimestampUtils.toTimestamp;

import com.twos.duel.fairness.RoundOutcome;
import com.twos.duel.model.GameOutcome;
import com.twos.duel.model.GameRecord;
import com.twos.duel.model.GameStatus;
import com.twos.duel.model.PlayerSide;
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
public class GameRepository {

  private static final String COLUMNS =
      """
      game_id, match_id, round_number, status, started_at, deadline,
      player_a_number, player_a_submitted_at, player_b_number, player_b_submitted_at,
      outcome, time_slot, seed_slice, random_number, distance_a, distance_b, winner_id,
      finished_at, version
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  // (match_id, round_number) の一意制約により同じラウンドは二重に作られない
  public GameRecord insert(
      UUID gameId, UUID matchId, int roundNumber, Instant startedAt, Instant deadline) {
    final String sql =
        """
        INSERT INTO duel_games (
          game_id,
          match_id,
          round_number,
          status,
          started_at,
          deadline,
          version
        ) VALUES (
          :gameId,
          :matchId,
          :roundNumber,
          'AWAITING_SUBMISSIONS',
          :startedAt,
          :deadline,
          0
        )
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("gameId", gameId)
            .addValue("matchId", matchId)
            .addValue("roundNumber", roundNumber)
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("deadline", toTimestamp(deadline));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public List<GameRecord> findByMatchId(UUID matchId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM duel_games WHERE match_id = :matchId ORDER BY round_number";
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("matchId", matchId), this::mapRow);
  }

  public Optional<GameRecord> findByMatchAndRoundForUpdate(UUID matchId, int roundNumber) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM duel_games WHERE match_id = :matchId AND round_number = :roundNumber"
            + " FOR UPDATE";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("matchId", matchId)
            .addValue("roundNumber", roundNumber);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<GameRecord> findByIdForUpdateSkipLocked(UUID gameId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM duel_games WHERE game_id = :gameId FOR UPDATE SKIP LOCKED";
    return jdbcTemplate.query(
            sql, new MapSqlParameterSource().addValue("gameId", gameId), this::mapRow)
        .stream()
        .findFirst();
  }

  public List<UUID> findDueIds(Instant now, int limit) {
    final String sql =
        """
        SELECT game_id
        FROM duel_games
        WHERE status = 'AWAITING_SUBMISSIONS'
          AND deadline <= :now
        ORDER BY deadline
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getObject("game_id", UUID.class));
  }

  /**
   * 役割: 片側の提出値を記録し、締切を newDeadline へ更新する。
   * 動作: 未確定かつ同じ側が未提出の場合のみ更新し、更新後の行を返す。
   */
  public Optional<GameRecord> recordSubmission(
      UUID gameId, PlayerSide side, int number, Instant submittedAt, Instant newDeadline) {
    final String numberColumn = side == PlayerSide.A ? "player_a_number" : "player_b_number";
    final String submittedColumn =
        side == PlayerSide.A ? "player_a_submitted_at" : "player_b_submitted_at";
    final String sql =
        "UPDATE duel_games SET "
            + numberColumn
            + " = :number, "
            + submittedColumn
            + " = :submittedAt, deadline = :deadline, version = version + 1"
            + " WHERE game_id = :gameId AND status = 'AWAITING_SUBMISSIONS' AND "
            + numberColumn
            + " IS NULL RETURNING "
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("gameId", gameId)
            .addValue("number", number)
            .addValue("submittedAt", toTimestamp(submittedAt))
            .addValue("deadline", toTimestamp(newDeadline));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** 公平性エンジンの判定結果でラウンドを確定する。既に確定済みなら空を返す。 */
  public Optional<GameRecord> finishWithResult(
      UUID gameId, GameOutcome outcome, RoundOutcome result, Instant finishedAt) {
    final String sql =
        """
        UPDATE duel_games
        SET status = 'FINISHED',
            outcome = :outcome,
            time_slot = :timeSlot,
            seed_slice = :seedSlice,
            random_number = :randomNumber,
            distance_a = :distanceA,
            distance_b = :distanceB,
            winner_id = :winnerId,
            finished_at = :finishedAt,
            version = version + 1
        WHERE game_id = :gameId
          AND status = 'AWAITING_SUBMISSIONS'
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("gameId", gameId)
            .addValue("outcome", outcome.name())
            .addValue("timeSlot", result.timeSlot())
            .addValue("seedSlice", result.seedSlice())
            .addValue("randomNumber", result.randomNumber())
            .addValue("distanceA", result.distanceA())
            .addValue("distanceB", result.distanceB())
            .addValue("winnerId", result.winnerId())
            .addValue("finishedAt", toTimestamp(finishedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  // 期限切れ確定用。乱数は計算しないため公平性の列は NULL のまま
  public Optional<GameRecord> finishWithoutDraw(
      UUID gameId, GameOutcome outcome, String winnerId, Instant finishedAt) {
    final String sql =
        """
        UPDATE duel_games
        SET status = 'FINISHED',
            outcome = :outcome,
            winner_id = :winnerId,
            finished_at = :finishedAt,
            version = version + 1
        WHERE game_id = :gameId
          AND status = 'AWAITING_SUBMISSIONS'
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("gameId", gameId)
            .addValue("outcome", outcome.name())
            .addValue("winnerId", winnerId)
            .addValue("finishedAt", toTimestamp(finishedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private GameRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String outcome = rs.getString("outcome");
    return new GameRecord(
        rs.getObject("game_id", UUID.class),
        rs.getObject("match_id", UUID.class),
        rs.getInt("round_number"),
        GameStatus.valueOf(rs.getString("status")),
        getInstant(rs, "started_at"),
        getInstant(rs, "deadline"),
        getNullableInt(rs, "player_a_number"),
        getInstant(rs, "player_a_submitted_at"),
        getNullableInt(rs, "player_b_number"),
        getInstant(rs, "player_b_submitted_at"),
        outcome == null ? null : GameOutcome.valueOf(outcome),
        getNullableLong(rs, "time_slot"),
        rs.getString("seed_slice"),
        getNullableInt(rs, "random_number"),
        getNullableInt(rs, "distance_a"),
        getNullableInt(rs, "distance_b"),
        rs.getString("winner_id"),
        getInstant(rs, "finished_at"),
        rs.getLong("version"));
  }
}

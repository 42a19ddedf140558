/*
 * どこで: 公平性エンジン
 * 何を: HMAC-SHA256 で 1 ラウンドの乱数を導出し、提出値との距離で勝敗を決める
 * なぜ: 同じ入力なら誰が計算しても同じ結果になり、seed_slice だけで結果を検証できるようにするため
 */
package com.twos.duel.fairness;

import com.twos.duel.api.InvalidDuelRequestException;
import com.twos.duel.api.SeedSliceFormatException;
import com.twos.duel.config.FairnessProperties;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Locale;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

@Component
public class FairnessEngine {

  public static final int MIN_PLAYER_NUMBER = 0;
  public static final int MAX_PLAYER_NUMBER = 999_999;
  public static final int RANDOM_MODULUS = 1_000_000;
  public static final long TIME_SLOT_MILLIS = 30_000L;
  public static final int SEED_SLICE_LENGTH = 8;
  static final int DRAW_INDEX = -1;

  private static final String HMAC_ALGORITHM = "HmacSHA256";
  private static final char[] HEX = "0123456789abcdef".toCharArray();

  // Mac はスレッドセーフでないため、スレッドごとに初期化済みインスタンスを持つ
  private final ThreadLocal<Mac> macs;

  public FairnessEngine(FairnessProperties properties) {
    final String secret = properties == null ? null : properties.platformSecret();
    if (secret == null || secret.isBlank()) {
      throw new IllegalStateException("duel.fairness.platform-secret must be set");
    }
    final SecretKeySpec key =
        new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
    this.macs = ThreadLocal.withInitial(() -> newMac(key));
  }

  public static long timeSlotOf(Instant instant) {
    return Math.floorDiv(instant.toEpochMilli(), TIME_SLOT_MILLIS);
  }

  public RoundOutcome determineWinner(
      String duelId, int roundNumber, long timeSlot, PlayerNumber playerA, PlayerNumber playerB) {
    validateRoundInput(duelId, roundNumber, playerA, playerB);
    final String seedInput =
        String.join(
            ":",
            duelId,
            Integer.toString(roundNumber),
            Long.toString(timeSlot),
            playerA.playerId(),
            Integer.toString(playerA.number()),
            playerB.playerId(),
            Integer.toString(playerB.number()));
    final Mac mac = macs.get();
    final byte[] digest = mac.doFinal(seedInput.getBytes(StandardCharsets.UTF_8));
    final String seedSlice = toHex(digest).substring(0, SEED_SLICE_LENGTH);
    final Resolution resolution = resolve(seedSlice, playerA.number(), playerB.number());
    final String winnerId =
        switch (resolution.winnerIndex()) {
          case 0 -> playerA.playerId();
          case 1 -> playerB.playerId();
          default -> null;
        };
    return new RoundOutcome(
        seedInput,
        seedSlice,
        timeSlot,
        resolution.randomNumber(),
        resolution.distanceA(),
        resolution.distanceB(),
        winnerId,
        resolution.winnerIndex() == DRAW_INDEX,
        formula(seedSlice, resolution, playerA.number(), playerB.number()));
  }

  /**
   * 役割: 公開済みの seed_slice と提出値から勝敗を再計算し、主張された勝者と一致するか判定する。
   * 動作: 鍵は使わないため、誰でも同じ計算で検証できる。
   * 前提: claimedWinnerIndex は 0 (A) / 1 (B) / -1 (引き分け) のいずれか。
   */
  public VerificationResult verifyResult(
      String seedSlice, int playerANumber, int playerBNumber, int claimedWinnerIndex) {
    final String normalizedSlice = normalizeSeedSlice(seedSlice);
    validateNumber("player_a_number", playerANumber);
    validateNumber("player_b_number", playerBNumber);
    if (claimedWinnerIndex < DRAW_INDEX || claimedWinnerIndex > 1) {
      throw new InvalidDuelRequestException("claimed_winner_index must be -1, 0 or 1");
    }
    final Resolution resolution = resolve(normalizedSlice, playerANumber, playerBNumber);
    return new VerificationResult(
        resolution.winnerIndex() == claimedWinnerIndex,
        resolution.randomNumber(),
        resolution.distanceA(),
        resolution.distanceB(),
        resolution.winnerIndex(),
        resolution.winnerIndex() == DRAW_INDEX);
  }

  /** 確定済みラウンドの保存値から表示用の計算式を組み立てる。再計算はしない。 */
  public static String formula(
      String seedSlice,
      int randomNumber,
      int playerANumber,
      int distanceA,
      int playerBNumber,
      int distanceB) {
    final String verdict;
    if (distanceA == distanceB) {
      verdict = "draw";
    } else {
      verdict = distanceA < distanceB ? "player A wins" : "player B wins";
    }
    return String.format(
        Locale.ROOT,
        "0x%s mod %d = %d; |%d - %d| = %d; |%d - %d| = %d; %s",
        seedSlice,
        RANDOM_MODULUS,
        randomNumber,
        playerANumber,
        randomNumber,
        distanceA,
        playerBNumber,
        randomNumber,
        distanceB,
        verdict);
  }

  private static String formula(String seedSlice, Resolution resolution, int a, int b) {
    return formula(
        seedSlice, resolution.randomNumber(), a, resolution.distanceA(), b, resolution.distanceB());
  }

  private static Resolution resolve(String seedSlice, int playerANumber, int playerBNumber) {
    final int randomNumber = (int) (Long.parseLong(seedSlice, 16) % RANDOM_MODULUS);
    final int distanceA = Math.abs(playerANumber - randomNumber);
    final int distanceB = Math.abs(playerBNumber - randomNumber);
    final int winnerIndex;
    if (distanceA == distanceB) {
      winnerIndex = DRAW_INDEX;
    } else {
      winnerIndex = distanceA < distanceB ? 0 : 1;
    }
    return new Resolution(randomNumber, distanceA, distanceB, winnerIndex);
  }

  private static String normalizeSeedSlice(String seedSlice) {
    if (seedSlice == null || seedSlice.length() != SEED_SLICE_LENGTH) {
      throw new SeedSliceFormatException("seed_slice must be 8 hex characters");
    }
    for (int i = 0; i < seedSlice.length(); i++) {
      if (Character.digit(seedSlice.charAt(i), 16) < 0) {
        throw new SeedSliceFormatException("seed_slice must be 8 hex characters");
      }
    }
    return seedSlice.toLowerCase(Locale.ROOT);
  }

  private static void validateRoundInput(
      String duelId, int roundNumber, PlayerNumber playerA, PlayerNumber playerB) {
    if (duelId == null || duelId.isBlank()) {
      throw new InvalidDuelRequestException("duelId is required");
    }
    if (roundNumber < 1) {
      throw new InvalidDuelRequestException("roundNumber must be positive");
    }
    if (playerA == null || playerB == null) {
      throw new InvalidDuelRequestException("both players are required");
    }
    if (playerA.playerId() == null || playerA.playerId().isBlank()
        || playerB.playerId() == null || playerB.playerId().isBlank()) {
      throw new InvalidDuelRequestException("playerId is required");
    }
    validateNumber("player A number", playerA.number());
    validateNumber("player B number", playerB.number());
  }

  public static void validateNumber(String label, int number) {
    if (number < MIN_PLAYER_NUMBER || number > MAX_PLAYER_NUMBER) {
      throw new InvalidDuelRequestException(
          label + " must be between " + MIN_PLAYER_NUMBER + " and " + MAX_PLAYER_NUMBER);
    }
  }

  private static Mac newMac(SecretKeySpec key) {
    try {
      final Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(key);
      return mac;
    } catch (NoSuchAlgorithmException | InvalidKeyException ex) {
      throw new IllegalStateException("failed to initialize " + HMAC_ALGORITHM, ex);
    }
  }

  private static String toHex(byte[] bytes) {
    final char[] chars = new char[bytes.length * 2];
    for (int i = 0; i < bytes.length; i++) {
      final int value = bytes[i] & 0xff;
      chars[i * 2] = HEX[value >>> 4];
      chars[i * 2 + 1] = HEX[value & 0x0f];
    }
    return new String(chars);
  }

  private record Resolution(int randomNumber, int distanceA, int distanceB, int winnerIndex) {}
}

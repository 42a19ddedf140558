/*
 * どこで: Duel ドメインモデル
 * 何を: 注文で選べるチップ種別と 1 試合あたりの賭けポイントを定義する
 * なぜ: 賭け額を任意入力にせず固定の額面に限定するため
 */
package com.twos.duel.model;

public enum ChipType {
  SMILE(5),
  HEART(10),
  FIRE(25),
  RING(50);

  private final long pointsPerGame;

  ChipType(long pointsPerGame) {
    this.pointsPerGame = pointsPerGame;
  }

  public long pointsPerGame() {
    return pointsPerGame;
  }

  /**
   * 役割: API で受け取った chip_type 文字列を内部列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定を行い、未対応値は IllegalArgumentException を送出する。
   */
  public static ChipType fromValue(String value) {
    for (ChipType chipType : values()) {
      if (chipType.name().equalsIgnoreCase(value)) {
        return chipType;
      }
    }
    throw new IllegalArgumentException("unsupported chip_type: " + value);
  }
}

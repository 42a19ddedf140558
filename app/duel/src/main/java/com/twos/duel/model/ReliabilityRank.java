/*
 * どこで: Duel ドメインモデル
 * 何を: 信頼度係数の段階評価を定義する
 * なぜ: 対戦相手に見せる評価を係数の閾値で一意に決めるため
 */
package com.twos.duel.model;

public enum ReliabilityRank {
    TRUSTED(0.90d),
    RELIABLE(0.70d),
    AVERAGE(0.50d),
    RISKY(0.30d),
    UNRELIABLE(0.0d);

    private final double threshold;

    ReliabilityRank(double threshold) {
        this.threshold = threshold;
    }

    public double threshold() {
        return threshold;
    }

    public boolean isWarning() {
        return this == RISKY || this == UNRELIABLE;
    }

    // 閾値の高い順に宣言しているため、最初に満たした段階を返す
    public static ReliabilityRank fromCoefficient(double coefficient) {
        for (ReliabilityRank rank : values()) {
            if (coefficient >= rank.threshold) {
                return rank;
            }
        }
        return UNRELIABLE;
    }
}

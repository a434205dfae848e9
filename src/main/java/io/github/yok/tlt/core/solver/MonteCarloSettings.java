package io.github.yok.tlt.core.solver;

import io.github.yok.tlt.core.error.ConfigurationException;
import lombok.Value;

/**
 * モンテカルロ平均の設定です。
 */
@Value
public class MonteCarloSettings {

    /**
     * 乱れの実現回数です。
     */
    int realizations;

    /**
     * 乱数の種です（null の場合は実行ごとに決めます）。
     */
    Long seed;

    /**
     * 並列に実行するワーカ数です。
     */
    int parallelism;

    /**
     * 設定を生成します。
     *
     * @param realizations 実現回数です（1 以上）
     * @param seed 乱数の種です（null 可）
     * @param parallelism ワーカ数です（1 以上）
     * @throws ConfigurationException 実現回数またはワーカ数が 1 未満の場合に発生します
     */
    public MonteCarloSettings(int realizations, Long seed, int parallelism) {
        if (realizations < 1) {
            throw new ConfigurationException("realizations は 1 以上が必要です: " + realizations);
        }
        if (parallelism < 1) {
            throw new ConfigurationException("parallelism は 1 以上が必要です: " + parallelism);
        }
        this.realizations = realizations;
        this.seed = seed;
        this.parallelism = parallelism;
    }

    /**
     * 逐次実行・種なしの設定を生成します。
     *
     * @param realizations 実現回数です（1 以上）
     * @return 設定です
     */
    public static MonteCarloSettings sequential(int realizations) {
        return new MonteCarloSettings(realizations, null, 1);
    }
}

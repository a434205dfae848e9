package io.github.yok.tlt.core.solver;

import lombok.Value;

/**
 * 局在長の二乗のモンテカルロ平均と、その標準誤差・実現ごとのサンプルを保持するクラスです。
 *
 * <p>
 * サンプル配列は生成時と取得時にコピーします。
 * </p>
 */
@Value
public class AveragedLocalization {

    /**
     * 実現回数です。
     */
    int realizations;

    /**
     * 使用した乱数の種（マスター種）です。
     */
    long seed;

    /**
     * 第 1 輸送軸方向の平均 ⟨Lx²⟩ です。
     */
    double meanLx2;

    /**
     * 第 2 輸送軸方向の平均 ⟨Ly²⟩ です。
     */
    double meanLy2;

    /**
     * ⟨Lx²⟩ の標準誤差（s/√n）です。
     */
    double standardErrorLx2;

    /**
     * ⟨Ly²⟩ の標準誤差（s/√n）です。
     */
    double standardErrorLy2;

    /**
     * 実現ごとの Lx² です（実現番号順）。
     */
    double[] lx2Samples;

    /**
     * 実現ごとの Ly² です（実現番号順）。
     */
    double[] ly2Samples;

    /**
     * 平均結果を生成します。
     *
     * @param realizations 実現回数です
     * @param seed 使用したマスター種です
     * @param meanLx2 ⟨Lx²⟩ です
     * @param meanLy2 ⟨Ly²⟩ です
     * @param standardErrorLx2 ⟨Lx²⟩ の標準誤差です
     * @param standardErrorLy2 ⟨Ly²⟩ の標準誤差です
     * @param lx2Samples 実現ごとの Lx² です（null 不可）
     * @param ly2Samples 実現ごとの Ly² です（null 不可）
     */
    public AveragedLocalization(int realizations, long seed, double meanLx2, double meanLy2,
            double standardErrorLx2, double standardErrorLy2, double[] lx2Samples,
            double[] ly2Samples) {
        if (lx2Samples == null || ly2Samples == null) {
            throw new IllegalArgumentException("サンプル配列は null 不可です");
        }
        this.realizations = realizations;
        this.seed = seed;
        this.meanLx2 = meanLx2;
        this.meanLy2 = meanLy2;
        this.standardErrorLx2 = standardErrorLx2;
        this.standardErrorLy2 = standardErrorLy2;
        this.lx2Samples = lx2Samples.clone();
        this.ly2Samples = ly2Samples.clone();
    }

    /**
     * 実現ごとの Lx² のコピーを返します。
     *
     * @return 実現ごとの Lx² です
     */
    public double[] getLx2Samples() {
        return lx2Samples.clone();
    }

    /**
     * 実現ごとの Ly² のコピーを返します。
     *
     * @return 実現ごとの Ly² です
     */
    public double[] getLy2Samples() {
        return ly2Samples.clone();
    }
}

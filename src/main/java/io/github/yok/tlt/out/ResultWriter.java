package io.github.yok.tlt.out;

import io.github.yok.tlt.core.solver.AveragedLocalization;
import io.github.yok.tlt.core.solver.MobilityResult;
import io.github.yok.tlt.core.solver.ThermalParameters;

/**
 * 移動度の計算結果を出力する処理のインタフェースです。
 */
public interface ResultWriter {

    /**
     * 移動度と局在長の平均結果を出力します。
     *
     * @param mobility 移動度の計算結果です
     * @param averaged 局在長のモンテカルロ平均結果です
     * @param thermal 計算に使用した温度・散乱率です
     */
    void write(MobilityResult mobility, AveragedLocalization averaged, ThermalParameters thermal);
}

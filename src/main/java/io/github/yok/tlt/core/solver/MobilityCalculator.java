package io.github.yok.tlt.core.solver;

import static io.github.yok.tlt.core.solver.PhysicalConstants.BOLTZMANN;
import static io.github.yok.tlt.core.solver.PhysicalConstants.ELEMENTARY_CHARGE;
import static io.github.yok.tlt.core.solver.PhysicalConstants.JOULE_TO_EV;
import static io.github.yok.tlt.core.solver.PhysicalConstants.REDUCED_PLANCK;
import static io.github.yok.tlt.core.solver.PhysicalConstants.SQUARED_ANGSTROM_TO_CM2;

import com.google.common.base.Preconditions;

/**
 * 平均局在長から TLT 移動度を計算するクラスです。
 *
 * <pre>
 * τ = ħ / Γ                      （Γ は eV 単位）
 * μ = 1e-16 · e · ⟨L²⟩ / (2 τ k_B T)   [cm²/(V·s)]
 * </pre>
 */
public final class MobilityCalculator {

    /**
     * 平均結果と熱パラメータから移動度を計算します。
     *
     * @param averaged モンテカルロ平均の結果です（null 不可）
     * @param thermal 温度・散乱率です（null 不可）
     * @return 移動度の計算結果です
     * @throws NullPointerException 引数が null の場合に発生します
     */
    public MobilityResult calculate(AveragedLocalization averaged, ThermalParameters thermal) {
        Preconditions.checkNotNull(averaged, "averaged が null です。");
        return calculate(averaged.getMeanLx2(), averaged.getMeanLy2(), thermal);
    }

    /**
     * 平均局在長の二乗から移動度を計算します。
     *
     * @param averageLx2 第 1 輸送軸方向の平均 ⟨Lx²⟩ です
     * @param averageLy2 第 2 輸送軸方向の平均 ⟨Ly²⟩ です
     * @param thermal 温度・散乱率です（null 不可）
     * @return 移動度の計算結果です
     * @throws NullPointerException thermal が null の場合に発生します
     * @throws IllegalArgumentException 平均値が有限でない場合に発生します
     */
    public MobilityResult calculate(double averageLx2, double averageLy2,
            ThermalParameters thermal) {
        Preconditions.checkNotNull(thermal, "thermal が null です。");
        Preconditions.checkArgument(Double.isFinite(averageLx2) && Double.isFinite(averageLy2),
                "平均局在長は有限値である必要があります。Lx2=%s, Ly2=%s", averageLx2, averageLy2);

        double tau = relaxationTime(thermal.getInverseScatteringTime());
        double denominator = 2 * tau * BOLTZMANN * thermal.getTemperature();

        double mobilityX = SQUARED_ANGSTROM_TO_CM2 * ELEMENTARY_CHARGE * averageLx2 / denominator;
        double mobilityY = SQUARED_ANGSTROM_TO_CM2 * ELEMENTARY_CHARGE * averageLy2 / denominator;
        double mobilityAverage = SQUARED_ANGSTROM_TO_CM2 * ELEMENTARY_CHARGE * 0.5
                * (averageLx2 + averageLy2) / denominator;

        return new MobilityResult(averageLx2, averageLy2, mobilityX, mobilityY, mobilityAverage);
    }

    /**
     * 散乱時間 τ = ħ/Γ [s] を返します。
     *
     * @param inverseScatteringTime Γ [eV] です
     * @return 散乱時間です
     */
    public static double relaxationTime(double inverseScatteringTime) {
        return REDUCED_PLANCK * JOULE_TO_EV / inverseScatteringTime;
    }
}

package io.github.yok.tlt.core.solver;

/**
 * 移動度計算で使用する物理定数です（CODATA 2018、SI 単位）。
 *
 * <p>
 * 値は scipy.constants と一致させています。結果のビット互換性のため変更しないでください。
 * </p>
 */
public final class PhysicalConstants {

    /**
     * 電気素量 e [C] です。
     */
    public static final double ELEMENTARY_CHARGE = 1.602176634e-19;

    /**
     * 換算プランク定数 ħ [J·s] です。
     */
    public static final double REDUCED_PLANCK = 1.054571817e-34;

    /**
     * ボルツマン定数 k_B [J/K] です。
     */
    public static final double BOLTZMANN = 1.380649e-23;

    /**
     * J から eV への換算係数です。
     */
    public static final double JOULE_TO_EV = 6.241509074460763e+18;

    /**
     * 格子定数単位（Å）の二乗を cm² に換算する係数です。
     */
    public static final double SQUARED_ANGSTROM_TO_CM2 = 1e-16;

    private PhysicalConstants() {
    }
}

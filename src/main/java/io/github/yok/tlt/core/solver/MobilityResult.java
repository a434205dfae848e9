package io.github.yok.tlt.core.solver;

import lombok.Value;

/**
 * TLT 移動度の計算結果です。
 *
 * <p>
 * 局在長の二乗は格子定数単位（Å²）、移動度は cm²/(V·s) です。
 * </p>
 */
@Value
public class MobilityResult {

    /**
     * 第 1 輸送軸方向の平均 ⟨Lx²⟩ です。
     */
    double averageLx2;

    /**
     * 第 2 輸送軸方向の平均 ⟨Ly²⟩ です。
     */
    double averageLy2;

    /**
     * 第 1 輸送軸方向の移動度です。
     */
    double mobilityX;

    /**
     * 第 2 輸送軸方向の移動度です。
     */
    double mobilityY;

    /**
     * 輸送面内で平均した移動度です。
     */
    double mobilityAverage;
}

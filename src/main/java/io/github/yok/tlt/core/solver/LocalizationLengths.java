package io.github.yok.tlt.core.solver;

import lombok.Value;

/**
 * 1 実現における輸送面 2 軸方向の局在長の二乗です。
 */
@Value
public class LocalizationLengths {

    /**
     * 第 1 輸送軸方向の局在長の二乗 Lx² です。
     */
    double lx2;

    /**
     * 第 2 輸送軸方向の局在長の二乗 Ly² です。
     */
    double ly2;
}

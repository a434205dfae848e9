package io.github.yok.tlt.core.solver;

/**
 * キャリアの種別です。
 */
public enum CarrierType {

    /**
     * 正孔輸送です。価電子帯の上端が占有されるため、ボルツマン因子は exp(+βE) です。
     */
    HOLE(+1),

    /**
     * 電子輸送です。伝導帯の下端が占有されるため、ボルツマン因子は exp(-βE) です。
     */
    ELECTRON(-1);

    /**
     * ボルツマン因子の指数に掛ける符号です。
     */
    private final int boltzmannSign;

    CarrierType(int boltzmannSign) {
        this.boltzmannSign = boltzmannSign;
    }

    /**
     * ボルツマン因子の指数に掛ける符号（+1 または -1）を返します。
     *
     * @return 符号です
     */
    public int boltzmannSign() {
        return boltzmannSign;
    }

    /**
     * 正孔フラグからキャリア種別を返します。
     *
     * @param hole 正孔輸送の場合は true です
     * @return キャリア種別です
     */
    public static CarrierType fromHoleFlag(boolean hole) {
        return hole ? HOLE : ELECTRON;
    }
}

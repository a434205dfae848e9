package io.github.yok.tlt.core.lattice;

/**
 * 周期境界での最小イメージ補正の方式です。
 */
public enum MinimumImageMode {

    /**
     * ペアごとの最小イメージ補正です。
     *
     * <p>
     * スーパーセルの箱長 L に対し、変位成分が +L/2 を超えれば L を引き、-L/2 を下回れば L を足します。 変位の反対称性（disp[i,j] =
     * -disp[j,i]）を保ちます。
     * </p>
     */
    PER_PAIR,

    /**
     * 軸全体を一括で判定する補正です。
     *
     * <p>
     * 軸ごとに変位配列全体へ一括で判定を行います。判定は「軸に非ゼロ成分があるか」のフラグ（0/1）を 単位胞の格子長の ±1/2 と比較するもので、成立した場合は軸全体を
     * 一律にずらします。 通常の格子長（2 以上）では補正は発生しません。
     * </p>
     */
    LEGACY
}

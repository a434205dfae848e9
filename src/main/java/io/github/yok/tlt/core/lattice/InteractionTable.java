package io.github.yok.tlt.core.lattice;

import io.github.yok.tlt.core.error.ConfigurationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * 相互作用の種別コード表（距離カットオフと並進距離）です。
 *
 * <p>
 * {@code distances} のリスト位置 k（1 始まり）が種別コード k になります。 {@code translationDistance}
 * に一致するペアは予約コード {@link #TRANSLATION_TYPE} に上書きされます。
 * </p>
 */
@Getter
public final class InteractionTable {

    /**
     * 相互作用なしを表すコードです。
     */
    public static final int NO_INTERACTION = 0;

    /**
     * 並進距離に一致するペアへ割り当てる予約コードです。
     */
    public static final int TRANSLATION_TYPE = 3;

    /**
     * 距離一致判定の許容誤差です。
     */
    public static final double DISTANCE_TOLERANCE = 1e-4;

    /**
     * 種別コード 1..K に対応する距離の一覧です。
     */
    private final List<Double> distances;

    /**
     * 並進距離（格子定数の一つ）です。
     */
    private final double translationDistance;

    /**
     * コード表を生成します。
     *
     * @param distances 距離の一覧です（1 件以上、null 要素不可）
     * @param translationDistance 並進距離です（有限値）
     * @throws ConfigurationException 引数が不正な場合に発生します
     */
    public InteractionTable(List<Double> distances, double translationDistance) {
        if (distances == null || distances.isEmpty()) {
            throw new ConfigurationException("distances は 1 件以上が必要です");
        }
        List<Double> copy = new ArrayList<>(distances.size());
        for (Double d : distances) {
            if (d == null || !Double.isFinite(d) || d < 0.0) {
                throw new ConfigurationException("distances は 0 以上の有限値が必要です: " + distances);
            }
            copy.add(d);
        }
        if (!Double.isFinite(translationDistance)) {
            throw new ConfigurationException(
                    "translationDistance は有限値が必要です: " + translationDistance);
        }
        this.distances = Collections.unmodifiableList(copy);
        this.translationDistance = translationDistance;
    }

    /**
     * 2 つの距離が許容誤差内で一致するかを返します。
     *
     * @param distance 計測距離です
     * @param reference 基準距離です
     * @return 一致する場合は true です
     */
    static boolean matches(double distance, double reference) {
        return Math.abs(distance - reference) <= DISTANCE_TOLERANCE;
    }
}

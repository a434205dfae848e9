package io.github.yok.tlt.core.model;

import io.github.yok.tlt.core.error.ConfigurationException;
import java.util.List;
import lombok.Getter;

/**
 * タイトバインディングの結合定数と静的乱れの強度（単位 eV）を保持するクラスです。
 *
 * <p>
 * 分子間の値は種別コード 1, 2, 3 に対応する 3 要素で指定します。
 * </p>
 */
@Getter
public final class CouplingParameters {

    /**
     * 分子間の値の要素数です。
     */
    public static final int INTERMOLECULAR_TYPES = 3;

    /**
     * オンサイトエネルギー J_ii です。
     */
    private final double onsiteEnergy;

    /**
     * 分子間トランスファー積分 J_ij（種別 1, 2, 3）です。
     */
    private final double[] transferIntegrals;

    /**
     * オンサイトの乱れ強度 σ_ii です。
     */
    private final double onsiteDisorder;

    /**
     * 分子間の乱れ強度 σ_ij（種別 1, 2, 3）です。
     */
    private final double[] transferDisorders;

    /**
     * パラメータを生成します。
     *
     * @param onsiteEnergy オンサイトエネルギー J_ii です
     * @param transferIntegrals J_ij（3 要素）です
     * @param onsiteDisorder σ_ii です
     * @param transferDisorders σ_ij（3 要素）です
     * @throws ConfigurationException 要素数が 3 でない、または非有限値を含む場合に発生します
     */
    public CouplingParameters(double onsiteEnergy, double[] transferIntegrals,
            double onsiteDisorder, double[] transferDisorders) {
        this.onsiteEnergy = requireFinite("jii", onsiteEnergy);
        this.transferIntegrals = requireTriple("jij", transferIntegrals);
        this.onsiteDisorder = requireFinite("sigmaIi", onsiteDisorder);
        this.transferDisorders = requireTriple("sigmaIj", transferDisorders);
    }

    /**
     * リスト指定からパラメータを生成します。
     *
     * @param onsiteEnergy オンサイトエネルギー J_ii です
     * @param transferIntegrals J_ij（3 要素）です
     * @param onsiteDisorder σ_ii です
     * @param transferDisorders σ_ij（3 要素）です
     * @return パラメータです
     * @throws ConfigurationException リストが null、要素数が 3 でない、または null 要素を含む場合に発生します
     */
    public static CouplingParameters of(double onsiteEnergy, List<Double> transferIntegrals,
            double onsiteDisorder, List<Double> transferDisorders) {
        return new CouplingParameters(onsiteEnergy, toArray("jij", transferIntegrals),
                onsiteDisorder, toArray("sigmaIj", transferDisorders));
    }

    /**
     * 種別コードに対応する J_ij を返します。
     *
     * @param typeCode 種別コードです（1, 2, 3）
     * @return J_ij です
     */
    public double transferIntegral(int typeCode) {
        return transferIntegrals[typeCode - 1];
    }

    /**
     * 種別コードに対応する σ_ij を返します。
     *
     * @param typeCode 種別コードです（1, 2, 3）
     * @return σ_ij です
     */
    public double transferDisorder(int typeCode) {
        return transferDisorders[typeCode - 1];
    }

    /**
     * J_ij のコピーを返します。
     *
     * @return J_ij です
     */
    public double[] getTransferIntegrals() {
        return transferIntegrals.clone();
    }

    /**
     * σ_ij のコピーを返します。
     *
     * @return σ_ij です
     */
    public double[] getTransferDisorders() {
        return transferDisorders.clone();
    }

    private static double requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new ConfigurationException(name + " は有限値が必要です: " + value);
        }
        return value;
    }

    private static double[] requireTriple(String name, double[] values) {
        if (values == null || values.length != INTERMOLECULAR_TYPES) {
            throw new ConfigurationException(name + " は 3 要素が必要です: "
                    + (values == null ? "null" : values.length + " 要素"));
        }
        double[] copy = values.clone();
        for (double v : copy) {
            requireFinite(name, v);
        }
        return copy;
    }

    private static double[] toArray(String name, List<Double> values) {
        if (values == null) {
            throw new ConfigurationException(name + " は必須です");
        }
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            Double v = values.get(i);
            if (v == null) {
                throw new ConfigurationException(name + " に null が含まれています");
            }
            out[i] = v;
        }
        return out;
    }
}

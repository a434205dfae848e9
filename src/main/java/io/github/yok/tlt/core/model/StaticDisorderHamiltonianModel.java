package io.github.yok.tlt.core.model;

import io.github.yok.tlt.core.disorder.SymmetricGaussianSampler;
import io.github.yok.tlt.core.lattice.InteractionTopology;
import java.util.Random;
import lombok.Getter;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * 静的（凍結）乱れを持つタイトバインディング・ハミルトニアンのモデルです。
 *
 * <p>
 * H = H0 + Σ ⊙ G とします。H0 は対角に J_ii、種別コード t∈{1,2,3} の非対角に J_ij[t] を置いた決定的な行列、 Σ は同様に σ_ii と
 * σ_ij[t] から作る乱れ強度の行列、G は実現ごとに引く対称ガウス乱数行列です。 標準的な TLT では H_ii = 0 ですが、オンサイト項と局所的な乱れも扱えます。
 * </p>
 */
public final class StaticDisorderHamiltonianModel implements HamiltonianModel {

    /**
     * 結合定数と乱れ強度です。
     */
    @Getter
    private final CouplingParameters parameters;

    /**
     * 決定的なハミルトニアン H0 です。
     */
    private final DMatrixRMaj baseHamiltonian;

    /**
     * 乱れ強度の行列 Σ です。
     */
    private final DMatrixRMaj disorderMagnitudes;

    /**
     * 対称ガウス乱数行列の生成器です。
     */
    private final SymmetricGaussianSampler sampler;

    /**
     * モデルを生成します。
     *
     * @param topology 相互作用の分類結果です（null 不可）
     * @param parameters 結合定数と乱れ強度です（null 不可）
     * @param sampler 対称ガウス乱数行列の生成器です（null 不可）
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public StaticDisorderHamiltonianModel(InteractionTopology topology,
            CouplingParameters parameters, SymmetricGaussianSampler sampler) {
        if (topology == null) {
            throw new IllegalArgumentException("topology は null 不可です");
        }
        if (parameters == null) {
            throw new IllegalArgumentException("parameters は null 不可です");
        }
        if (sampler == null) {
            throw new IllegalArgumentException("sampler は null 不可です");
        }
        this.parameters = parameters;
        this.sampler = sampler;

        int n = topology.siteCount();
        this.baseHamiltonian = new DMatrixRMaj(n, n);
        this.disorderMagnitudes = new DMatrixRMaj(n, n);

        for (int i = 0; i < n; i++) {
            baseHamiltonian.set(i, i, parameters.getOnsiteEnergy());
            disorderMagnitudes.set(i, i, parameters.getOnsiteDisorder());

            for (int j = 0; j < n; j++) {
                if (i == j) {
                    continue;
                }
                int type = topology.typeOf(i, j);
                // 種別 1..3 以外（0 や 4 以上）は結合なし
                if (type < 1 || type > CouplingParameters.INTERMOLECULAR_TYPES) {
                    continue;
                }
                baseHamiltonian.set(i, j, parameters.transferIntegral(type));
                disorderMagnitudes.set(i, j, parameters.transferDisorder(type));
            }
        }
    }

    /**
     * サイト数 N を返します。
     *
     * @return サイト数です
     */
    @Override
    public int siteCount() {
        return baseHamiltonian.numRows;
    }

    /**
     * 乱れを 1 回引き、H = H0 + Σ ⊙ G を返します。
     *
     * @param random 乱数源です（null 不可）
     * @return ハミルトニアンです
     * @throws IllegalArgumentException random が null の場合に発生します
     */
    @Override
    public DMatrixRMaj sampleHamiltonian(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("random は null 不可です");
        }
        int n = siteCount();
        DMatrixRMaj gaussian = sampler.sample(n, random);

        DMatrixRMaj hamiltonian = new DMatrixRMaj(n, n);
        CommonOps_DDRM.elementMult(disorderMagnitudes, gaussian, hamiltonian);
        CommonOps_DDRM.addEquals(hamiltonian, baseHamiltonian);
        return hamiltonian;
    }

    /**
     * 決定的なハミルトニアン H0 のコピーを返します。
     *
     * @return H0 です
     */
    public DMatrixRMaj baseHamiltonian() {
        return baseHamiltonian.copy();
    }

    /**
     * 乱れ強度の行列 Σ のコピーを返します。
     *
     * @return Σ です
     */
    public DMatrixRMaj disorderMagnitudes() {
        return disorderMagnitudes.copy();
    }
}

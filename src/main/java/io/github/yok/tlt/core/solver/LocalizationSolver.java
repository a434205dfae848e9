package io.github.yok.tlt.core.solver;

import io.github.yok.tlt.core.error.NumericalException;
import io.github.yok.tlt.core.lattice.Lattice;
import io.github.yok.tlt.core.lattice.TransportPlane;
import io.github.yok.tlt.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.tlt.core.linearalgebra.EigenDecompositionBackend.Eigensystem;
import lombok.AccessLevel;
import lombok.Getter;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;

/**
 * 1 実現のハミルトニアンから、熱的に重み付けした局在長の二乗を計算するクラスです。
 *
 * <p>
 * 固有基底 |n⟩ で位置演算子の行列要素 ⟨n|x|m⟩ を求め、次の久保型の式で評価します。
 * </p>
 *
 * <pre>
 * L² = (1/Z) Σ_{n,m} w_n |(E_n - E_m) ⟨n|x|m⟩|² · 2 / (Γ² + (E_n - E_m)²)
 * w_n = exp(s β E_n),  Z = Σ_n w_n
 * </pre>
 *
 * <p>
 * s は正孔で +1、電子で -1 です。位置は格子定数単位の分率座標を使います。
 * </p>
 */
@Getter
public final class LocalizationSolver {

    /**
     * サイト座標を与える格子です。
     */
    private final Lattice lattice;

    /**
     * 輸送面です。
     */
    private final TransportPlane plane;

    /**
     * 温度・散乱率・キャリア種別です。
     */
    private final ThermalParameters thermal;

    /**
     * 固有分解バックエンドです。
     */
    private final EigenDecompositionBackend eigenBackend;

    /**
     * 第 1 輸送軸の座標（位置演算子の対角成分）です。
     */
    @Getter(AccessLevel.NONE)
    private final double[] firstAxisPositions;

    /**
     * 第 2 輸送軸の座標（位置演算子の対角成分）です。
     */
    @Getter(AccessLevel.NONE)
    private final double[] secondAxisPositions;

    /**
     * ソルバを生成します。
     *
     * @param lattice 格子です（null 不可）
     * @param plane 輸送面です（null 不可）
     * @param thermal 温度・散乱率・キャリア種別です（null 不可）
     * @param eigenBackend 固有分解バックエンドです（null 不可）
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public LocalizationSolver(Lattice lattice, TransportPlane plane, ThermalParameters thermal,
            EigenDecompositionBackend eigenBackend) {
        if (lattice == null) {
            throw new IllegalArgumentException("lattice は null 不可です");
        }
        if (plane == null) {
            throw new IllegalArgumentException("plane は null 不可です");
        }
        if (thermal == null) {
            throw new IllegalArgumentException("thermal は null 不可です");
        }
        if (eigenBackend == null) {
            throw new IllegalArgumentException("eigenBackend は null 不可です");
        }
        this.lattice = lattice;
        this.plane = plane;
        this.thermal = thermal;
        this.eigenBackend = eigenBackend;

        DMatrixRMaj positions = lattice.positions();
        this.firstAxisPositions = column(positions, plane.getFirst());
        this.secondAxisPositions = column(positions, plane.getSecond());
    }

    /**
     * ハミルトニアン 1 つについて局在長の二乗を計算します。
     *
     * @param hamiltonian N×N 実対称ハミルトニアンです（null 不可）
     * @return 輸送面 2 軸方向の局在長の二乗です
     * @throws IllegalArgumentException hamiltonian が null、または次元が格子と一致しない場合に発生します
     * @throws NumericalException 非有限値を含む、固有分解に失敗した、または結果が非有限の場合に発生します
     */
    public LocalizationLengths solve(DMatrixRMaj hamiltonian) {
        if (hamiltonian == null) {
            throw new IllegalArgumentException("hamiltonian は null 不可です");
        }
        int n = lattice.siteCount();
        if (hamiltonian.numRows != n || hamiltonian.numCols != n) {
            throw new IllegalArgumentException("hamiltonian の次元が格子と一致しません: "
                    + hamiltonian.numRows + "x" + hamiltonian.numCols + " vs " + n);
        }
        if (MatrixFeatures_DDRM.hasUncountable(hamiltonian)) {
            throw new NumericalException("ハミルトニアンに NaN/Inf が含まれています");
        }

        // 1) 固有分解（昇順）
        Eigensystem eigen = eigenBackend.decomposeSymmetric(hamiltonian);
        double[] energies = eigen.getEnergies();
        DMatrixRMaj vectors = eigen.getEigenvectors();

        // 2) ボルツマン重みと分配関数
        double[] weights = boltzmannWeights(energies);
        double partition = 0.0;
        for (double w : weights) {
            partition += w;
        }

        // 3) 固有基底での位置演算子 X' = V^T X V, Y' = V^T Y V
        DMatrixRMaj xPrime = transformDiagonal(vectors, firstAxisPositions);
        DMatrixRMaj yPrime = transformDiagonal(vectors, secondAxisPositions);

        // 4) 久保型の和
        double gammaSq = thermal.getInverseScatteringTime() * thermal.getInverseScatteringTime();
        double sumX = 0.0;
        double sumY = 0.0;
        for (int a = 0; a < n; a++) {
            double wa = weights[a];
            for (int b = 0; b < n; b++) {
                double diff = energies[a] - energies[b];
                double mx = xPrime.get(a, b) * diff;
                double my = yPrime.get(a, b) * diff;
                double kernel = 2.0 / (gammaSq + diff * diff);
                sumX += wa * mx * mx * kernel;
                sumY += wa * my * my * kernel;
            }
        }

        double lx2 = sumX / partition;
        double ly2 = sumY / partition;
        if (!Double.isFinite(lx2) || !Double.isFinite(ly2)) {
            throw new NumericalException("局在長が非有限になりました: Lx²=" + lx2 + ", Ly²=" + ly2);
        }
        return new LocalizationLengths(lx2, ly2);
    }

    /**
     * ボルツマン重み w_n = exp(s β E_n) を返します。
     *
     * <p>
     * 指数の最大値を引いてから exp を取ります。定数倍は w/Z で相殺されます。
     * </p>
     *
     * @param energies 固有値です
     * @return ボルツマン重みです
     */
    double[] boltzmannWeights(double[] energies) {
        double scale = thermal.getCarrierType().boltzmannSign() * thermal.beta();
        double maxExponent = Double.NEGATIVE_INFINITY;
        for (double e : energies) {
            maxExponent = Math.max(maxExponent, scale * e);
        }
        double[] weights = new double[energies.length];
        for (int i = 0; i < energies.length; i++) {
            weights[i] = Math.exp(scale * energies[i] - maxExponent);
        }
        return weights;
    }

    /**
     * 対角演算子 diag(x) を固有基底へ変換した V^T diag(x) V を返します。
     *
     * @param vectors 固有ベクトル行列 V です
     * @param diagonal 対角成分です
     * @return 変換後の行列です
     */
    private static DMatrixRMaj transformDiagonal(DMatrixRMaj vectors, double[] diagonal) {
        int n = vectors.numRows;
        // diag(x) V は V の各行 i を x_i 倍したもの
        DMatrixRMaj scaled = vectors.copy();
        for (int row = 0; row < n; row++) {
            double x = diagonal[row];
            for (int col = 0; col < n; col++) {
                scaled.set(row, col, x * vectors.get(row, col));
            }
        }
        DMatrixRMaj out = new DMatrixRMaj(n, n);
        CommonOps_DDRM.multTransA(vectors, scaled, out);
        return out;
    }

    /**
     * 行列の指定列を配列として返します。
     *
     * @param m 行列です
     * @param col 列インデックスです
     * @return 列の配列です
     */
    private static double[] column(DMatrixRMaj m, int col) {
        double[] out = new double[m.numRows];
        for (int row = 0; row < m.numRows; row++) {
            out[row] = m.get(row, col);
        }
        return out;
    }
}

package io.github.yok.tlt.core.lattice;

import io.github.yok.tlt.core.error.DimensionException;
import java.util.Arrays;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 周期境界条件のもとでサイト間の変位を求め、各ペアに相互作用の種別コードを割り当てるクラスです。
 *
 * <p>
 * 種別コードは次の順で上書きします（後段が前段より優先されます）。
 * </p>
 * <ol>
 * <li>距離一致：{@code |dist - d_k| <= 1e-4} のペアをコード k にする</li>
 * <li>並進距離一致：{@code |dist - translationDistance| <= 1e-4} のペアをコード 3 にする</li>
 * <li>コード 1 の細分：輸送面 2 軸の変位の符号が異なればコード 1 のまま、同じならコード 2 にする</li>
 * </ol>
 *
 * <pre>
 *       *      *     *
 *
 *   #      2#      3#
 *
 *       *      1*    *
 *
 *   #      #       #
 * </pre>
 *
 * <p>
 * 1→2 は同距離で向きが逆（コード 1）、1→3 はコード 2、2→3 はコード 3 です。
 * </p>
 */
@Getter
@Slf4j
public final class InteractionClassifier {

    /**
     * 種別コード表です。
     */
    private final InteractionTable table;

    /**
     * 輸送面です。
     */
    private final TransportPlane plane;

    /**
     * 最小イメージ補正の方式です。
     */
    private final MinimumImageMode minimumImageMode;

    /**
     * 分類器を生成します。
     *
     * @param table 種別コード表です（null 不可）
     * @param plane 輸送面です（null 不可）
     * @param minimumImageMode 最小イメージ補正の方式です（null 不可）
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public InteractionClassifier(InteractionTable table, TransportPlane plane,
            MinimumImageMode minimumImageMode) {
        if (table == null) {
            throw new IllegalArgumentException("table は null 不可です");
        }
        if (plane == null) {
            throw new IllegalArgumentException("plane は null 不可です");
        }
        if (minimumImageMode == null) {
            throw new IllegalArgumentException("minimumImageMode は null 不可です");
        }
        this.table = table;
        this.plane = plane;
        this.minimumImageMode = minimumImageMode;
    }

    /**
     * スーパーセル格子の全ペアを分類します。
     *
     * @param lattice スーパーセル格子です（null 不可）
     * @return 分類結果です
     * @throws IllegalArgumentException lattice が null の場合に発生します
     * @throws DimensionException PER_PAIR 補正で箱長が正でない場合に発生します
     */
    public InteractionTopology classify(SupercellLattice lattice) {
        if (lattice == null) {
            throw new IllegalArgumentException("lattice は null 不可です");
        }

        DMatrixRMaj cart = lattice.cartesianPositions();
        int n = cart.numRows;

        // 1) 全ペアの変位 disp[i,j] = cart[i] - cart[j]
        double[][][] displacements = new double[n][n][3];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                for (int axis = 0; axis < 3; axis++) {
                    displacements[i][j][axis] = cart.get(i, axis) - cart.get(j, axis);
                }
            }
        }

        // 並進距離の判定に使う補正前の距離（LEGACY 方式用）
        double[][] rawDistances = norms(displacements);

        // 2) 最小イメージ補正
        if (minimumImageMode == MinimumImageMode.PER_PAIR) {
            applyPerPairMinimumImage(displacements, lattice);
        } else {
            applyLegacyMinimumImage(displacements, lattice.getUnitCell());
        }

        double[][] distances = norms(displacements);

        // 3) 距離一致 → 4) 並進距離で上書き → 5) コード 1 の符号による細分
        int[][] typeCodes = new int[n][n];
        assignByDistance(typeCodes, distances);

        double[][] translationBasis =
                (minimumImageMode == MinimumImageMode.LEGACY) ? rawDistances : distances;
        overrideTranslation(typeCodes, translationBasis);

        refineTypeOne(typeCodes, displacements);

        if (log.isDebugEnabled()) {
            log.debug("相互作用の分類が完了しました。サイト数={}、補正方式={}、種別ごとのペア数={}", n, minimumImageMode,
                    countByType(typeCodes));
        }

        return new InteractionTopology(typeCodes, displacements, distances);
    }

    /**
     * ペアごとの最小イメージ補正を適用します。
     *
     * @param displacements 変位ベクトル（上書きします）
     * @param lattice スーパーセル格子です
     */
    private static void applyPerPairMinimumImage(double[][][] displacements,
            SupercellLattice lattice) {
        for (int axis = 0; axis < 3; axis++) {
            double box = lattice.boxLength(axis);
            if (!(box > 0.0)) {
                throw new DimensionException("格子ベクトルの対角成分は正が必要です: axis=" + axis + ", L=" + box);
            }
            double half = box / 2.0;
            for (double[][] row : displacements) {
                for (double[] d : row) {
                    if (d[axis] > half) {
                        d[axis] -= box;
                    } else if (d[axis] < -half) {
                        d[axis] += box;
                    }
                }
            }
        }
    }

    /**
     * LEGACY 方式の最小イメージ補正を適用します。
     *
     * <p>
     * 軸ごとに「非ゼロ成分の有無」のフラグ（0 または 1）を単位胞の格子長の ±1/2 と比較し、 成立した場合は軸全体を一律にずらします。
     * </p>
     *
     * @param displacements 変位ベクトル（上書きします）
     * @param unitCell 単位胞です
     */
    private static void applyLegacyMinimumImage(double[][][] displacements, UnitCell unitCell) {
        for (int axis = 0; axis < 3; axis++) {
            double length = unitCell.axisLength(axis);
            double half = length / 2.0;

            boolean anyNonZero = false;
            for (double[][] row : displacements) {
                for (double[] d : row) {
                    if (d[axis] != 0.0) {
                        anyNonZero = true;
                        break;
                    }
                }
                if (anyNonZero) {
                    break;
                }
            }
            double flag = anyNonZero ? 1.0 : 0.0;

            double shift;
            if (flag > half) {
                shift = -length;
            } else if (flag < -half) {
                shift = length;
            } else {
                continue;
            }

            log.warn("LEGACY 方式の最小イメージ補正で軸全体をずらします。axis={}、shift={}", axis, shift);
            for (double[][] row : displacements) {
                for (double[] d : row) {
                    d[axis] += shift;
                }
            }
        }
    }

    /**
     * 距離一致でコード 1..K を割り当てます（リスト順に後勝ち）。
     *
     * @param typeCodes 種別コード行列（上書きします）
     * @param distances 距離行列です
     */
    private void assignByDistance(int[][] typeCodes, double[][] distances) {
        int code = 1;
        for (double reference : table.getDistances()) {
            for (int i = 0; i < typeCodes.length; i++) {
                for (int j = 0; j < typeCodes.length; j++) {
                    if (InteractionTable.matches(distances[i][j], reference)) {
                        typeCodes[i][j] = code;
                    }
                }
            }
            code++;
        }
    }

    /**
     * 並進距離に一致するペアを予約コードに上書きします。
     *
     * @param typeCodes 種別コード行列（上書きします）
     * @param distances 判定に使う距離行列です
     */
    private void overrideTranslation(int[][] typeCodes, double[][] distances) {
        double reference = table.getTranslationDistance();
        for (int i = 0; i < typeCodes.length; i++) {
            for (int j = 0; j < typeCodes.length; j++) {
                if (InteractionTable.matches(distances[i][j], reference)) {
                    typeCodes[i][j] = InteractionTable.TRANSLATION_TYPE;
                }
            }
        }
    }

    /**
     * コード 1 のペアだけを、輸送面 2 軸の変位の符号で細分します。
     *
     * @param typeCodes 種別コード行列（上書きします）
     * @param displacements 補正後の変位ベクトルです
     */
    private void refineTypeOne(int[][] typeCodes, double[][][] displacements) {
        int p = plane.getFirst();
        int q = plane.getSecond();
        for (int i = 0; i < typeCodes.length; i++) {
            for (int j = 0; j < typeCodes.length; j++) {
                if (typeCodes[i][j] != 1) {
                    continue;
                }
                double signP = Math.signum(displacements[i][j][p]);
                double signQ = Math.signum(displacements[i][j][q]);
                // 符号が同じ（(+,+), (-,-), ゼロ同士）ならコード 2
                if (signP == signQ) {
                    typeCodes[i][j] = 2;
                }
            }
        }
    }

    /**
     * 変位ベクトルのノルム（距離行列）を計算します。
     *
     * @param displacements 変位ベクトルです
     * @return 距離行列です
     */
    private static double[][] norms(double[][][] displacements) {
        int n = displacements.length;
        double[][] out = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                double[] d = displacements[i][j];
                out[i][j] = Math.sqrt(d[0] * d[0] + d[1] * d[1] + d[2] * d[2]);
            }
        }
        return out;
    }

    /**
     * 種別コードごとのペア数（対角を除く）を数えます。
     *
     * @param typeCodes 種別コード行列です
     * @return 種別コードごとのペア数の文字列表現（添字 = コード）です
     */
    private static String countByType(int[][] typeCodes) {
        int max = 0;
        for (int[] row : typeCodes) {
            for (int code : row) {
                max = Math.max(max, code);
            }
        }
        int[] counts = new int[max + 1];
        for (int i = 0; i < typeCodes.length; i++) {
            for (int j = 0; j < typeCodes.length; j++) {
                if (i != j) {
                    counts[typeCodes[i][j]]++;
                }
            }
        }
        return Arrays.toString(counts);
    }
}

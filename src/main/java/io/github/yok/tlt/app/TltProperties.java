package io.github.yok.tlt.app;

import io.github.yok.tlt.core.lattice.MinimumImageMode;
import java.util.List;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * tlt-mobility の設定値（tlt.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * 必須項目（atoms, latticeVectors, plane, distances, translationDistance）に既定値はありません。
 * 欠落や不正値は {@link TltMobilityConfiguration} の Bean 生成時に ConfigurationException になります。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@ConfigurationProperties(prefix = "tlt")
public class TltProperties {

    /**
     * 結晶（単位胞）設定です。
     */
    private Crystal crystal = new Crystal();

    /**
     * スーパーセル設定です。
     */
    private Supercell supercell = new Supercell();

    /**
     * 輸送面の設定です。
     */
    private Transport transport = new Transport();

    /**
     * 相互作用の分類設定です。
     */
    private Interaction interaction = new Interaction();

    /**
     * 結合定数と乱れ強度の設定です。
     */
    private Coupling coupling = new Coupling();

    /**
     * 温度・散乱率・キャリア種別の設定です。
     */
    private Thermal thermal = new Thermal();

    /**
     * モンテカルロ平均の設定です。
     */
    private MonteCarlo monteCarlo = new MonteCarlo();

    /**
     * 出力設定です。
     */
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "tlt")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Crystal cr = getCrystal();
        Supercell sc = getSupercell();
        Interaction in = getInteraction();
        Coupling co = getCoupling();
        Thermal th = getThermal();
        MonteCarlo mc = getMonteCarlo();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "crystal",
                // atoms: 単位胞内の分子位置（分率座標）
                "atoms", cr.getAtoms(),
                // latticeVectors: 格子ベクトル（行 = ベクトル）
                "latticeVectors", cr.getLatticeVectors());

        appendSection(sb, nl, "supercell",
                "nx", sc.getNx(),
                "ny", sc.getNy(),
                "nz", sc.getNz());

        appendSection(sb, nl, "transport",
                // plane: 輸送面の 2 軸
                "plane", getTransport().getPlane());

        appendSection(sb, nl, "interaction",
                // distances: 種別コード 1..K に対応する距離
                "distances", in.getDistances(),
                // translationDistance: 種別 3 に上書きする並進距離
                "translationDistance", in.getTranslationDistance(),
                // minimumImage: 最小イメージ補正の方式
                "minimumImage", in.getMinimumImage());

        appendSection(sb, nl, "coupling",
                "jii", co.getJii(),
                "jij", co.getJij(),
                "sigmaIi", co.getSigmaIi(),
                "sigmaIj", co.getSigmaIj());

        appendSection(sb, nl, "thermal",
                // temperature: 温度 [K]
                "temperature", th.getTemperature(),
                // inverseHtau: 散乱時間の逆数 ħ/τ [eV]
                "inverseHtau", th.getInverseHtau(),
                // hole: 正孔輸送なら true
                "hole", th.isHole());

        appendSection(sb, nl, "monteCarlo",
                "realizations", mc.getRealizations(),
                // seed: 未指定なら実行ごとに決定
                "seed", mc.getSeed(),
                "parallelism", mc.getParallelism());

        appendSection(sb, nl, "output",
                "enabled", o.isEnabled(),
                "dir", o.getDir(),
                "name", o.getName());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * <pre>
     *   section:
     *     key: value
     * </pre>
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Crystal {

        /**
         * 単位胞内の分子位置です（各要素は格子定数単位の分率座標 3 成分）。
         */
        private List<List<Double>> atoms;

        /**
         * 格子ベクトルです（3×3、行 = 格子ベクトル、単位 Å）。
         */
        private List<List<Double>> latticeVectors;
    }

    @Data
    public static class Supercell {

        /**
         * x 方向の複製数です。
         */
        private int nx = 1;

        /**
         * y 方向の複製数です。
         */
        private int ny = 1;

        /**
         * z 方向の複製数です。
         */
        private int nz = 1;
    }

    @Data
    public static class Transport {

        /**
         * 輸送面の 2 軸です（例: yz 面は [1, 2]、必須）。
         */
        private List<Integer> plane;
    }

    @Data
    public static class Interaction {

        /**
         * 考慮する相互作用距離の一覧です（リスト位置が種別コード 1..K）。
         */
        private List<Double> distances;

        /**
         * 種別コード 3 に上書きする並進距離（格子定数の一つ）です。
         */
        private Double translationDistance;

        /**
         * 最小イメージ補正の方式です。
         */
        private MinimumImageMode minimumImage = MinimumImageMode.PER_PAIR;
    }

    @Data
    public static class Coupling {

        /**
         * オンサイトエネルギー J_ii [eV] です。
         */
        private double jii = 0.0;

        /**
         * 分子間トランスファー積分 J_ij（J_a, J_b, J_c）[eV] です。
         */
        private List<Double> jij = List.of();

        /**
         * 局所的な電子格子結合 σ_ii [eV] です。
         */
        private double sigmaIi = 0.0;

        /**
         * 非局所的な電子格子結合 σ_ij（σ_a, σ_b, σ_c）[eV] です。
         *
         * <p>
         * TLT ではこれを静的な乱れとして扱います。
         * </p>
         */
        private List<Double> sigmaIj = List.of();
    }

    @Data
    public static class Thermal {

        /**
         * 温度 [K] です。
         */
        private double temperature = 300.0;

        /**
         * 散乱時間の逆数 ħ/τ [eV] です。
         */
        private double inverseHtau = 5e-3;

        /**
         * 正孔輸送なら true、電子輸送なら false です。
         */
        private boolean hole = true;
    }

    @Data
    public static class MonteCarlo {

        /**
         * 平均に用いる乱れの実現回数です。
         */
        private int realizations = 250;

        /**
         * 乱数の種です（未指定なら実行ごとに決めます）。
         */
        private Long seed;

        /**
         * 並列に実行するワーカ数です。
         */
        private int parallelism = 1;
    }

    @Data
    public static class Output {

        /**
         * CSV を出力するかどうかです。
         */
        private boolean enabled = true;

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";

        /**
         * 出力ファイル名（拡張子なし）です。
         */
        private String name = "tlt_mobility";
    }
}

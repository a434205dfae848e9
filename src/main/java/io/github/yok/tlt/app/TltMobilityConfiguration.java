package io.github.yok.tlt.app;

import io.github.yok.tlt.core.disorder.SymmetricGaussianSampler;
import io.github.yok.tlt.core.error.ConfigurationException;
import io.github.yok.tlt.core.lattice.InteractionClassifier;
import io.github.yok.tlt.core.lattice.InteractionTable;
import io.github.yok.tlt.core.lattice.InteractionTopology;
import io.github.yok.tlt.core.lattice.Supercell;
import io.github.yok.tlt.core.lattice.SupercellLattice;
import io.github.yok.tlt.core.lattice.SupercellLatticeBuilder;
import io.github.yok.tlt.core.lattice.TransportPlane;
import io.github.yok.tlt.core.lattice.UnitCell;
import io.github.yok.tlt.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.tlt.core.linearalgebra.EjmlSymmetricEigenDecompositionBackend;
import io.github.yok.tlt.core.model.CouplingParameters;
import io.github.yok.tlt.core.model.HamiltonianModel;
import io.github.yok.tlt.core.model.StaticDisorderHamiltonianModel;
import io.github.yok.tlt.core.solver.CarrierType;
import io.github.yok.tlt.core.solver.LocalizationAverager;
import io.github.yok.tlt.core.solver.LocalizationSolver;
import io.github.yok.tlt.core.solver.MobilityCalculator;
import io.github.yok.tlt.core.solver.MonteCarloSettings;
import io.github.yok.tlt.core.solver.ThermalParameters;
import io.github.yok.tlt.out.CsvResultWriter;
import io.github.yok.tlt.out.ResultWriter;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * スーパーセル格子 + 静的乱れハミルトニアン + TLT 局在長ソルバの Bean 定義を行う設定クラスです。
 *
 * <p>
 * 設定値（tlt.*）をドメインの値オブジェクトに変換します。不正な設定は Bean 生成時（計算開始前）に
 * {@link ConfigurationException} などで失敗します。
 * </p>
 */
@Configuration
@RequiredArgsConstructor
public class TltMobilityConfiguration {

    /**
     * tlt-mobility の設定値（tlt.*）です。
     */
    private final TltProperties p;

    /**
     * 単位胞を生成します。
     *
     * @return 単位胞です
     */
    @Bean
    public UnitCell unitCell() {
        TltProperties.Crystal c = p.getCrystal();
        return new UnitCell(toMatrix("crystal.atoms", c.getAtoms()),
                toMatrix("crystal.latticeVectors", c.getLatticeVectors()));
    }

    /**
     * スーパーセル格子を生成します。
     *
     * @param unitCell 単位胞です
     * @return スーパーセル格子です
     */
    @Bean
    public SupercellLattice supercellLattice(UnitCell unitCell) {
        TltProperties.Supercell s = p.getSupercell();
        return new SupercellLatticeBuilder().build(unitCell,
                new Supercell(s.getNx(), s.getNy(), s.getNz()));
    }

    /**
     * 輸送面を生成します。
     *
     * @return 輸送面です
     */
    @Bean
    public TransportPlane transportPlane() {
        return TransportPlane.of(p.getTransport().getPlane());
    }

    /**
     * 相互作用の分類結果を生成します。
     *
     * @param lattice スーパーセル格子です
     * @param plane 輸送面です
     * @return 分類結果です
     */
    @Bean
    public InteractionTopology interactionTopology(SupercellLattice lattice, TransportPlane plane) {
        TltProperties.Interaction in = p.getInteraction();
        if (in.getTranslationDistance() == null) {
            throw new ConfigurationException("interaction.translationDistance は必須です");
        }
        InteractionTable table =
                new InteractionTable(in.getDistances(), in.getTranslationDistance());
        return new InteractionClassifier(table, plane, in.getMinimumImage()).classify(lattice);
    }

    /**
     * 静的乱れハミルトニアンのモデルを生成します。
     *
     * @param topology 相互作用の分類結果です
     * @return ハミルトニアンのモデルです
     */
    @Bean
    public HamiltonianModel hamiltonianModel(InteractionTopology topology) {
        TltProperties.Coupling c = p.getCoupling();
        CouplingParameters parameters =
                CouplingParameters.of(c.getJii(), c.getJij(), c.getSigmaIi(), c.getSigmaIj());
        return new StaticDisorderHamiltonianModel(topology, parameters,
                new SymmetricGaussianSampler());
    }

    /**
     * 温度・散乱率・キャリア種別を生成します。
     *
     * @return 熱パラメータです
     */
    @Bean
    public ThermalParameters thermalParameters() {
        TltProperties.Thermal t = p.getThermal();
        return new ThermalParameters(t.getTemperature(), t.getInverseHtau(),
                CarrierType.fromHoleFlag(t.isHole()));
    }

    /**
     * 固有分解バックエンドを生成します。
     *
     * @return 固有分解バックエンドです
     */
    @Bean
    public EigenDecompositionBackend eigenDecompositionBackend() {
        return new EjmlSymmetricEigenDecompositionBackend();
    }

    /**
     * 局在長ソルバを生成します。
     *
     * @param lattice スーパーセル格子です
     * @param plane 輸送面です
     * @param thermal 熱パラメータです
     * @param eigen 固有分解バックエンドです
     * @return 局在長ソルバです
     */
    @Bean
    public LocalizationSolver localizationSolver(SupercellLattice lattice, TransportPlane plane,
            ThermalParameters thermal, EigenDecompositionBackend eigen) {
        return new LocalizationSolver(lattice, plane, thermal, eigen);
    }

    /**
     * 局在長のモンテカルロ平均ロジックを生成します。
     *
     * @param model ハミルトニアンのモデルです
     * @param solver 局在長ソルバです
     * @return 平均化ロジックです
     */
    @Bean
    public LocalizationAverager localizationAverager(HamiltonianModel model,
            LocalizationSolver solver) {
        TltProperties.MonteCarlo mc = p.getMonteCarlo();
        return new LocalizationAverager(model, solver,
                new MonteCarloSettings(mc.getRealizations(), mc.getSeed(), mc.getParallelism()));
    }

    /**
     * 移動度の計算ロジックを生成します。
     *
     * @return 移動度の計算ロジックです
     */
    @Bean
    public MobilityCalculator mobilityCalculator() {
        return new MobilityCalculator();
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @param plane 輸送面です
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter(TransportPlane plane) {
        return new CsvResultWriter(p.getOutput().getDir(), p.getOutput().getName(), plane);
    }

    /**
     * 入れ子リストを 2 次元配列に変換します。
     *
     * @param name 設定項目名です（メッセージ用）
     * @param rows 入れ子リストです
     * @return 2 次元配列です
     * @throws ConfigurationException null または null 要素を含む場合に発生します
     */
    static double[][] toMatrix(String name, List<List<Double>> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new ConfigurationException(name + " は必須です");
        }
        double[][] out = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            List<Double> row = rows.get(i);
            if (row == null || row.contains(null)) {
                throw new ConfigurationException(name + " の " + i + " 行目が不正です: " + row);
            }
            out[i] = row.stream().mapToDouble(Double::doubleValue).toArray();
        }
        return out;
    }
}

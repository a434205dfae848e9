package io.github.yok.tlt.app;

import io.github.yok.tlt.core.lattice.SupercellLattice;
import io.github.yok.tlt.core.solver.AveragedLocalization;
import io.github.yok.tlt.core.solver.LocalizationAverager;
import io.github.yok.tlt.core.solver.MobilityCalculator;
import io.github.yok.tlt.core.solver.MobilityResult;
import io.github.yok.tlt.core.solver.ThermalParameters;
import io.github.yok.tlt.out.ResultWriter;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で TLT 移動度計算を実行するクラスです。
 *
 * <p>
 * 局在長をモンテカルロ平均し、移動度に換算して出力します。 途中で失敗・中断した場合は結果を出力しません。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class TltCliRunner implements CommandLineRunner {

    /**
     * tlt-mobility の設定値（tlt.*）です。
     */
    private final TltProperties properties;

    /**
     * スーパーセル格子です。
     */
    private final SupercellLattice lattice;

    /**
     * 熱パラメータです。
     */
    private final ThermalParameters thermal;

    /**
     * 局在長のモンテカルロ平均ロジックです。
     */
    private final LocalizationAverager averager;

    /**
     * 移動度の計算ロジックです。
     */
    private final MobilityCalculator mobilityCalculator;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== tlt-mobility start: transient localization mobility ===");
        System.out.print(properties.toMultilineString());

        System.out.println("入力: サイト数=" + lattice.siteCount() + "（単位胞 "
                + lattice.getUnitCell().atomCount() + " 分子 × " + lattice.getSupercell().cellCount()
                + " セル）、キャリア=" + thermal.getCarrierType());

        AveragedLocalization averaged = averager.average();
        MobilityResult mobility = mobilityCalculator.calculate(averaged, thermal);

        if (properties.getOutput().isEnabled()) {
            resultWriter.write(mobility, averaged, thermal);
        }

        System.out.println("結果: <Lx²>=" + fmt(mobility.getAverageLx2()) + " ± "
                + fmt(averaged.getStandardErrorLx2()) + ", <Ly²>=" + fmt(mobility.getAverageLy2())
                + " ± " + fmt(averaged.getStandardErrorLy2()) + "（Å²）");
        System.out.println("結果: μx=" + fmt(mobility.getMobilityX()) + ", μy="
                + fmt(mobility.getMobilityY()) + ", μavg=" + fmt(mobility.getMobilityAverage())
                + "（cm²/Vs）");
        System.out.println("=== tlt-mobility end ===");
    }

    /**
     * 数値を指数表記（有効数字 6 桁）の文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.6e", v);
    }
}

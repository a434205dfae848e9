package io.github.yok.tlt.out;

import io.github.yok.tlt.core.lattice.TransportPlane;
import io.github.yok.tlt.core.solver.AveragedLocalization;
import io.github.yok.tlt.core.solver.MobilityResult;
import io.github.yok.tlt.core.solver.ThermalParameters;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 計算結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（name は {@code tlt.output.name}、既定は {@code tlt_mobility}）。
 * </p>
 *
 * <ul>
 * <li>{@code <name>.csv}（key,value 形式：入力条件、平均局在長、標準誤差、移動度）</li>
 * <li>{@code <name>_localization.csv}（実現ごとの Lx², Ly²）</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * ファイル名に付ける計算名です。
     */
    private final String name;

    /**
     * 輸送面です（メタ情報として出力します）。
     */
    private final TransportPlane plane;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @param name ファイル名に付ける計算名です
     * @param plane 輸送面です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir, String name, TransportPlane plane) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("output.name は必須です");
        }
        if (plane == null) {
            throw new IllegalArgumentException("plane は null 不可です");
        }
        this.outputDir = Paths.get(outputDir);
        this.name = name;
        this.plane = plane;
    }

    /**
     * 移動度と局在長の平均結果を出力します。
     *
     * @param mobility 移動度の計算結果です
     * @param averaged 局在長のモンテカルロ平均結果です
     * @param thermal 計算に使用した温度・散乱率です
     * @throws IllegalArgumentException 引数が null の場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(MobilityResult mobility, AveragedLocalization averaged,
            ThermalParameters thermal) {
        if (mobility == null) {
            throw new IllegalArgumentException("mobility は null 不可です");
        }
        if (averaged == null) {
            throw new IllegalArgumentException("averaged は null 不可です");
        }
        if (thermal == null) {
            throw new IllegalArgumentException("thermal は null 不可です");
        }

        try {
            Files.createDirectories(outputDir);
            writeSummaryCsv(mobility, averaged, thermal);
            writeSamplesCsv(averaged);
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * 集計結果（key,value）を出力します。
     *
     * @param mobility 移動度の計算結果です
     * @param averaged 局在長の平均結果です
     * @param thermal 温度・散乱率です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeSummaryCsv(MobilityResult mobility, AveragedLocalization averaged,
            ThermalParameters thermal) throws IOException {

        Path file = summaryFile();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("input.plane", "[" + plane.getFirst() + ", " + plane.getSecond() + "]");
            pr.printRecord("input.temperature", thermal.getTemperature());
            pr.printRecord("input.inverseHtau", thermal.getInverseScatteringTime());
            pr.printRecord("input.carrier", thermal.getCarrierType());
            pr.printRecord("input.realizations", averaged.getRealizations());
            pr.printRecord("input.seed", averaged.getSeed());

            pr.printRecord("avgLx2", mobility.getAverageLx2());
            pr.printRecord("avgLy2", mobility.getAverageLy2());
            pr.printRecord("stderrLx2", averaged.getStandardErrorLx2());
            pr.printRecord("stderrLy2", averaged.getStandardErrorLy2());

            pr.printRecord("mobilityX", mobility.getMobilityX());
            pr.printRecord("mobilityY", mobility.getMobilityY());
            pr.printRecord("mobilityAverage", mobility.getMobilityAverage());
        }
    }

    /**
     * 実現ごとの局在長の二乗を出力します。
     *
     * @param averaged 局在長の平均結果です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeSamplesCsv(AveragedLocalization averaged) throws IOException {
        Path file = samplesFile();

        double[] lx2 = averaged.getLx2Samples();
        double[] ly2 = averaged.getLy2Samples();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("realization", "lx2", "ly2").build().print(w)) {

            for (int r = 0; r < lx2.length; r++) {
                pr.printRecord(r, lx2[r], ly2[r]);
            }
        }
    }

    /**
     * 集計結果のファイルパスを返します。
     *
     * @return ファイルパスです
     */
    Path summaryFile() {
        return outputDir.resolve(name + ".csv");
    }

    /**
     * 実現ごとの結果のファイルパスを返します。
     *
     * @return ファイルパスです
     */
    Path samplesFile() {
        return outputDir.resolve(name + "_localization.csv");
    }
}

package io.github.yok.tlt.core.solver;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.yok.tlt.core.error.NumericalException;
import io.github.yok.tlt.core.model.HamiltonianModel;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 乱れの実現ごとに「ハミルトニアン生成 → 局在長計算」を繰り返し、モンテカルロ平均を取るクラスです。
 *
 * <p>
 * 実現 r には、マスター種から事前に引いた種で初期化した専用の {@link Random} を渡します。 そのため結果はワーカ数に依存しません。
 * いずれかの実現が失敗した場合は平均全体を中断します（失敗した実現を飛ばすと推定が偏るためです）。
 * 呼び出しスレッドが割り込まれた場合は {@link CancellationException} を送出し、途中結果は返しません。
 * </p>
 */
@Getter
@Slf4j
public final class LocalizationAverager {

    /**
     * ハミルトニアンのモデルです。
     */
    private final HamiltonianModel model;

    /**
     * 局在長ソルバです。
     */
    private final LocalizationSolver solver;

    /**
     * モンテカルロ設定です。
     */
    private final MonteCarloSettings settings;

    /**
     * 平均化ロジックを生成します。
     *
     * @param model ハミルトニアンのモデルです（null 不可）
     * @param solver 局在長ソルバです（null 不可）
     * @param settings モンテカルロ設定です（null 不可）
     * @throws IllegalArgumentException 引数が null、またはモデルと格子のサイト数が一致しない場合に発生します
     */
    public LocalizationAverager(HamiltonianModel model, LocalizationSolver solver,
            MonteCarloSettings settings) {
        if (model == null) {
            throw new IllegalArgumentException("model は null 不可です");
        }
        if (solver == null) {
            throw new IllegalArgumentException("solver は null 不可です");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings は null 不可です");
        }
        if (model.siteCount() != solver.getLattice().siteCount()) {
            throw new IllegalArgumentException("model と lattice のサイト数が一致しません: "
                    + model.siteCount() + " vs " + solver.getLattice().siteCount());
        }
        this.model = model;
        this.solver = solver;
        this.settings = settings;
    }

    /**
     * 全実現を実行し、局在長の二乗の平均を返します。
     *
     * @return 平均結果です
     * @throws NumericalException いずれかの実現で数値計算が破綻した場合に発生します
     * @throws CancellationException 実行中に割り込まれた場合に発生します
     */
    public AveragedLocalization average() {
        int realizations = settings.getRealizations();
        long masterSeed =
                (settings.getSeed() != null) ? settings.getSeed() : new Random().nextLong();

        // 実現ごとの種を事前に引きます（ワーカ数によらず同じ乱数列になります）。
        Random master = new Random(masterSeed);
        long[] seeds = new long[realizations];
        for (int r = 0; r < realizations; r++) {
            seeds[r] = master.nextLong();
        }

        log.info("局在長のモンテカルロ平均を開始します。実現回数={}、サイト数={}、ワーカ数={}、種={}", realizations,
                model.siteCount(), settings.getParallelism(), masterSeed);

        long t0 = System.nanoTime();
        LocalizationLengths[] samples = (settings.getParallelism() == 1) ? runSequential(seeds)
                : runParallel(seeds, settings.getParallelism());
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;

        double[] lx2 = new double[realizations];
        double[] ly2 = new double[realizations];
        for (int r = 0; r < realizations; r++) {
            lx2[r] = samples[r].getLx2();
            ly2[r] = samples[r].getLy2();
        }

        double meanLx2 = mean(lx2);
        double meanLy2 = mean(ly2);
        double seLx2 = standardError(lx2, meanLx2);
        double seLy2 = standardError(ly2, meanLy2);

        log.info("モンテカルロ平均が完了しました。所要時間={}ms（<Lx²>={} ± {}、<Ly²>={} ± {}）", elapsedMs,
                fmt(meanLx2), fmt(seLx2), fmt(meanLy2), fmt(seLy2));

        return new AveragedLocalization(realizations, masterSeed, meanLx2, meanLy2, seLx2, seLy2,
                lx2, ly2);
    }

    /**
     * 実現 1 回分（乱れの生成と局在長計算）を実行します。
     *
     * @param seed この実現の乱数の種です
     * @return 局在長の二乗です
     */
    private LocalizationLengths runRealization(long seed) {
        DMatrixRMaj hamiltonian = model.sampleHamiltonian(new Random(seed));
        return solver.solve(hamiltonian);
    }

    /**
     * 呼び出しスレッドで逐次実行します。
     *
     * @param seeds 実現ごとの種です
     * @return 実現ごとの結果です
     */
    private LocalizationLengths[] runSequential(long[] seeds) {
        LocalizationLengths[] out = new LocalizationLengths[seeds.length];
        int logEvery = Math.max(1, seeds.length / 10);
        for (int r = 0; r < seeds.length; r++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("割り込みにより中断しました: 完了=" + r + "/" + seeds.length);
            }
            out[r] = runRealization(seeds[r]);
            logProgress(r + 1, seeds.length, logEvery, out[r]);
        }
        return out;
    }

    /**
     * 固定長スレッドプールで並列実行します。
     *
     * @param seeds 実現ごとの種です
     * @param parallelism ワーカ数です
     * @return 実現ごとの結果です
     */
    private LocalizationLengths[] runParallel(long[] seeds, int parallelism) {
        ExecutorService executor = Executors.newFixedThreadPool(parallelism,
                new ThreadFactoryBuilder().setNameFormat("tlt-realization-%d").setDaemon(true)
                        .build());
        List<Future<LocalizationLengths>> futures = new ArrayList<>(seeds.length);
        try {
            for (long seed : seeds) {
                futures.add(executor.submit(() -> runRealization(seed)));
            }

            LocalizationLengths[] out = new LocalizationLengths[seeds.length];
            int logEvery = Math.max(1, seeds.length / 10);
            for (int r = 0; r < seeds.length; r++) {
                // 完了済みの Future は割り込みを確認せずに返るため、ここで確認します。
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException(
                            "割り込みにより中断しました: 完了=" + r + "/" + seeds.length);
                }
                try {
                    out[r] = futures.get(r).get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    CancellationException ce = new CancellationException(
                            "割り込みにより中断しました: 完了=" + r + "/" + seeds.length);
                    ce.initCause(e);
                    throw ce;
                } catch (ExecutionException e) {
                    throw rethrow(r, e.getCause());
                }
                logProgress(r + 1, seeds.length, logEvery, out[r]);
            }
            return out;
        } finally {
            // 失敗・中断時は残りの実現を取り消します。
            for (Future<LocalizationLengths> f : futures) {
                f.cancel(true);
            }
            executor.shutdownNow();
        }
    }

    /**
     * ワーカで発生した例外を呼び出し側へ送出できる形にします。
     *
     * @param realization 実現番号です
     * @param cause 原因です
     * @return 送出する例外です
     */
    private static RuntimeException rethrow(int realization, Throwable cause) {
        log.error("実現 {} で失敗したため平均を中断します: {}", realization, String.valueOf(cause));
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new NumericalException("実現 " + realization + " で失敗しました", cause);
    }

    /**
     * 進捗をログ出力します。
     *
     * @param done 完了数です
     * @param total 全体数です
     * @param logEvery INFO で出力する間隔です
     * @param last 直近の結果です
     */
    private static void logProgress(int done, int total, int logEvery, LocalizationLengths last) {
        if (done % logEvery == 0 || done == total) {
            log.info("実現 {} / {} 完了", done, total);
        }
        if (log.isDebugEnabled()) {
            log.debug("実現 {}：Lx²={}、Ly²={}", done, fmt(last.getLx2()), fmt(last.getLy2()));
        }
    }

    /**
     * 算術平均を返します。
     *
     * @param values 値です（1 件以上）
     * @return 平均です
     */
    private static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * 平均の標準誤差 s/√n（s は不偏標準偏差）を返します。n = 1 の場合は 0 です。
     *
     * @param values 値です
     * @param mean 平均です
     * @return 標準誤差です
     */
    private static double standardError(double[] values, double mean) {
        int n = values.length;
        if (n < 2) {
            return 0.0;
        }
        double sumSq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        double variance = sumSq / (n - 1);
        return Math.sqrt(variance / n);
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

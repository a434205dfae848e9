package io.github.yok.tlt;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * tlt-mobility のエントリポイントです。
 *
 * <p>
 * tlt.* の設定クラスをスキャンし、移動度計算の CLI 実行を開始します。
 * </p>
 */
@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "io.github.yok.tlt")
public class TltMobilityApplication {

    /**
     * Spring Boot アプリケーションを起動します。
     *
     * @param args 起動引数です
     */
    public static void main(String[] args) {
        SpringApplication.run(TltMobilityApplication.class, args);
    }
}

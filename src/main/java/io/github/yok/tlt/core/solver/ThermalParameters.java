package io.github.yok.tlt.core.solver;

import io.github.yok.tlt.core.error.ConfigurationException;
import lombok.Value;

/**
 * 温度・散乱率・キャリア種別を保持するクラスです。
 */
@Value
public class ThermalParameters {

    /**
     * 温度 T [K] です。
     */
    double temperature;

    /**
     * 散乱時間の逆数 Γ = ħ/τ [eV] です。
     */
    double inverseScatteringTime;

    /**
     * キャリア種別です。
     */
    CarrierType carrierType;

    /**
     * パラメータを生成します。
     *
     * @param temperature 温度 T [K] です（正の有限値）
     * @param inverseScatteringTime Γ [eV] です（正の有限値）
     * @param carrierType キャリア種別です（null 不可）
     * @throws ConfigurationException 引数が不正な場合に発生します
     */
    public ThermalParameters(double temperature, double inverseScatteringTime,
            CarrierType carrierType) {
        if (!(temperature > 0.0) || !Double.isFinite(temperature)) {
            throw new ConfigurationException("temperature は正の有限値が必要です: " + temperature);
        }
        if (!(inverseScatteringTime > 0.0) || !Double.isFinite(inverseScatteringTime)) {
            throw new ConfigurationException(
                    "inverseHtau は正の有限値が必要です: " + inverseScatteringTime);
        }
        if (carrierType == null) {
            throw new ConfigurationException("carrierType は null 不可です");
        }
        this.temperature = temperature;
        this.inverseScatteringTime = inverseScatteringTime;
        this.carrierType = carrierType;
    }

    /**
     * 逆温度 β = 1/(k_B T) [1/eV] を返します。
     *
     * @return 逆温度です
     */
    public double beta() {
        return 1.0 / (PhysicalConstants.BOLTZMANN * PhysicalConstants.JOULE_TO_EV * temperature);
    }
}

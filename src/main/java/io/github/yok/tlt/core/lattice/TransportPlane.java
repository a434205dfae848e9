package io.github.yok.tlt.core.lattice;

import io.github.yok.tlt.core.error.ConfigurationException;
import java.util.List;
import lombok.Value;

/**
 * 2 次元の輸送面（例: yz 面は [1, 2]）を表すクラスです。
 */
@Value
public class TransportPlane {

    /**
     * 第 1 輸送軸です。
     */
    int first;

    /**
     * 第 2 輸送軸です。
     */
    int second;

    /**
     * 輸送面を生成します。
     *
     * @param first 第 1 輸送軸です（0, 1, 2）
     * @param second 第 2 輸送軸です（0, 1, 2、first と異なる）
     * @throws ConfigurationException 軸が範囲外、または同一の場合に発生します
     */
    public TransportPlane(int first, int second) {
        if (first < 0 || first > 2 || second < 0 || second > 2) {
            throw new ConfigurationException(
                    "plane の軸は 0, 1, 2 のいずれかです: [" + first + ", " + second + "]");
        }
        if (first == second) {
            throw new ConfigurationException(
                    "plane の 2 軸は異なる必要があります: [" + first + ", " + second + "]");
        }
        this.first = first;
        this.second = second;
    }

    /**
     * 軸リスト（長さ 2）から輸送面を生成します。
     *
     * @param axes 軸リストです
     * @return 輸送面です
     * @throws ConfigurationException 軸リストが null、または長さが 2 でない場合に発生します
     */
    public static TransportPlane of(List<Integer> axes) {
        if (axes == null || axes.size() != 2 || axes.contains(null)) {
            throw new ConfigurationException("plane は 2 軸の指定が必要です: " + axes);
        }
        return new TransportPlane(axes.get(0), axes.get(1));
    }
}

package io.github.yok.tlt.core.lattice;

import io.github.yok.tlt.core.error.DimensionException;
import lombok.Value;

/**
 * スーパーセルの複製数（nx, ny, nz）です。
 */
@Value
public class Supercell {

    /**
     * x 方向の複製数です。
     */
    int nx;

    /**
     * y 方向の複製数です。
     */
    int ny;

    /**
     * z 方向の複製数です。
     */
    int nz;

    /**
     * スーパーセルを生成します。
     *
     * @param nx x 方向の複製数です（1 以上）
     * @param ny y 方向の複製数です（1 以上）
     * @param nz z 方向の複製数です（1 以上）
     * @throws DimensionException いずれかが 1 未満の場合に発生します
     */
    public Supercell(int nx, int ny, int nz) {
        if (nx < 1 || ny < 1 || nz < 1) {
            throw new DimensionException(
                    "nx/ny/nz は 1 以上が必要です: " + nx + "x" + ny + "x" + nz);
        }
        this.nx = nx;
        this.ny = ny;
        this.nz = nz;
    }

    /**
     * セル数（nx·ny·nz）を返します。
     *
     * @return セル数です
     */
    public int cellCount() {
        return nx * ny * nz;
    }

    /**
     * 指定軸の複製数を返します。
     *
     * @param axis 軸インデックスです（0, 1, 2）
     * @return 複製数です
     */
    public int countAlong(int axis) {
        switch (axis) {
            case 0:
                return nx;
            case 1:
                return ny;
            case 2:
                return nz;
            default:
                throw new IllegalArgumentException("axis は 0, 1, 2 のいずれかです: " + axis);
        }
    }
}

package io.github.yok.dispersion.core.spectrum;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * 等間隔の波長グリッドを生成するクラスです。
 */
public final class WavelengthGrid {

    /**
     * 既定グリッドの開始波長（nm）です。
     */
    public static final double DEFAULT_START = 200.0;

    /**
     * 既定グリッドの終了波長（nm）です。
     */
    public static final double DEFAULT_END = 1000.0;

    /**
     * 既定グリッドの点数です。
     */
    public static final int DEFAULT_POINTS = 500;

    private WavelengthGrid() {}

    /**
     * 200 nm から 1000 nm までの 500 点の既定グリッドを返します。
     *
     * @return 既定グリッドです
     */
    public static double[] defaultGrid() {
        return linspace(DEFAULT_START, DEFAULT_END, DEFAULT_POINTS);
    }

    /**
     * start から end まで（両端を含む）points 点の等間隔グリッドを返します。
     *
     * @param start 開始波長（nm）です
     * @param end 終了波長（nm）です
     * @param points 点数です（2 以上）
     * @return グリッドです
     * @throws IllegalArgumentException 点数が 2 未満、または範囲が有限でない場合に発生します
     */
    public static double[] linspace(double start, double end, int points) {
        checkArgument(points >= 2, "points は 2 以上が必要です: %s", points);
        checkArgument(Double.isFinite(start) && Double.isFinite(end),
                "start/end は有限値が必要です: %s, %s", start, end);

        double[] grid = new double[points];
        double step = (end - start) / (points - 1);
        for (int i = 0; i < points; i++) {
            grid[i] = start + i * step;
        }
        // 終端は丸め誤差を持ち込まないよう厳密に合わせます。
        grid[points - 1] = end;
        return grid;
    }
}

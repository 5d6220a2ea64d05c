package io.github.yok.dispersion.out;

import io.github.yok.dispersion.core.spectrum.Spectrum;

/**
 * 評価結果（誘電率と屈折率のスペクトル）を出力する処理のインタフェースです。
 */
public interface ResultWriter {

    /**
     * 誘電率と屈折率のスペクトルを出力します。
     *
     * @param name 出力名（ファイル名の識別子）です
     * @param dielectric 誘電率のスペクトルです
     * @param refractiveIndex 屈折率のスペクトルです（波長は dielectric と同じ）
     * @param conjugate true の場合、値が ε1-iε2（n-ik）規約であることを表します
     */
    void write(String name, Spectrum dielectric, Spectrum refractiveIndex, boolean conjugate);
}

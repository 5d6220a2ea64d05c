package io.github.yok.dispersion.core.law;

import lombok.Value;

/**
 * 振動子モデルの 1 項分のパラメータ（振幅・共鳴位置・広がり）です。
 *
 * <p>
 * 共鳴位置と広がりの単位はモデルにより異なります（エネルギー表示なら eV、波長表示なら nm）。
 * </p>
 */
@Value
public class Oscillator {

    /**
     * 振幅です。
     */
    double amplitude;

    /**
     * 共鳴位置（エネルギーまたは波長）です。
     */
    double position;

    /**
     * 広がりです。
     */
    double broadening;
}

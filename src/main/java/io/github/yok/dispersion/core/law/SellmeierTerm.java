package io.github.yok.dispersion.core.law;

import lombok.Value;

/**
 * Sellmeier 式の 1 項分の係数です。
 */
@Value
public class SellmeierTerm {

    /**
     * n² への寄与係数 A です。
     */
    double a;

    /**
     * 共鳴位置 B（µm²）です。
     */
    double b;
}

package io.github.yok.dispersion.core.model;

import com.google.common.collect.ImmutableList;
import io.github.yok.dispersion.core.law.DispersionConfigurationException;
import java.util.List;

/**
 * 分散則の生成時パラメータを検査する共通処理です。
 */
final class ModelPreconditions {

    private ModelPreconditions() {}

    /**
     * パラメータの一覧が null でも空でもなく、null 要素を含まないことを検査し、不変リストとして返します。
     *
     * @param <T> 要素の型です
     * @param terms パラメータの一覧です
     * @param name エラーメッセージに使うパラメータ名です
     * @return 不変リストです
     * @throws DispersionConfigurationException 一覧が null、空、または null 要素を含む場合に発生します
     */
    static <T> ImmutableList<T> requireTerms(List<T> terms, String name) {
        if (terms == null || terms.isEmpty()) {
            throw new DispersionConfigurationException(name + " は 1 項以上が必要です");
        }
        for (int i = 0; i < terms.size(); i++) {
            if (terms.get(i) == null) {
                throw new DispersionConfigurationException(name + " に null が含まれています: index=" + i);
            }
        }
        return ImmutableList.copyOf(terms);
    }

    /**
     * 値が有限であることを検査します。
     *
     * @param value 値です
     * @param name エラーメッセージに使うパラメータ名です
     * @return 検査済みの値です
     * @throws DispersionConfigurationException 値が NaN または無限大の場合に発生します
     */
    static double requireFinite(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new DispersionConfigurationException(name + " は有限値である必要があります: " + value);
        }
        return value;
    }
}

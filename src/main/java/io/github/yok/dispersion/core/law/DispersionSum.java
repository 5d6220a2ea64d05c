package io.github.yok.dispersion.core.law;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import lombok.Getter;
import org.apache.commons.math3.complex.Complex;

/**
 * 2 つの分散則の誘電率を足し合わせる分散則です。
 *
 * <p>
 * 正規化や受動性の検査は行いません。入れ子の和は再帰ではなく明示的なスタックでたどるため、 {@code plus} を繰り返した長い連鎖でもスタックを溢れさせません。
 * </p>
 */
@Getter
public final class DispersionSum implements DispersionLaw {

    /**
     * 左オペランドです。
     */
    private final DispersionLaw left;

    /**
     * 右オペランドです。
     */
    private final DispersionLaw right;

    /**
     * 和の分散則を生成します。
     *
     * @param left 左オペランドです（null 不可）
     * @param right 右オペランドです（null 不可）
     */
    public DispersionSum(DispersionLaw left, DispersionLaw right) {
        this.left = checkNotNull(left, "left は null 不可です");
        this.right = checkNotNull(right, "right は null 不可です");
    }

    /**
     * 葉の分散則を左から順に評価して合計します。
     *
     * @param lbda 波長（nm）です
     * @return 誘電率の和です
     */
    @Override
    public Complex dielectric(double lbda) {
        Complex total = null;
        for (DispersionLaw leaf : flatten()) {
            Complex value = leaf.dielectric(lbda);
            total = (total == null) ? value : total.add(value);
        }
        return total;
    }

    /**
     * 波長配列に対して、葉ごとに配列評価してから要素ごとに合計します。
     *
     * @param lbda 波長配列（nm）です
     * @return 同じ長さ・順序の誘電率の和です
     */
    @Override
    public Complex[] dielectric(double[] lbda) {
        checkNotNull(lbda, "lbda は null 不可です");
        Complex[] total = null;
        for (DispersionLaw leaf : flatten()) {
            Complex[] values = leaf.dielectric(lbda);
            if (total == null) {
                total = values;
                continue;
            }
            for (int i = 0; i < total.length; i++) {
                total[i] = total[i].add(values[i]);
            }
        }
        return total;
    }

    /**
     * 和の木を左から順にたどり、和ではない分散則（葉）の一覧を返します。
     *
     * @return 評価順の葉の一覧です
     */
    public ImmutableList<DispersionLaw> flatten() {
        ImmutableList.Builder<DispersionLaw> leaves = ImmutableList.builder();
        Deque<DispersionLaw> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            DispersionLaw law = stack.pop();
            if (law instanceof DispersionSum) {
                DispersionSum sum = (DispersionSum) law;
                // 左を先に取り出すため、右から積みます。
                stack.push(sum.right);
                stack.push(sum.left);
            } else {
                leaves.add(law);
            }
        }
        return leaves.build();
    }
}

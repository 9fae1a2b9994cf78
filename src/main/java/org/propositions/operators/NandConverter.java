package org.propositions.operators;

import org.propositions.syntax.Formula;

/**
 * 转换到单运算符基 {-&amp;}。
 * <p>
 * 否定为 a-&amp;a；T 编码为 v-&amp;(v-&amp;v)，F 为 T-&amp;T。
 * XOR 与 IFF 共享中间项 x = (a|b)-&amp;(a-&amp;b)：x 本身就是 IFF，XOR 是 x 的否定。
 */
public class NandConverter extends AbstractBasisConverter {

    public NandConverter() {
        super();
    }

    public NandConverter(String defaultVariable) {
        super(defaultVariable);
    }

    @Override
    public Basis getBasis() {
        return Basis.NAND;
    }

    @Override
    protected Formula trueConstant(String variable) {
        Formula v = Formula.variable(variable);
        return Formula.nand(v, Formula.nand(v, v));
    }

    @Override
    protected Formula falseConstant(String variable) {
        Formula t = trueConstant(variable);
        return Formula.nand(t, t);
    }

    @Override
    protected Formula not(Formula a) {
        return Formula.nand(a, a);
    }

    @Override
    protected Formula and(Formula a, Formula b) {
        Formula x = Formula.nand(a, b);
        return Formula.nand(x, x);
    }

    // (a-&a)-&(b-&b)
    @Override
    protected Formula or(Formula a, Formula b) {
        return Formula.nand(not(a), not(b));
    }

    // a-&(b-&b)
    @Override
    protected Formula implies(Formula a, Formula b) {
        return Formula.nand(a, not(b));
    }

    @Override
    protected Formula xor(Formula a, Formula b) {
        return not(iff(a, b));
    }

    // ~((a|b)&~(a&b)) == (a<->b)
    @Override
    protected Formula iff(Formula a, Formula b) {
        return Formula.nand(or(a, b), Formula.nand(a, b));
    }

    @Override
    protected Formula nand(Formula a, Formula b) {
        return Formula.nand(a, b);
    }

    @Override
    protected Formula nor(Formula a, Formula b) {
        return not(or(a, b));
    }
}

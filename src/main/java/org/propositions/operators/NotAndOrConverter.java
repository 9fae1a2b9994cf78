package org.propositions.operators;

import org.propositions.syntax.Formula;

/**
 * 转换到基 {~, &amp;, |}。
 * T 编码为 (v|~v)，F 编码为 (v&amp;~v)，其余连接词按经典的德摩根/析取范式展开。
 */
public class NotAndOrConverter extends AbstractBasisConverter {

    public NotAndOrConverter() {
        super();
    }

    public NotAndOrConverter(String defaultVariable) {
        super(defaultVariable);
    }

    @Override
    public Basis getBasis() {
        return Basis.NOT_AND_OR;
    }

    @Override
    protected Formula trueConstant(String variable) {
        return Formula.or(Formula.variable(variable), Formula.not(Formula.variable(variable)));
    }

    @Override
    protected Formula falseConstant(String variable) {
        return Formula.and(Formula.variable(variable), Formula.not(Formula.variable(variable)));
    }

    @Override
    protected Formula not(Formula a) {
        return Formula.not(a);
    }

    @Override
    protected Formula and(Formula a, Formula b) {
        return Formula.and(a, b);
    }

    @Override
    protected Formula or(Formula a, Formula b) {
        return Formula.or(a, b);
    }

    // a->b == ~a|b
    @Override
    protected Formula implies(Formula a, Formula b) {
        return Formula.or(Formula.not(a), b);
    }

    // (a&~b)|(~a&b)
    @Override
    protected Formula xor(Formula a, Formula b) {
        return Formula.or(Formula.and(a, Formula.not(b)), Formula.and(Formula.not(a), b));
    }

    // (a&b)|(~a&~b)
    @Override
    protected Formula iff(Formula a, Formula b) {
        return Formula.or(Formula.and(a, b), Formula.and(Formula.not(a), Formula.not(b)));
    }

    @Override
    protected Formula nand(Formula a, Formula b) {
        return Formula.not(Formula.and(a, b));
    }

    @Override
    protected Formula nor(Formula a, Formula b) {
        return Formula.not(Formula.or(a, b));
    }
}

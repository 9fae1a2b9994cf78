package org.propositions.operators;

import org.propositions.syntax.Formula;

/**
 * 转换到基 {~, &amp;}。析取统一通过 a|b == ~(~a&amp;~b) 消去。
 */
public class NotAndConverter extends AbstractBasisConverter {

    public NotAndConverter() {
        super();
    }

    public NotAndConverter(String defaultVariable) {
        super(defaultVariable);
    }

    @Override
    public Basis getBasis() {
        return Basis.NOT_AND;
    }

    @Override
    protected Formula trueConstant(String variable) {
        return Formula.not(falseConstant(variable));
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
        return Formula.not(Formula.and(Formula.not(a), Formula.not(b)));
    }

    // ~(a&~b)
    @Override
    protected Formula implies(Formula a, Formula b) {
        return Formula.not(Formula.and(a, Formula.not(b)));
    }

    // (a|b)&~(a&b)
    @Override
    protected Formula xor(Formula a, Formula b) {
        return Formula.and(or(a, b), Formula.not(Formula.and(a, b)));
    }

    // (a&b)|(~a&~b)
    @Override
    protected Formula iff(Formula a, Formula b) {
        return or(Formula.and(a, b), Formula.and(Formula.not(a), Formula.not(b)));
    }

    @Override
    protected Formula nand(Formula a, Formula b) {
        return Formula.not(Formula.and(a, b));
    }

    // ~a&~b
    @Override
    protected Formula nor(Formula a, Formula b) {
        return Formula.and(Formula.not(a), Formula.not(b));
    }
}

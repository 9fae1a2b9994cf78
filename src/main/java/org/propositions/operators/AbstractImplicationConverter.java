package org.propositions.operators;

import org.propositions.syntax.Formula;

/**
 * 以蕴涵为主连接词的基的公共改写规则。子类只需给出否定的编码和常量。
 * <ul>
 *     <li>a|b == ~a-&gt;b</li>
 *     <li>a&amp;b == ~(a-&gt;~b)</li>
 *     <li>a&lt;-&gt;b == (a-&gt;b)&amp;(b-&gt;a)</li>
 *     <li>a+b == (a|b)&amp;~(a&amp;b)</li>
 * </ul>
 */
public abstract class AbstractImplicationConverter extends AbstractBasisConverter {

    protected AbstractImplicationConverter() {
        super();
    }

    protected AbstractImplicationConverter(String defaultVariable) {
        super(defaultVariable);
    }

    @Override
    protected Formula and(Formula a, Formula b) {
        return not(Formula.implies(a, not(b)));
    }

    @Override
    protected Formula or(Formula a, Formula b) {
        return Formula.implies(not(a), b);
    }

    @Override
    protected Formula implies(Formula a, Formula b) {
        return Formula.implies(a, b);
    }

    @Override
    protected Formula xor(Formula a, Formula b) {
        return and(or(a, b), not(and(a, b)));
    }

    @Override
    protected Formula iff(Formula a, Formula b) {
        return and(Formula.implies(a, b), Formula.implies(b, a));
    }

    @Override
    protected Formula nand(Formula a, Formula b) {
        return not(and(a, b));
    }

    @Override
    protected Formula nor(Formula a, Formula b) {
        return not(or(a, b));
    }
}

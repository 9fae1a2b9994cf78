package org.propositions.operators;

import org.propositions.syntax.Formula;

/**
 * 转换到基 {-&gt;, ~}。T 编码为 v-&gt;v，F 为 ~(v-&gt;v)。
 */
public class ImpliesNotConverter extends AbstractImplicationConverter {

    public ImpliesNotConverter() {
        super();
    }

    public ImpliesNotConverter(String defaultVariable) {
        super(defaultVariable);
    }

    @Override
    public Basis getBasis() {
        return Basis.IMPLIES_NOT;
    }

    @Override
    protected Formula trueConstant(String variable) {
        return Formula.implies(Formula.variable(variable), Formula.variable(variable));
    }

    @Override
    protected Formula falseConstant(String variable) {
        return Formula.not(trueConstant(variable));
    }

    @Override
    protected Formula not(Formula a) {
        return Formula.not(a);
    }
}

package org.propositions.operators;

import org.propositions.syntax.Formula;

/**
 * 转换到基 {-&gt;, F}。
 * <p>
 * 该基自带常量 F，因此不需要借用变量：F 保持原样，T 编码为 F-&gt;F，~a 编码为 a-&gt;F。
 * 不含变量的输入也会得到不含变量的输出。
 */
public class ImpliesFalseConverter extends AbstractImplicationConverter {

    public ImpliesFalseConverter() {
        super();
    }

    public ImpliesFalseConverter(String defaultVariable) {
        super(defaultVariable);
    }

    @Override
    public Basis getBasis() {
        return Basis.IMPLIES_FALSE;
    }

    @Override
    protected Formula trueConstant(String variable) {
        return Formula.implies(Formula.constant(false), Formula.constant(false));
    }

    @Override
    protected Formula falseConstant(String variable) {
        return Formula.constant(false);
    }

    @Override
    protected Formula not(Formula a) {
        return Formula.implies(a, Formula.constant(false));
    }
}

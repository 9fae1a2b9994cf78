package org.propositions.operators;

import org.propositions.syntax.Formula;

/**
 * 把任意命题公式改写为只使用某个目标基中运算符的等价公式。
 * <p>
 * 实现必须是全函数、无副作用且线程安全的：对每个合法公式都返回结果，
 * 结果只含 {@link #getBasis()} 允许的运算符，并且在任意赋值下与输入取值相同。
 * 若转换为表示常量而引入了输入中没有的变量，等价性对该变量的两种取值都成立。
 */
public interface BasisConverter {

    /**
     * @param formula 待转换的公式，不会被修改。
     * @return 新构造的、只使用目标基运算符的等价公式。
     */
    Formula convert(Formula formula);

    Basis getBasis();
}

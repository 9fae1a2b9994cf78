package org.propositions.operators;

import lombok.Getter;
import org.propositions.syntax.Formula;
import org.propositions.syntax.Operator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 支持的目标基，以及把公式转换到该基的转换器。
 * 基的运算符集合包含它允许出现的常量，例如 {-&gt;, F} 中的 F。
 * @author Ayalyt
 */
@Getter
public enum Basis {

    NOT_AND_OR(new NotAndOrConverter(), Operator.NOT, Operator.AND, Operator.OR),
    NOT_AND(new NotAndConverter(), Operator.NOT, Operator.AND),
    NAND(new NandConverter(), Operator.NAND),
    IMPLIES_NOT(new ImpliesNotConverter(), Operator.IMPLIES, Operator.NOT),
    IMPLIES_FALSE(new ImpliesFalseConverter(), Operator.IMPLIES, Operator.FALSE);

    private static final Logger logger = LoggerFactory.getLogger(Basis.class);

    private final BasisConverter converter;
    private final Set<Operator> operators;

    Basis(BasisConverter converter, Operator first, Operator... rest) {
        this.converter = converter;
        this.operators = Collections.unmodifiableSet(EnumSet.of(first, rest));
    }

    /**
     * @return formula 中出现的每个运算符（包括常量）是否都属于此基。
     */
    public boolean contains(Formula formula) {
        Set<Operator> used = formula.operators();
        boolean contained = operators.containsAll(used);
        if (!contained) {
            logger.debug("{} 使用了基 {} 之外的运算符: {}", formula, this, used);
        }
        return contained;
    }

    /**
     * 使用此基的默认转换器转换公式。
     */
    public Formula convert(Formula formula) {
        return converter.convert(formula);
    }
}

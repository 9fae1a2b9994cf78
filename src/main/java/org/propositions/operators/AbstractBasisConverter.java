package org.propositions.operators;

import lombok.Getter;
import org.propositions.syntax.Formula;
import org.propositions.syntax.Operator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.SortedSet;

/**
 * 所有基转换器共用的结构递归：变量原样复制，常量、否定和每个二元连接词
 * 分别交给子类的改写规则，改写规则收到的子公式已经转换完毕。
 * <p>
 * 对 {@link Operator} 的分派是穷举的 switch，新增运算符时编译器会要求补全所有转换器。
 * @author Ayalyt
 */
@Getter
public abstract class AbstractBasisConverter implements BasisConverter {

    private static final Logger logger = LoggerFactory.getLogger(AbstractBasisConverter.class);

    /**
     * 输入公式不含任何变量时，用来构造恒真式/矛盾式的变量名。
     */
    public static final String DEFAULT_VARIABLE = "p";

    private final String defaultVariable;

    protected AbstractBasisConverter() {
        this(DEFAULT_VARIABLE);
    }

    /**
     * @param defaultVariable 输入没有变量时用于表示常量的变量名。
     * @throws IllegalArgumentException 如果名字不是合法的变量名。
     */
    protected AbstractBasisConverter(String defaultVariable) {
        if (!Operator.isVariableName(defaultVariable)) {
            logger.error("{}: 默认变量名 '{}' 不合法", getClass().getSimpleName(), defaultVariable);
            throw new IllegalArgumentException("Illegal default variable name: '" + defaultVariable + "'");
        }
        this.defaultVariable = defaultVariable;
    }

    @Override
    public final Formula convert(Formula formula) {
        Objects.requireNonNull(formula, "Formula to convert cannot be null");
        String variable = chooseVariable(formula);
        Formula result = convert(formula, variable);
        logger.debug("{}: {} => {}", getBasis(), formula, result);
        return result;
    }

    /**
     * 为常量编码挑选变量：输入中字典序最小的变量，输入没有变量时使用默认变量名。
     * 一次调用中所有常量共用同一个变量。
     */
    String chooseVariable(Formula formula) {
        SortedSet<String> variables = formula.variables();
        if (variables.isEmpty()) {
            logger.debug("{} 中没有变量，常量将使用默认变量 {}", formula, defaultVariable);
            return defaultVariable;
        }
        return variables.first();
    }

    private Formula convert(Formula formula, String variable) {
        if (formula.isVariable()) {
            return Formula.variable(formula.getName());
        }
        return switch (formula.getOperator()) {
            case TRUE -> trueConstant(variable);
            case FALSE -> falseConstant(variable);
            case NOT -> not(convert(formula.getFirst(), variable));
            case AND -> and(convert(formula.getFirst(), variable), convert(formula.getSecond(), variable));
            case OR -> or(convert(formula.getFirst(), variable), convert(formula.getSecond(), variable));
            case IMPLIES -> implies(convert(formula.getFirst(), variable), convert(formula.getSecond(), variable));
            case XOR -> xor(convert(formula.getFirst(), variable), convert(formula.getSecond(), variable));
            case IFF -> iff(convert(formula.getFirst(), variable), convert(formula.getSecond(), variable));
            case NAND -> nand(convert(formula.getFirst(), variable), convert(formula.getSecond(), variable));
            case NOR -> nor(convert(formula.getFirst(), variable), convert(formula.getSecond(), variable));
        };
    }

    /**
     * @param variable 可用于构造恒真式的变量名。
     * @return 与常量 T 等价的公式。
     */
    protected abstract Formula trueConstant(String variable);

    /**
     * @param variable 可用于构造矛盾式的变量名。
     * @return 与常量 F 等价的公式。
     */
    protected abstract Formula falseConstant(String variable);

    protected abstract Formula not(Formula a);

    protected abstract Formula and(Formula a, Formula b);

    protected abstract Formula or(Formula a, Formula b);

    protected abstract Formula implies(Formula a, Formula b);

    protected abstract Formula xor(Formula a, Formula b);

    protected abstract Formula iff(Formula a, Formula b);

    protected abstract Formula nand(Formula a, Formula b);

    protected abstract Formula nor(Formula a, Formula b);

    @Override
    public String toString() {
        return getClass().getSimpleName() + getBasis().getOperators();
    }
}

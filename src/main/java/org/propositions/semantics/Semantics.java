package org.propositions.semantics;

import org.apache.commons.lang3.StringUtils;
import org.propositions.syntax.Formula;
import org.propositions.syntax.Operator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 命题公式的真值语义：求值、枚举模型、真值表以及基于真值表的恒真与等价判定。
 * @author Ayalyt
 */
public final class Semantics {

    private static final Logger logger = LoggerFactory.getLogger(Semantics.class);

    /**
     * 真值表枚举允许的最大变量数。模型是逐行生成的，内存占用与变量数无关，
     * 但耗时随 2^n 增长，超过后应改用 {@link org.propositions.symbolic.Z3Oracle}。
     */
    public static final int MAX_VARIABLES = 20;

    private Semantics() {
    }

    /**
     * 在给定模型下计算公式的真值。
     * 转换结果中被多次引用的子公式只求值一次。
     * @param formula 待求值的公式。
     * @param model 必须为公式中的每个变量赋值，可以包含多余的变量。
     * @return 公式在该模型下的真值。
     * @throws IllegalArgumentException 如果模型缺少公式中的某个变量。
     */
    public static boolean evaluate(Formula formula, Model model) {
        Objects.requireNonNull(formula, "Formula cannot be null");
        Objects.requireNonNull(model, "Model cannot be null");
        return evaluate(formula, model, new IdentityHashMap<>());
    }

    private static boolean evaluate(Formula formula, Model model, Map<Formula, Boolean> cache) {
        if (formula.isVariable()) {
            return model.getValue(formula.getName());
        }
        Boolean cached = cache.get(formula);
        if (cached != null) {
            return cached;
        }
        boolean value = switch (formula.getOperator()) {
            case TRUE -> true;
            case FALSE -> false;
            case NOT -> !evaluate(formula.getFirst(), model, cache);
            case AND -> evaluate(formula.getFirst(), model, cache) && evaluate(formula.getSecond(), model, cache);
            case OR -> evaluate(formula.getFirst(), model, cache) || evaluate(formula.getSecond(), model, cache);
            case IMPLIES -> !evaluate(formula.getFirst(), model, cache) || evaluate(formula.getSecond(), model, cache);
            case XOR -> evaluate(formula.getFirst(), model, cache) != evaluate(formula.getSecond(), model, cache);
            case IFF -> evaluate(formula.getFirst(), model, cache) == evaluate(formula.getSecond(), model, cache);
            case NAND -> !(evaluate(formula.getFirst(), model, cache) && evaluate(formula.getSecond(), model, cache));
            case NOR -> !(evaluate(formula.getFirst(), model, cache) || evaluate(formula.getSecond(), model, cache));
        };
        cache.put(formula, value);
        return value;
    }

    /**
     * 枚举给定变量上的全部 2^n 个模型，顺序与真值表一致：
     * 第一个变量是最高位，全假的模型排在最前。
     * 模型在迭代时逐个生成，不会同时保存在内存中。
     * @param variables 变量名，按迭代顺序决定位次，重复的名字只计一次。
     * @return 可重复迭代的全部模型。
     * @throws IllegalArgumentException 如果变量数超过 {@link #MAX_VARIABLES}，或某个名字不是合法变量名。
     */
    public static Iterable<Model> allModels(Collection<String> variables) {
        Objects.requireNonNull(variables, "Variables cannot be null");
        List<String> ordered = new ArrayList<>(new LinkedHashSet<>(variables));
        int n = ordered.size();
        if (n > MAX_VARIABLES) {
            logger.error("变量数 {} 超过了真值表枚举的上限 {}", n, MAX_VARIABLES);
            throw new IllegalArgumentException("Too many variables for truth-table enumeration: " + n);
        }
        for (String variable : ordered) {
            if (!Operator.isVariableName(variable)) {
                logger.error("非法的变量名: '{}'", variable);
                throw new IllegalArgumentException("Illegal variable name: '" + variable + "'");
            }
        }
        logger.debug("为变量 {} 枚举 {} 个模型", ordered, 1 << n);
        return () -> new ModelIterator(ordered);
    }

    /**
     * 按行号逐个生成模型，第 row 行中第 i 个变量取 row 的第 (n-1-i) 位。
     */
    private static final class ModelIterator implements Iterator<Model> {

        private final List<String> variables;
        private final int rows;
        private int row;

        private ModelIterator(List<String> variables) {
            this.variables = variables;
            this.rows = 1 << variables.size();
        }

        @Override
        public boolean hasNext() {
            return row < rows;
        }

        @Override
        public Model next() {
            if (!hasNext()) {
                throw new NoSuchElementException("All " + rows + " models have been enumerated");
            }
            int n = variables.size();
            Map<String, Boolean> assignment = new TreeMap<>();
            for (int i = 0; i < n; i++) {
                assignment.put(variables.get(i), ((row >> (n - 1 - i)) & 1) == 1);
            }
            row++;
            return Model.of(assignment);
        }
    }

    public static List<Boolean> truthValues(Formula formula, Iterable<Model> models) {
        List<Boolean> values = new ArrayList<>();
        for (Model model : models) {
            values.add(evaluate(formula, model));
        }
        return values;
    }

    public static boolean isTautology(Formula formula) {
        for (Model model : allModels(formula.variables())) {
            if (!evaluate(formula, model)) {
                logger.debug("{} 在 {} 下为假，不是恒真式", formula, model);
                return false;
            }
        }
        return true;
    }

    public static boolean isContradiction(Formula formula) {
        return !isSatisfiable(formula);
    }

    public static boolean isSatisfiable(Formula formula) {
        for (Model model : allModels(formula.variables())) {
            if (evaluate(formula, model)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 判断两个公式是否语义等价：在两者变量并集上的每个模型下真值相同。
     * 只在一侧出现的变量（例如转换时为常量引入的变量）会取遍两种真值。
     */
    public static boolean areEquivalent(Formula left, Formula right) {
        SortedSet<String> variables = new TreeSet<>(left.variables());
        variables.addAll(right.variables());
        for (Model model : allModels(variables)) {
            if (evaluate(left, model) != evaluate(right, model)) {
                logger.debug("{} 与 {} 在 {} 下取值不同", left, right, model);
                return false;
            }
        }
        return true;
    }

    /**
     * 生成公式的真值表，例如：
     * <pre>
     * | p | q | (p&amp;q) |
     * |---|---|-------|
     * | F | F | F     |
     * </pre>
     */
    public static String truthTable(Formula formula) {
        List<String> columns = new ArrayList<>(formula.variables());
        String header = formula.toString();
        columns.add(header);

        StringBuilder table = new StringBuilder();
        table.append('|');
        for (String column : columns) {
            table.append(' ').append(column).append(" |");
        }
        table.append('\n').append('|');
        for (String column : columns) {
            table.append(StringUtils.repeat('-', column.length() + 2)).append('|');
        }
        table.append('\n');

        for (Model model : allModels(formula.variables())) {
            table.append('|');
            for (String variable : formula.variables()) {
                table.append(' ').append(StringUtils.rightPad(model.getValue(variable) ? "T" : "F", variable.length()))
                        .append(" |");
            }
            table.append(' ').append(StringUtils.rightPad(evaluate(formula, model) ? "T" : "F", header.length()))
                    .append(" |\n");
        }
        return table.toString();
    }
}

package org.propositions.syntax;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 把 {@link Formula#toString()} 生成的全括号中缀形式解析回公式树。
 * <pre>
 * formula := variable | 'T' | 'F' | '~' formula | '(' formula binop formula ')'
 * variable := [p-z][0-9]*
 * binop    := '&' | '|' | '->' | '+' | '<->' | '-&' | '-|'
 * </pre>
 * 语法中不允许空白。
 * @author Ayalyt
 */
public final class FormulaParser {

    private static final Logger logger = LoggerFactory.getLogger(FormulaParser.class);

    private FormulaParser() {
    }

    /**
     * 解析整个字符串。
     * @param input 公式的字符串表示。
     * @return 解析得到的公式。
     * @throws IllegalArgumentException 如果字符串不是一个合法公式，或公式之后还有多余字符。
     */
    public static Formula parse(String input) {
        Pair<Formula, String> result = parsePrefix(input);
        if (!result.getRight().isEmpty()) {
            logger.error("公式 '{}' 之后有多余的输入: '{}'", result.getLeft(), result.getRight());
            throw new IllegalArgumentException("Unexpected trailing input '" + result.getRight()
                    + "' after formula " + result.getLeft());
        }
        logger.debug("解析完成: {}", result.getLeft());
        return result.getLeft();
    }

    /**
     * 解析 input 开头的最长公式。
     * @param input 待解析的字符串。
     * @return (公式, 剩余未解析的后缀)。
     * @throws IllegalArgumentException 如果 input 不以合法公式开头。
     */
    public static Pair<Formula, String> parsePrefix(String input) {
        if (StringUtils.isEmpty(input)) {
            logger.error("尝试解析空字符串");
            throw new IllegalArgumentException("Cannot parse an empty string");
        }
        Cursor cursor = new Cursor(input);
        Formula formula = cursor.formula();
        return Pair.of(formula, input.substring(cursor.position));
    }

    /**
     * @return input 是否恰好是一个合法公式。
     */
    public static boolean isFormula(String input) {
        try {
            parse(input);
            return true;
        } catch (IllegalArgumentException e) {
            logger.debug("'{}' 不是合法公式: {}", input, e.getMessage());
            return false;
        }
    }

    /**
     * 单次解析的状态，position 指向下一个未消费的字符。
     */
    private static final class Cursor {

        private final String input;
        private int position;

        private Cursor(String input) {
            this.input = input;
        }

        private Formula formula() {
            if (position >= input.length()) {
                throw fail("Unexpected end of input, expected a formula");
            }
            char c = input.charAt(position);
            if (c >= 'p' && c <= 'z') {
                return variable();
            }
            if (c == '(') {
                position++;
                Formula first = formula();
                Operator operator = Operator.matchAt(input, position);
                if (operator == null || !operator.isBinary()) {
                    throw fail("Expected a binary operator");
                }
                position += operator.getSymbol().length();
                Formula second = formula();
                if (position >= input.length() || input.charAt(position) != ')') {
                    throw fail("Expected ')'");
                }
                position++;
                return Formula.of(operator, first, second);
            }
            Operator operator = Operator.matchAt(input, position);
            if (operator == null || operator.isBinary()) {
                throw fail("Unexpected character '" + c + "'");
            }
            position += operator.getSymbol().length();
            if (operator.isConstant()) {
                return Formula.of(operator);
            }
            return Formula.of(operator, formula());
        }

        private Formula variable() {
            int start = position;
            position++;
            while (position < input.length() && input.charAt(position) >= '0' && input.charAt(position) <= '9') {
                position++;
            }
            return Formula.variable(input.substring(start, position));
        }

        private IllegalArgumentException fail(String message) {
            logger.error("解析 '{}' 时在位置 {} 失败: {}", input, position, message);
            return new IllegalArgumentException(message + " at position " + position + " in '" + input + "'");
        }
    }
}

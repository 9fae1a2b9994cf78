package org.propositions.syntax;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 命题公式中除变量以外的全部根标签。
 * 常量的元数为 0，否定为 1，其余二元连接词为 2。
 * 该集合是封闭的：所有转换器都对它做穷举 switch。
 * @author Ayalyt
 */
@Getter
public enum Operator {

    TRUE("T", 0),
    FALSE("F", 0),
    NOT("~", 1),
    AND("&", 2),
    OR("|", 2),
    IMPLIES("->", 2),
    XOR("+", 2),
    IFF("<->", 2),
    NAND("-&", 2),
    NOR("-|", 2);

    private static final Logger logger = LoggerFactory.getLogger(Operator.class);

    // 解析时按符号长度降序尝试，保证 "<->" 先于 "-&"、"->" 匹配
    private static final List<Operator> BY_SYMBOL_LENGTH = Arrays.stream(values())
            .sorted(Comparator.comparingInt((Operator op) -> op.symbol.length()).reversed())
            .collect(Collectors.toUnmodifiableList());

    private final String symbol;
    private final int arity;

    Operator(String symbol, int arity) {
        this.symbol = symbol;
        this.arity = arity;
    }

    public boolean isConstant() {
        return arity == 0;
    }

    public boolean isUnary() {
        return arity == 1;
    }

    public boolean isBinary() {
        return arity == 2;
    }

    /**
     * 根据符号查找运算符。
     * @param symbol 运算符符号，例如 "->"。
     * @return 对应的 Operator。
     * @throws IllegalArgumentException 如果符号未知。
     */
    public static Operator fromSymbol(String symbol) {
        for (Operator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        logger.error("未知的运算符符号: '{}'", symbol);
        throw new IllegalArgumentException("Unknown operator symbol: '" + symbol + "'");
    }

    /**
     * 返回 input 从 offset 开始的最长匹配运算符，没有匹配时返回 null。
     */
    static Operator matchAt(String input, int offset) {
        for (Operator op : BY_SYMBOL_LENGTH) {
            if (input.startsWith(op.symbol, offset)) {
                return op;
            }
        }
        return null;
    }

    /**
     * 变量名形如 p..z 中的一个小写字母，后跟可选的十进制数字，例如 p、q12、z0。
     */
    public static boolean isVariableName(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        char head = name.charAt(0);
        if (head < 'p' || head > 'z') {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return symbol;
    }
}

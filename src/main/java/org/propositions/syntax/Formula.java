package org.propositions.syntax;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.propositions.symbolic.ToZ3BoolExpr;
import org.propositions.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 代表一个命题公式，即以变量、常量 T/F、否定和二元连接词为节点的树。
 * <p>
 * 变量节点只有名字；常量节点没有子节点；否定节点只有 first；二元节点同时有 first 和 second。
 * 这些不变量由工厂方法保证，无法构造出畸形的树。
 * 此类是不可变的，子树可以被安全地共享。
 * <p>
 * 基转换器的输出会多次引用同一个子公式（例如 a-&amp;a）。{@link #size()}、{@link #depth()}、
 * {@link #variables()}、{@link #operators()}、{@link #toZ3BoolExpr} 以及
 * {@link org.propositions.semantics.Semantics#evaluate} 对每个共享节点只处理一次；
 * {@link #toString()} 输出展开后的树，与另一棵不共享节点的树比较 {@link #equals} 时也按展开后的树逐一比较，
 * 二者的开销随展开后的大小增长。
 * @author Ayalyt
 */
@Getter
public final class Formula implements ToZ3BoolExpr {

    private static final Logger logger = LoggerFactory.getLogger(Formula.class);

    private final String name;         // 仅变量节点非 null
    private final Operator operator;   // 仅非变量节点非 null
    private final Formula first;       // 一元与二元节点
    private final Formula second;      // 仅二元节点

    private final int hashCode;

    private Formula(String name, Operator operator, Formula first, Formula second) {
        this.name = name;
        this.operator = operator;
        this.first = first;
        this.second = second;
        this.hashCode = Objects.hash(name, operator, first, second);
        logger.debug("创建了一个 Formula 节点: {}", name != null ? name : operator);
    }

    // --- 工厂方法 ---

    /**
     * 创建变量节点。
     * @param name 变量名，必须满足 {@link Operator#isVariableName(String)}。
     * @return 新的变量节点。
     * @throws IllegalArgumentException 如果名字不是合法的变量名。
     */
    public static Formula variable(String name) {
        if (!Operator.isVariableName(name)) {
            logger.error("非法的变量名: '{}'", name);
            throw new IllegalArgumentException("Illegal variable name: '" + name + "'");
        }
        return new Formula(name, null, null, null);
    }

    public static Formula constant(boolean value) {
        return new Formula(null, value ? Operator.TRUE : Operator.FALSE, null, null);
    }

    /**
     * 创建常量节点。
     * @throws IllegalArgumentException 如果 operator 不是常量。
     */
    public static Formula of(Operator operator) {
        Objects.requireNonNull(operator, "Formula-of: operator 不能为 null");
        checkArity(operator, 0);
        return new Formula(null, operator, null, null);
    }

    /**
     * 创建一元节点。目前唯一的一元运算符是 NOT。
     */
    public static Formula of(Operator operator, Formula first) {
        Objects.requireNonNull(operator, "Formula-of: operator 不能为 null");
        Objects.requireNonNull(first, "Formula-of: first 不能为 null");
        checkArity(operator, 1);
        return new Formula(null, operator, first, null);
    }

    /**
     * 创建二元节点。
     * @throws IllegalArgumentException 如果 operator 不是二元运算符。
     */
    public static Formula of(Operator operator, Formula first, Formula second) {
        Objects.requireNonNull(operator, "Formula-of: operator 不能为 null");
        Objects.requireNonNull(first, "Formula-of: first 不能为 null");
        Objects.requireNonNull(second, "Formula-of: second 不能为 null");
        checkArity(operator, 2);
        return new Formula(null, operator, first, second);
    }

    private static void checkArity(Operator operator, int arity) {
        if (operator.getArity() != arity) {
            logger.error("运算符 {} 的元数为 {}，但提供了 {} 个子公式", operator, operator.getArity(), arity);
            throw new IllegalArgumentException("Operator " + operator.name() + " expects "
                    + operator.getArity() + " operand(s), got " + arity);
        }
    }

    public static Formula not(Formula first) { return of(Operator.NOT, first); }
    public static Formula and(Formula first, Formula second) { return of(Operator.AND, first, second); }
    public static Formula or(Formula first, Formula second) { return of(Operator.OR, first, second); }
    public static Formula implies(Formula first, Formula second) { return of(Operator.IMPLIES, first, second); }
    public static Formula xor(Formula first, Formula second) { return of(Operator.XOR, first, second); }
    public static Formula iff(Formula first, Formula second) { return of(Operator.IFF, first, second); }
    public static Formula nand(Formula first, Formula second) { return of(Operator.NAND, first, second); }
    public static Formula nor(Formula first, Formula second) { return of(Operator.NOR, first, second); }

    /**
     * 解析公式的字符串表示，等价于 {@link FormulaParser#parse(String)}。
     */
    public static Formula parse(String input) {
        return FormulaParser.parse(input);
    }

    // --- 查询 ---

    public boolean isVariable() {
        return name != null;
    }

    /**
     * @return 公式中出现的全部变量名，按字典序排列。
     */
    public SortedSet<String> variables() {
        SortedSet<String> result = new TreeSet<>();
        for (Formula node : nodes()) {
            if (node.isVariable()) {
                result.add(node.name);
            }
        }
        return Collections.unmodifiableSortedSet(result);
    }

    /**
     * @return 公式中出现的全部运算符（包括常量 T/F，不包括变量）。
     */
    public Set<Operator> operators() {
        Set<Operator> result = EnumSet.noneOf(Operator.class);
        for (Formula node : nodes()) {
            if (!node.isVariable()) {
                result.add(node.operator);
            }
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * @return 树中的节点数，共享的子树按出现次数重复计数。
     */
    public long size() {
        return size(new IdentityHashMap<>());
    }

    private long size(Map<Formula, Long> cache) {
        if (isVariable() || operator.isConstant()) {
            return 1;
        }
        Long cached = cache.get(this);
        if (cached != null) {
            return cached;
        }
        long result = operator.isUnary()
                ? 1 + first.size(cache)
                : 1 + first.size(cache) + second.size(cache);
        cache.put(this, result);
        return result;
    }

    public int depth() {
        return depth(new IdentityHashMap<>());
    }

    private int depth(Map<Formula, Integer> cache) {
        if (isVariable() || operator.isConstant()) {
            return 0;
        }
        Integer cached = cache.get(this);
        if (cached != null) {
            return cached;
        }
        int result = operator.isUnary()
                ? 1 + first.depth(cache)
                : 1 + Math.max(first.depth(cache), second.depth(cache));
        cache.put(this, result);
        return result;
    }

    // 按先序遍历所有节点，共享的子树只访问一次
    private Set<Formula> nodes() {
        Set<Formula> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Formula> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            Formula node = stack.pop();
            if (!seen.add(node)) {
                continue;
            }
            if (node.second != null) {
                stack.push(node.second);
            }
            if (node.first != null) {
                stack.push(node.first);
            }
        }
        return seen;
    }

    // --- Z3 转换 ---
    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        return toZ3BoolExpr(ctx, varManager, new IdentityHashMap<>());
    }

    private BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager, Map<Formula, BoolExpr> cache) {
        if (isVariable()) {
            return varManager.getZ3Var(name);
        }
        BoolExpr cached = cache.get(this);
        if (cached != null) {
            return cached;
        }
        BoolExpr result = switch (operator) {
            case TRUE -> ctx.mkTrue();
            case FALSE -> ctx.mkFalse();
            case NOT -> ctx.mkNot(first.toZ3BoolExpr(ctx, varManager, cache));
            case AND -> ctx.mkAnd(first.toZ3BoolExpr(ctx, varManager, cache), second.toZ3BoolExpr(ctx, varManager, cache));
            case OR -> ctx.mkOr(first.toZ3BoolExpr(ctx, varManager, cache), second.toZ3BoolExpr(ctx, varManager, cache));
            case IMPLIES -> ctx.mkImplies(first.toZ3BoolExpr(ctx, varManager, cache), second.toZ3BoolExpr(ctx, varManager, cache));
            case XOR -> ctx.mkXor(first.toZ3BoolExpr(ctx, varManager, cache), second.toZ3BoolExpr(ctx, varManager, cache));
            case IFF -> ctx.mkIff(first.toZ3BoolExpr(ctx, varManager, cache), second.toZ3BoolExpr(ctx, varManager, cache));
            case NAND -> ctx.mkNot(ctx.mkAnd(first.toZ3BoolExpr(ctx, varManager, cache), second.toZ3BoolExpr(ctx, varManager, cache)));
            case NOR -> ctx.mkNot(ctx.mkOr(first.toZ3BoolExpr(ctx, varManager, cache), second.toZ3BoolExpr(ctx, varManager, cache)));
        };
        cache.put(this, result);
        return result;
    }

    // --- Object 方法 ---
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Formula that = (Formula) o;
        return hashCode == that.hashCode &&
                operator == that.operator &&
                Objects.equals(name, that.name) &&
                Objects.equals(first, that.first) &&
                Objects.equals(second, that.second);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    /**
     * 全括号的中缀形式：变量与常量原样输出，否定为 ~φ，二元为 (φ∘ψ)。
     * 输出可以被 {@link FormulaParser#parse(String)} 还原。
     */
    @Override
    public String toString() {
        StringBuilder result = new StringBuilder();
        toString(result);
        return result.toString();
    }

    private void toString(StringBuilder result) {
        if (isVariable()) {
            result.append(name);
        } else if (operator.isConstant()) {
            result.append(operator.getSymbol());
        } else if (operator.isUnary()) {
            result.append(operator.getSymbol());
            first.toString(result);
        } else {
            result.append('(');
            first.toString(result);
            result.append(operator.getSymbol());
            second.toString(result);
            result.append(')');
        }
    }
}

package org.propositions.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import org.propositions.syntax.Formula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 基于 Z3 的命题公式判定器，用于在变量较多、真值表不可行时检查可满足性与等价性。
 * 每个 Oracle 独占一个 Z3 Context，使用完毕必须 close。
 * 此类不是线程安全的，每个线程应使用自己的实例。
 * @author Ayalyt
 */
public class Z3Oracle implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3Oracle.class);

    private final Context ctx;
    private final Z3VariableManager varManager;

    public Z3Oracle() {
        this.ctx = new Context();
        this.varManager = new Z3VariableManager(ctx);
        logger.info("Z3Oracle 已创建");
    }

    /**
     * @return formula 是否存在一个满足赋值。
     */
    public boolean isSatisfiable(Formula formula) {
        Objects.requireNonNull(formula, "Formula cannot be null.");
        Status status = check(formula.toZ3BoolExpr(ctx, varManager));
        logger.debug("{} 的可满足性检查结果: {}", formula, status);
        return status == Status.SATISFIABLE;
    }

    /**
     * @return formula 是否在所有赋值下为真，即其否定不可满足。
     */
    public boolean isTautology(Formula formula) {
        Objects.requireNonNull(formula, "Formula cannot be null.");
        Status status = check(ctx.mkNot(formula.toZ3BoolExpr(ctx, varManager)));
        logger.debug("{} 的恒真检查结果: {}", formula, status);
        return status == Status.UNSATISFIABLE;
    }

    /**
     * 判断两个公式是否语义等价。
     * 只在一侧出现的变量被视为自由变量，因此等价要求对它们的所有取值都成立。
     * @return ¬(left ↔ right) 是否不可满足。
     */
    public boolean areEquivalent(Formula left, Formula right) {
        Objects.requireNonNull(left, "Left formula cannot be null.");
        Objects.requireNonNull(right, "Right formula cannot be null.");
        BoolExpr difference = ctx.mkNot(ctx.mkIff(left.toZ3BoolExpr(ctx, varManager),
                right.toZ3BoolExpr(ctx, varManager)));
        Status status = check(difference);
        logger.debug("等价检查结果: {}", status);
        return status == Status.UNSATISFIABLE;
    }

    private Status check(BoolExpr assertion) {
        Solver solver = ctx.mkSolver();
        solver.add(assertion);
        Status status = solver.check();
        if (status == Status.UNKNOWN) {
            logger.error("Z3 返回 UNKNOWN: {}", solver.getReasonUnknown());
            throw new IllegalStateException("Z3 could not decide the query: " + solver.getReasonUnknown());
        }
        return status;
    }

    @Override
    public void close() {
        ctx.close();
        logger.info("Z3Oracle 已关闭，共使用 {} 个变量", varManager.size());
    }
}

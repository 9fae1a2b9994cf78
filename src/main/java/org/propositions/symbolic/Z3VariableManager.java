package org.propositions.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 负责管理命题变量名到 Z3 布尔常量的映射。
 * 确保每个变量在 Z3 Context 中有唯一的对应 Z3 变量。
 * @author Ayalyt
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    // 使用 HashMap 存储映射，因为 Z3 Context 本身不是线程安全的，这个实例也只在单线程中使用
    private final Map<String, BoolExpr> boolZ3Vars;

    public Z3VariableManager(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.boolZ3Vars = new HashMap<>();
        logger.debug("Z3VariableManager 初始化完成");
    }

    /**
     * 获取指定变量名对应的 Z3 布尔变量。
     * 如果变量尚未创建，则会创建并缓存。
     * @param name 命题变量名。
     * @return 对应的 Z3 BoolExpr 变量。
     */
    public BoolExpr getZ3Var(String name) {
        return boolZ3Vars.computeIfAbsent(name, n -> {
            logger.debug("创建 Z3 布尔变量: {}", n);
            return ctx.mkBoolConst(n);
        });
    }

    public int size() {
        return boolZ3Vars.size();
    }
}

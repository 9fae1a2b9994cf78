package org.propositions.semantics;

import lombok.Getter;
import org.propositions.syntax.Operator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 一个模型，即命题变量到真值的赋值。
 * 此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class Model {

    private static final Logger logger = LoggerFactory.getLogger(Model.class);

    private final SortedMap<String, Boolean> assignment;

    private Model(Map<String, Boolean> assignment) {
        for (Map.Entry<String, Boolean> entry : assignment.entrySet()) {
            if (!Operator.isVariableName(entry.getKey())) {
                logger.error("模型中包含非法的变量名: '{}'", entry.getKey());
                throw new IllegalArgumentException("Illegal variable name in model: '" + entry.getKey() + "'");
            }
            Objects.requireNonNull(entry.getValue(), "Model value cannot be null");
        }
        this.assignment = Collections.unmodifiableSortedMap(new TreeMap<>(assignment));
        logger.debug("创建 Model: {}", this);
    }

    /**
     * 工厂方法：从 Map 创建 Model 实例。
     * @param assignment 变量名到真值的映射。
     * @return Model 实例。
     * @throws IllegalArgumentException 如果任何键不是合法变量名。
     */
    public static Model of(Map<String, Boolean> assignment) {
        Objects.requireNonNull(assignment, "Assignment map cannot be null");
        return new Model(assignment);
    }

    public static Model empty() {
        return new Model(Collections.emptyMap());
    }

    /**
     * 获取指定变量的真值。
     * @param name 变量名。
     * @return 该变量的真值。
     * @throws IllegalArgumentException 如果模型没有为该变量赋值。
     */
    public boolean getValue(String name) {
        Boolean value = assignment.get(name);
        if (value == null) {
            logger.error("尝试获取不存在的变量值：变量 '{}' 不存在于模型 {} 中。", name, this);
            throw new IllegalArgumentException("Variable '" + name + "' is not assigned in model " + this);
        }
        return value;
    }

    /**
     * 返回一个在本模型基础上额外（或重新）为 name 赋值的新模型。
     */
    public Model extend(String name, boolean value) {
        Map<String, Boolean> extended = new TreeMap<>(assignment);
        extended.put(name, value);
        return new Model(extended);
    }

    public SortedSet<String> getVariables() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(assignment.keySet()));
    }

    public boolean covers(Iterable<String> variables) {
        for (String variable : variables) {
            if (!assignment.containsKey(variable)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Model that = (Model) o;
        return assignment.equals(that.assignment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(assignment);
    }

    @Override
    public String toString() {
        return "{" +
                assignment.entrySet().stream()
                        .map(entry -> entry.getKey() + "=" + (entry.getValue() ? "T" : "F"))
                        .collect(Collectors.joining(", ")) +
                "}";
    }
}

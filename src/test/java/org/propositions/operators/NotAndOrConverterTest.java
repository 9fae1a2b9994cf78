package org.propositions.operators;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.propositions.semantics.Semantics;
import org.propositions.syntax.Formula;

import static org.junit.jupiter.api.Assertions.*;

class NotAndOrConverterTest {

    private final NotAndOrConverter converter = new NotAndOrConverter();

    private String convert(String formula) {
        return converter.convert(Formula.parse(formula)).toString();
    }

    @Test
    @DisplayName("p->q 应改写为 ~p|q")
    void testImplies() {
        Formula result = converter.convert(Formula.parse("(p->q)"));
        assertEquals("(~p|q)", result.toString());
        assertTrue(Semantics.areEquivalent(Formula.parse("(p->q)"), result));
    }

    @Test
    @DisplayName("每个连接词的改写规则")
    void testRewriteRules() {
        assertAll("Rules",
                () -> assertEquals("(p&q)", convert("(p&q)")),
                () -> assertEquals("(p|q)", convert("(p|q)")),
                () -> assertEquals("((p&~q)|(~p&q))", convert("(p+q)")),
                () -> assertEquals("((p&q)|(~p&~q))", convert("(p<->q)")),
                () -> assertEquals("~(p&q)", convert("(p-&q)")),
                () -> assertEquals("~(p|q)", convert("(p-|q)")),
                () -> assertEquals("~~p", convert("~~p"))
        );
    }

    @Test
    @DisplayName("没有变量时 F 使用默认变量 p 编码为 p&~p")
    void testFalse_WithoutVariables() {
        Formula result = converter.convert(Formula.constant(false));
        assertAll("F",
                () -> assertEquals("(p&~p)", result.toString()),
                () -> assertTrue(Semantics.isContradiction(result))
        );
    }

    @Test
    @DisplayName("常量优先借用输入中最小的变量")
    void testConstants_BorrowInputVariable() {
        assertAll("Borrowed variable",
                () -> assertEquals("(r&(r|~r))", convert("(r&T)")),
                () -> assertEquals("((q&~q)|(q&r))", convert("(F|(q&r))")),
                () -> assertEquals("(p|~p)", convert("T"))
        );
    }

    @Test
    @DisplayName("可以配置默认变量名")
    void testCustomDefaultVariable() {
        NotAndOrConverter custom = new NotAndOrConverter("z9");
        assertEquals("(z9|~z9)", custom.convert(Formula.constant(true)).toString());
        assertThrows(IllegalArgumentException.class, () -> new NotAndOrConverter("a"));
    }
}

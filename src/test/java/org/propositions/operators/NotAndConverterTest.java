package org.propositions.operators;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.propositions.semantics.Model;
import org.propositions.semantics.Semantics;
import org.propositions.syntax.Formula;

import static org.junit.jupiter.api.Assertions.*;

class NotAndConverterTest {

    private final NotAndConverter converter = new NotAndConverter();

    private String convert(String formula) {
        return converter.convert(Formula.parse(formula)).toString();
    }

    @Test
    @DisplayName("p|q 应改写为 ~(~p&~q)，四个赋值下取值相同")
    void testOr() {
        Formula input = Formula.parse("(p|q)");
        Formula result = converter.convert(input);

        assertEquals("~(~p&~q)", result.toString());
        for (Model model : Semantics.allModels(input.variables())) {
            assertEquals(Semantics.evaluate(input, model), Semantics.evaluate(result, model), model.toString());
        }
    }

    @Test
    @DisplayName("每个连接词的改写规则")
    void testRewriteRules() {
        assertAll("Rules",
                () -> assertEquals("(p&q)", convert("(p&q)")),
                () -> assertEquals("~(p&~q)", convert("(p->q)")),
                () -> assertEquals("(~(~p&~q)&~(p&q))", convert("(p+q)")),
                () -> assertEquals("~(~(p&q)&~(~p&~q))", convert("(p<->q)")),
                () -> assertEquals("~(p&q)", convert("(p-&q)")),
                () -> assertEquals("(~p&~q)", convert("(p-|q)"))
        );
    }

    @Test
    @DisplayName("常量编码为矛盾式及其否定")
    void testConstants() {
        assertAll("Constants",
                () -> assertEquals("~(p&~p)", convert("T")),
                () -> assertEquals("(p&~p)", convert("F")),
                () -> assertEquals("~(~(q&~q)&~q)", convert("(F|q)"))
        );
    }

    @Test
    @DisplayName("输出中不应出现 | 或常量")
    void testNoOrInOutput() {
        Formula result = converter.convert(Formula.parse("((p|T)<->(q-|(r+F)))"));
        assertTrue(Basis.NOT_AND.contains(result), result.toString());
        assertTrue(Semantics.areEquivalent(Formula.parse("((p|T)<->(q-|(r+F)))"), result));
    }
}

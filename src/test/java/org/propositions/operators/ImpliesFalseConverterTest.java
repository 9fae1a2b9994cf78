package org.propositions.operators;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.propositions.semantics.Model;
import org.propositions.semantics.Semantics;
import org.propositions.syntax.Formula;

import static org.junit.jupiter.api.Assertions.*;

class ImpliesFalseConverterTest {

    private final ImpliesFalseConverter converter = new ImpliesFalseConverter();

    private String convert(String formula) {
        return converter.convert(Formula.parse(formula)).toString();
    }

    @Test
    @DisplayName("T 应改写为不含变量的 F->F")
    void testTrue_IsClosed() {
        Formula result = converter.convert(Formula.constant(true));

        assertAll("Closed tautology",
                () -> assertEquals("(F->F)", result.toString()),
                () -> assertTrue(result.variables().isEmpty()),
                () -> assertTrue(Semantics.evaluate(result, Model.empty()))
        );
    }

    @Test
    @DisplayName("F 原样保留，否定编码为 a->F")
    void testFalseAndNegation() {
        assertAll("Native constant",
                () -> assertEquals("F", convert("F")),
                () -> assertEquals("(p->F)", convert("~p")),
                () -> assertEquals("((F->F)->F)", convert("~T"))
        );
    }

    @Test
    @DisplayName("每个连接词的改写规则")
    void testRewriteRules() {
        assertAll("Rules",
                () -> assertEquals("((p->(q->F))->F)", convert("(p&q)")),
                () -> assertEquals("((p->F)->q)", convert("(p|q)")),
                () -> assertEquals("(p->q)", convert("(p->q)")),
                () -> assertEquals("(((p->(q->F))->F)->F)", convert("(p-&q)")),
                () -> assertEquals("(((p->F)->q)->F)", convert("(p-|q)"))
        );
    }

    @Test
    @DisplayName("默认变量名不会出现在输出中")
    void testDefaultVariableUnused() {
        ImpliesFalseConverter custom = new ImpliesFalseConverter("z");
        Formula result = custom.convert(Formula.parse("(T&~F)"));

        assertTrue(result.variables().isEmpty(), result.toString());
        assertTrue(Semantics.isTautology(result));
    }
}

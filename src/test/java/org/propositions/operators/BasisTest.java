package org.propositions.operators;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.propositions.semantics.Semantics;
import org.propositions.syntax.Formula;
import org.propositions.syntax.Operator;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class BasisTest {

    @Nested
    @DisplayName("基的定义 (Basis Definitions)")
    class DefinitionTests {

        @Test
        @DisplayName("每个基的运算符集合")
        void testOperators() {
            assertAll("Operator sets",
                    () -> assertEquals(EnumSet.of(Operator.NOT, Operator.AND, Operator.OR), Basis.NOT_AND_OR.getOperators()),
                    () -> assertEquals(EnumSet.of(Operator.NOT, Operator.AND), Basis.NOT_AND.getOperators()),
                    () -> assertEquals(EnumSet.of(Operator.NAND), Basis.NAND.getOperators()),
                    () -> assertEquals(EnumSet.of(Operator.IMPLIES, Operator.NOT), Basis.IMPLIES_NOT.getOperators()),
                    () -> assertEquals(EnumSet.of(Operator.IMPLIES, Operator.FALSE), Basis.IMPLIES_FALSE.getOperators())
            );
        }

        @Test
        @DisplayName("contains 应检查运算符与常量")
        void testContains() {
            assertAll("Containment",
                    () -> assertTrue(Basis.NOT_AND.contains(Formula.parse("~(p&~q)"))),
                    () -> assertFalse(Basis.NOT_AND.contains(Formula.parse("(p|q)"))),
                    () -> assertFalse(Basis.NOT_AND.contains(Formula.parse("(p&T)"))),
                    () -> assertTrue(Basis.IMPLIES_FALSE.contains(Formula.parse("(p->F)"))),
                    () -> assertFalse(Basis.IMPLIES_FALSE.contains(Formula.parse("(p->T)"))),
                    () -> assertTrue(Basis.NAND.contains(Formula.parse("q")))
            );
        }

        @Test
        @DisplayName("每个基的转换器都指回该基")
        void testConverterBasis() {
            for (Basis basis : Basis.values()) {
                assertEquals(basis, basis.getConverter().getBasis());
            }
        }
    }

    @Nested
    @DisplayName("转换性质 (Conversion Properties)")
    class PropertyTests {

        @Test
        @DisplayName("样本公式：基包含、语义等价、可组合")
        void testSamples() {
            for (Basis basis : Basis.values()) {
                for (Formula formula : SampleFormulas.samples()) {
                    SampleFormulas.assertConvertsFaithfully(basis.getConverter(), formula);
                }
            }
        }

        @Test
        @DisplayName("随机公式：基包含、语义等价、可组合")
        void testRandomFormulas() {
            for (Basis basis : Basis.values()) {
                for (Formula formula : SampleFormulas.random(basis.ordinal() + 17L, 60, 4)) {
                    SampleFormulas.assertConvertsFaithfully(basis.getConverter(), formula);
                }
            }
        }

        @Test
        @DisplayName("已在基内的公式转换后保持等价")
        void testAlreadyRestrictedInput() {
            for (Basis basis : Basis.values()) {
                Operator[] operators = basis.getOperators().toArray(new Operator[0]);
                for (Formula formula : SampleFormulas.random(basis.ordinal() + 101L, 30, 4, operators)) {
                    assertTrue(basis.contains(formula));
                    Formula converted = basis.convert(formula);
                    assertAll(basis + " on " + formula,
                            () -> assertTrue(basis.contains(converted)),
                            () -> assertTrue(Semantics.areEquivalent(formula, converted))
                    );
                }
            }
        }

        @Test
        @DisplayName("裸变量和裸常量都能转换")
        void testTotality_OnLeaves() {
            for (Basis basis : Basis.values()) {
                Formula variable = basis.convert(Formula.variable("q"));
                Formula truth = basis.convert(Formula.constant(true));
                Formula falsity = basis.convert(Formula.constant(false));

                assertAll(basis.name(),
                        () -> assertEquals(Formula.variable("q"), variable),
                        () -> assertTrue(Semantics.isTautology(truth), "T => " + truth),
                        () -> assertTrue(Semantics.isContradiction(falsity), "F => " + falsity),
                        () -> assertTrue(basis.contains(truth)),
                        () -> assertTrue(basis.contains(falsity))
                );
            }
        }

        @Test
        @DisplayName("转换不修改输入")
        void testInputIsUntouched() {
            Formula input = Formula.parse("((p-&q)+(r->~T))");
            String before = input.toString();
            for (Basis basis : Basis.values()) {
                basis.convert(input);
            }
            assertEquals(before, input.toString());
            assertEquals(Formula.parse(before), input);
        }
    }

    @Test
    @DisplayName("多线程并发转换同一公式应得到相同结果")
    void testConcurrentConversion() throws Exception {
        Formula input = Formula.parse("(((p|q)&r)->(p+(q<->~T)))");
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            for (Basis basis : Basis.values()) {
                Formula expected = basis.convert(input);
                List<Future<Formula>> futures = new ArrayList<>();
                for (int i = 0; i < 32; i++) {
                    futures.add(executor.submit(() -> basis.convert(input)));
                }
                for (Future<Formula> future : futures) {
                    assertEquals(expected, future.get());
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }
}

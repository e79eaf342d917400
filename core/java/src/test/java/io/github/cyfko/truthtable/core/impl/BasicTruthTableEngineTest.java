package io.github.cyfko.truthtable.core.impl;

import io.github.cyfko.truthtable.core.api.ErrorKind;
import io.github.cyfko.truthtable.core.api.Formula;
import io.github.cyfko.truthtable.core.api.TruthTableEngine;
import io.github.cyfko.truthtable.core.api.TruthTableResult;
import io.github.cyfko.truthtable.core.config.CachePolicy;
import io.github.cyfko.truthtable.core.config.EnginePolicy;
import io.github.cyfko.truthtable.core.exception.FormulaSyntaxException;
import io.github.cyfko.truthtable.core.exception.LexicalException;
import io.github.cyfko.truthtable.core.exception.VariableLimitExceededException;
import io.github.cyfko.truthtable.core.table.Classification;
import io.github.cyfko.truthtable.core.table.TruthTable;
import io.github.cyfko.truthtable.core.table.TruthTableRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for {@link BasicTruthTableEngine}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("BasicTruthTableEngine Tests")
class BasicTruthTableEngineTest {

    private BasicTruthTableEngine engine;

    @BeforeEach
    void setUp() {
        engine = new BasicTruthTableEngine();
    }

    static Stream<Arguments> equivalences() {
        return Stream.of(
                Arguments.of("double negation", "~~P", "P"),
                Arguments.of("material implication", "P → Q", "~P ∨ Q"),
                Arguments.of("biconditional", "P ↔ Q", "(P → Q) ∧ (Q → P)"),
                Arguments.of("exclusive or", "P ⊕ Q", "~(P ↔ Q)"),
                Arguments.of("De Morgan (and)", "~(P ∧ Q)", "~P ∨ ~Q"),
                Arguments.of("De Morgan (or)", "~(P ∨ Q)", "~P ∧ ~Q"),
                Arguments.of("distribution", "P ∧ (Q ∨ R)", "(P ∧ Q) ∨ (P ∧ R)")
        );
    }

    @Nested
    @DisplayName("Table generation")
    class Generation {

        @Test
        @DisplayName("(P ∧ Q) → R should give 8 rows over [P, Q, R]")
        void implicationOfConjunction() {
            TruthTable table = engine.generateTruthTable("(P ∧ Q) → R");

            assertEquals(List.of("P", "Q", "R"), table.variables());
            assertEquals(8, table.rowCount());
            assertEquals(4, table.columnCount());
            assertTrue(table.row(0).result());
            assertEquals(List.of(true, true, false), table.row(6).values());
            assertFalse(table.row(6).result());
            assertTrue(table.row(7).result());
            assertEquals(Classification.CONTINGENCY, table.classification());
        }

        @Test
        @DisplayName("P ⊕ Q should give the exclusive-or column")
        void exclusiveOr() {
            TruthTable table = engine.generateTruthTable("P ⊕ Q");

            assertEquals(List.of(false, true, true, false), table.results());
        }

        @Test
        @DisplayName("Single variable should give the identity table")
        void identity() {
            TruthTable table = engine.generateTruthTable("P");

            assertEquals(List.of("P"), table.variables());
            assertEquals(List.of(false, true), table.results());
        }

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {"P", "P ∧ Q", "(A ∨ B) → (C ↔ D)", "~a ⊕ (b ∧ c ∧ d ∧ e)"})
        @DisplayName("Row count should be 2^n and column count n + 1")
        void dimensions(String expression) {
            TruthTable table = engine.generateTruthTable(expression);
            int n = table.variables().size();

            assertEquals(1 << n, table.rowCount());
            assertEquals(n + 1, table.columnCount());
            for (TruthTableRow row : table.rows()) {
                for (int k = 0; k < n; k++) {
                    assertEquals(((row.index() >> (n - 1 - k)) & 1) == 1, row.values().get(k));
                }
            }
        }

        @Test
        @DisplayName("Variables should be case-sensitive and sorted with uppercase first")
        void caseSensitiveVariables() {
            TruthTable table = engine.generateTruthTable("p ∧ P");

            assertEquals(List.of("P", "p"), table.variables());
            assertEquals(List.of(false, false, false, true), table.results());
        }

        @Test
        @DisplayName("ASCII aliases should give the same table as canonical symbols")
        void aliases() {
            assertEquals(
                    engine.generateTruthTable("(P ∧ Q) → ~R ↔ (S ⊕ T) ∨ U").results(),
                    engine.generateTruthTable("(P & Q) -> !R <-> (S ^ T) | U").results());
        }

        @Test
        @DisplayName("Should classify tautologies and contradictions")
        void classification() {
            assertTrue(engine.generateTruthTable("P ∨ ~P").isTautology());
            assertTrue(engine.generateTruthTable("P ∧ ~P").isContradiction());
            assertTrue(engine.generateTruthTable("P → Q").isSatisfiable());
        }
    }

    @Nested
    @DisplayName("Logical laws")
    class Laws {

        @ParameterizedTest(name = "{0}: {1} ≡ {2}")
        @MethodSource("io.github.cyfko.truthtable.core.impl.BasicTruthTableEngineTest#equivalences")
        @DisplayName("Equivalent formulas should produce identical result columns")
        void equivalentFormulas(String law, String left, String right) {
            TruthTable l = engine.generateTruthTable(left);
            TruthTable r = engine.generateTruthTable(right);

            assertEquals(l.variables(), r.variables(), law);
            assertEquals(l.results(), r.results(), law);
            assertTrue(engine.generateTruthTable("(" + left + ") ↔ (" + right + ")").isTautology(), law);
        }
    }

    @Nested
    @DisplayName("Error handling")
    class Errors {

        @Test
        @DisplayName("Unbalanced parenthesis should raise a syntax error")
        void unbalanced() {
            FormulaSyntaxException exception = assertThrows(FormulaSyntaxException.class,
                    () -> engine.generateTruthTable("(p ∧ q"));
            assertEquals("Unmatched '(' at position 0", exception.getMessage());
        }

        @Test
        @DisplayName("Expression without variables should raise a syntax error")
        void noVariables() {
            FormulaSyntaxException exception = assertThrows(FormulaSyntaxException.class,
                    () -> engine.generateTruthTable("()"));
            assertEquals("No variables found in expression", exception.getMessage());
        }

        @Test
        @DisplayName("Null or blank expressions should be rejected")
        void blank() {
            assertThrows(FormulaSyntaxException.class, () -> engine.parse(null));
            assertThrows(FormulaSyntaxException.class, () -> engine.parse("   "));
        }

        @Test
        @DisplayName("Unknown character should raise a lexical error")
        void lexical() {
            LexicalException exception = assertThrows(LexicalException.class, () -> engine.parse("P $ Q"));
            assertEquals(2, exception.getPosition());
        }

        @Test
        @DisplayName("Too many variables should be rejected before enumeration")
        void tooManyVariables() {
            assertThrows(VariableLimitExceededException.class,
                    () -> engine.generateTruthTable("A∧B∧C∧D∧E∧F∧G∧H∧I∧J∧K∧L∧M∧N∧O∧P∧Q"));
        }

        @Test
        @DisplayName("Strict engine should reject ASCII aliases")
        void strictRejectsAliases() {
            TruthTableEngine strict = new BasicTruthTableEngine(EnginePolicy.strict(), CachePolicy.strict());

            TruthTableResult result = strict.evaluate("P & Q");

            assertFalse(result.isSuccess());
            assertEquals(ErrorKind.LEX, result.getErrorKind());
            assertTrue(strict.evaluate("P ∧ Q").isSuccess());
        }

        @Test
        @DisplayName("Null policies should be rejected")
        void nullPolicies() {
            assertThrows(IllegalArgumentException.class, () -> new BasicTruthTableEngine(null));
            assertThrows(IllegalArgumentException.class,
                    () -> new BasicTruthTableEngine(EnginePolicy.defaults(), null));
        }
    }

    @Nested
    @DisplayName("Policy ceilings")
    class Ceilings {

        private final BasicTruthTableEngine ceilingEngine = new BasicTruthTableEngine(
                EnginePolicy.builder()
                        .policyName("CEILING")
                        .maxVariables(EnginePolicy.MAX_SUPPORTED_VARIABLES)
                        .maxExpressionLength(EnginePolicy.MAX_SUPPORTED_EXPRESSION_LENGTH)
                        .maxNestingDepth(EnginePolicy.MAX_SUPPORTED_NESTING_DEPTH)
                        .build(),
                CachePolicy.none());

        @Test
        @DisplayName("Should build the full table at the variable ceiling")
        void variableCeiling() {
            StringBuilder expression = new StringBuilder("A");
            for (char c = 'B'; c < 'A' + EnginePolicy.MAX_SUPPORTED_VARIABLES; c++) {
                expression.append(" ∧ ").append(c);
            }

            TruthTableResult result = ceilingEngine.evaluate(expression.toString());

            assertTrue(result.isSuccess(), result::toString);
            TruthTable table = result.getTable();
            assertEquals(1 << EnginePolicy.MAX_SUPPORTED_VARIABLES, table.rowCount());
            assertFalse(table.row(0).result());
            assertTrue(table.row(table.rowCount() - 1).result());
            assertEquals(Classification.CONTINGENCY, table.classification());
        }

        @Test
        @DisplayName("Should evaluate the longest accepted chain")
        void lengthCeiling() {
            String chain = "P" + "∧P".repeat((EnginePolicy.MAX_SUPPORTED_EXPRESSION_LENGTH - 1) / 2);

            TruthTableResult result = ceilingEngine.evaluate(chain);

            assertTrue(result.isSuccess(), result::toString);
            assertEquals(List.of(false, true), result.getTable().results());
            assertEquals(ErrorKind.PARSE, ceilingEngine.evaluate(chain + "∧P").getErrorKind());
        }

        @Test
        @DisplayName("Should parse the deepest accepted nesting and reject one level more")
        void nestingCeiling() {
            int depth = EnginePolicy.MAX_SUPPORTED_NESTING_DEPTH;

            TruthTableResult parens = ceilingEngine.evaluate("(".repeat(depth) + "P" + ")".repeat(depth));
            TruthTableResult negations = ceilingEngine.evaluate("~".repeat(depth) + "P");
            TruthTableResult tooDeep = ceilingEngine.evaluate("(".repeat(depth + 1) + "P" + ")".repeat(depth + 1));

            assertEquals(List.of(false, true), parens.getTable().results());
            assertEquals(List.of(false, true), negations.getTable().results());
            assertEquals(ErrorKind.PARSE, tooDeep.getErrorKind());
            assertTrue(tooDeep.getErrorMessage().startsWith("Expression nested too deeply"));
        }
    }

    @Nested
    @DisplayName("evaluate()")
    class Evaluate {

        @Test
        @DisplayName("Should wrap a successful table")
        void success() {
            TruthTableResult result = engine.evaluate("P ∨ Q");

            assertTrue(result.isSuccess());
            assertEquals(4, result.getTable().rowCount());
            assertNull(result.getErrorKind());
            assertNull(result.getErrorMessage());
        }

        @Test
        @DisplayName("Should report the error kind of each failure")
        void failureKinds() {
            assertEquals(ErrorKind.LEX, engine.evaluate("P $ Q").getErrorKind());
            assertEquals(ErrorKind.PARSE, engine.evaluate("(P").getErrorKind());
            assertEquals(ErrorKind.PARSE, engine.evaluate("").getErrorKind());
            assertEquals(ErrorKind.VARIABLE_LIMIT,
                    engine.evaluate("A∧B∧C∧D∧E∧F∧G∧H∧I∧J∧K∧L∧M∧N∧O∧P∧Q").getErrorKind());
        }

        @Test
        @DisplayName("Failure should carry the exception message and no table")
        void failureMessage() {
            TruthTableResult result = engine.evaluate("()");

            assertFalse(result.isSuccess());
            assertNull(result.getTable());
            assertEquals("No variables found in expression", result.getErrorMessage());
        }
    }

    @Nested
    @DisplayName("Formula cache")
    class Cache {

        @Test
        @DisplayName("Repeated parse should return the cached formula")
        void cachedFormula() {
            Formula first = engine.parse("P → Q");
            Formula second = engine.parse("P → Q");

            assertSame(first, second);
            assertEquals(1, engine.getCacheStats().get("size"));
        }

        @Test
        @DisplayName("Failed parses should not be cached")
        void failuresNotCached() {
            engine.evaluate("(P");

            assertEquals(0, engine.getCacheStats().get("size"));
        }

        @Test
        @DisplayName("clearCache() should empty the cache")
        void clear() {
            engine.parse("P");
            engine.clearCache();

            assertEquals(Map.of("enabled", true, "size", 0, "maxSize", 256), engine.getCacheStats());
        }

        @Test
        @DisplayName("Disabled cache should parse every time")
        void disabled() {
            BasicTruthTableEngine uncached = new BasicTruthTableEngine(EnginePolicy.defaults(), CachePolicy.none());

            assertNotSame(uncached.parse("P ∧ Q"), uncached.parse("P ∧ Q"));
            assertEquals(Map.of("enabled", false), uncached.getCacheStats());
            uncached.clearCache();
        }
    }

    @Test
    @DisplayName("connectives() should list the six connectives in palette order")
    void connectives() {
        assertEquals(6, engine.connectives().size());
        assertEquals("∧", engine.connectives().get(0).symbol());
        assertEquals(EnginePolicy.PolicyName.DEFAULT_POLICY.name(), engine.getEnginePolicy().policyName());
    }
}

import org.junit.jupiter.api.Test;

import com.ecolang.script.parser.CompiledExpression;
import com.ecolang.script.parser.Environment;
import com.ecolang.script.parser.EvalError;
import com.ecolang.script.parser.ExpressionValidator;
import com.ecolang.script.parser.Value;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionEvaluatorTest {

    private static Value eval(String src) {
        return eval(src, new Environment());
    }

    private static Value eval(String src, Environment env) {
        return CompiledExpression.compile(src, 0).evaluate(env);
    }

    private static String fails(String src) {
        EvalError e = assertThrows(EvalError.class, () -> eval(src));
        return e.getMessage();
    }

    @Test
    void literals() {
        assertEquals(Value.integer(12), eval("12"));
        assertEquals(Value.number(1.5), eval("1.5"));
        assertEquals(Value.number(0.5), eval(".5"));
        assertEquals(Value.number(1000.0), eval("1e3"));
        assertEquals(Value.string("a\tb\n"), eval("'a\\tb\\n'"));
        assertEquals(Value.string("say \"hi\""), eval("\"say \\\"hi\\\"\""));
        assertEquals(Value.bool(true), eval("true"));
    }

    @Test
    void integerArithmeticStaysExact() {
        Value v = eval("2 + 3 * 4");
        assertEquals(Value.Type.INT, v.getType());
        assertEquals(14L, v.asInt());
        assertEquals(Value.integer(20), eval("(2 + 3) * 4"));
        assertEquals(Value.integer(256), eval("2 ** 8"));
        assertEquals(Value.integer(-8), eval("-2 ** 3"));
    }

    @Test
    void divisionAndModuloSemantics() {
        Value half = eval("7 / 2");
        assertEquals(Value.Type.FLOAT, half.getType());
        assertEquals(3.5, half.asNumber(), 0.0);
        assertEquals(Value.Type.FLOAT, eval("4 / 2").getType());
        assertEquals(Value.integer(-4), eval("-7 // 2"));
        assertEquals(Value.integer(2), eval("-7 % 3"));
        assertEquals(Value.integer(-2), eval("7 % -3"));
        assertEquals(-0.5, eval("1.5 % -1").asNumber(), 1e-12);
    }

    @Test
    void floatOperandMakesFloat() {
        assertEquals(Value.Type.FLOAT, eval("1 + 1.0").getType());
        assertEquals("2.0", eval("1 + 1.0").display());
    }

    @Test
    void arithmeticFaults() {
        assertEquals("division by zero", fails("1 / 0"));
        assertEquals("division by zero", fails("1 // 0"));
        assertEquals("modulo by zero", fails("1 % 0"));
        assertEquals("Integer overflow", fails("9223372036854775807 + 1"));
        assertEquals("Exponent too large; max 8", fails("2 ** 9"));
        assertEquals("Unsupported operand types for '-': string and int", fails("\"a\" - 1"));
    }

    @Test
    void stringConcatenation() {
        assertEquals(Value.string("n=3"), eval("\"n=\" + 3"));
        assertEquals(Value.string("1.5!"), eval("1.5 + \"!\""));
    }

    @Test
    void comparisonsAndLogic() {
        assertEquals(Value.bool(true), eval("3 < 5"));
        assertEquals(Value.bool(true), eval("1 == 1.0"));
        assertEquals(Value.bool(true), eval("\"abc\" < \"abd\""));
        assertEquals(Value.bool(false), eval("not (2 >= 1)"));
        assertEquals(Value.bool(true), eval("1 < 2 and 2 < 3"));
        assertEquals(Value.bool(true), eval("false or 1 != 2"));
    }

    @Test
    void logicShortCircuits() {
        assertEquals(Value.bool(false), eval("false and 1 / 0"));
        assertEquals(Value.bool(true), eval("true or undefinedName"));
    }

    @Test
    void chainedComparisons_areRejected() {
        assertEquals("Chained comparisons not supported", fails("1 < 2 < 3"));
    }

    @Test
    void builtins() {
        assertEquals(Value.integer(3), eval("len(\"abc\")"));
        assertEquals(Value.integer(0), eval("length(array())"));
        assertEquals(Value.integer(42), eval("toNumber(\"42\")"));
        assertEquals(Value.number(4.5), eval("toNumber(\"4.5\")"));
        assertEquals(Value.integer(3), eval("toNumber(3.9)"));
        assertEquals(Value.integer(1), eval("toNumber(true)"));
        assertEquals(Value.string("2.5"), eval("toString(2.5)"));
        assertEquals(Value.integer(30), eval("at(append(append(array(), 10), 30), -1)"));
        assertEquals("toNumber failed", fails("toNumber(\"abc\")"));
        assertEquals("index out of range", fails("at(array(), 0)"));
        assertEquals("length expects 1 arg", fails("length()"));
    }

    @Test
    void append_isFunctional() {
        Environment env = new Environment();
        env.define("a", Value.array(Arrays.asList(Value.integer(1))));
        Value b = eval("append(a, 2)", env);
        assertEquals(1, env.get("a").asArray().size());
        assertEquals(2, b.asArray().size());
    }

    @Test
    void ecoOps_readsSignal() {
        assertEquals(Value.integer(0), eval("ecoOps()"));
    }

    @Test
    void variables() {
        Environment env = new Environment();
        env.define("x", Value.integer(4));
        assertEquals(Value.integer(8), eval("x * 2", env));
        assertEquals("Undefined variable 'y'", assertThrows(EvalError.class, () -> eval("y", env)).getMessage());
    }

    @Test
    void staticRejection_namesTheElement() {
        assertEquals("Unsupported expression element: Attribute", fails("a.b"));
        assertEquals("Unsupported expression element: Subscript", fails("a[0]"));
        assertEquals("Unsupported expression element: List", fails("[1, 2]"));
        assertEquals("Unsupported expression element: Lambda", fails("lambda: 1"));
        assertEquals("Unsupported function call", fails("print(1)"));
        assertEquals("Unsupported name in expression: __import__", fails("__import__"));
    }

    @Test
    void strictPolicy_rejectsEveryCall() {
        CompiledExpression c = CompiledExpression.compile("len(\"a\")", 0, ExpressionValidator.Policy.STRICT);
        assertFalse(c.isValid());
        EvalError e = assertThrows(EvalError.class, () -> c.evaluate(new Environment()));
        assertEquals("Call not allowed", e.getMessage());
    }

    @Test
    void compileFailure_isDeferredUntilEvaluation() {
        CompiledExpression c = CompiledExpression.compile("1 +", 4);
        assertFalse(c.isValid());
        assertThrows(EvalError.class, () -> c.evaluate(new Environment()));
    }

    @Test
    void arithmeticFlag_tracksBinaryOperators() {
        assertTrue(CompiledExpression.compile("x + 1", 0).hasArithmetic());
        assertFalse(CompiledExpression.compile("-x", 0).hasArithmetic());
        assertFalse(CompiledExpression.compile("x == 1", 0).hasArithmetic());
    }

    @Test
    void errorColumn_isOffsetIntoLine() {
        CompiledExpression c = CompiledExpression.compile("1 / 0", 4);
        EvalError e = assertThrows(EvalError.class, () -> c.evaluate(new Environment()));
        assertEquals(Integer.valueOf(3), e.getColumn());
        assertEquals(7, c.lineColumn(e.getColumn()));
    }

    @Test
    void floatDisplay() {
        assertEquals("2.0", Value.number(2.0).display());
        assertEquals("1e-05", Value.number(0.00001).display());
        assertEquals("1e+16", Value.number(1e16).display());
        assertEquals("0.1", Value.number(0.1).display());
    }
}

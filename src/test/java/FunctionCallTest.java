import org.junit.jupiter.api.Test;

import com.ecolang.script.EcoLang;
import com.ecolang.script.parser.Interpreter;
import com.ecolang.script.parser.StatementParser;
import com.ecolang.script.parser.Value;
import com.ecolang.script.runtime.EcoMeter;
import com.ecolang.script.runtime.ErrorCode;
import com.ecolang.script.runtime.ResourceGovernor;
import com.ecolang.script.runtime.RunResult;
import com.ecolang.script.runtime.RunSettings;
import com.ecolang.script.runtime.ScriptError;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FunctionCallTest {

    private static RunResult run(String src) {
        return new EcoLang().execute(src);
    }

    private static Interpreter interpreter(RunSettings settings) {
        ResourceGovernor governor = new ResourceGovernor(settings, new EcoMeter());
        return new Interpreter(governor, Collections.<String, Object>emptyMap());
    }

    @Test
    void callWithArgs_intoVariable() {
        RunResult r = run(
                "func add a b\n" +
                "  return a + b\n" +
                "end\n" +
                "call add with 2, 3 into r\n" +
                "say r\n");
        assertNull(r.getError());
        assertEquals("5\n", r.getOutput());
        assertEquals(Collections.singletonList("func defined: add"), r.getWarnings());
    }

    @Test
    void callWithoutInto_printsNonNoneResult() {
        RunResult r = run(
                "func greet name\n" +
                "  return \"hi \" + name\n" +
                "end\n" +
                "func quiet\n" +
                "end\n" +
                "call greet with \"bo\"\n" +
                "call quiet\n");
        assertNull(r.getError());
        assertEquals("hi bo\n", r.getOutput());
    }

    @Test
    void argumentsRespectNestedCommasAndQuotes() {
        RunResult r = run(
                "func pair a b\n" +
                "  say a\n" +
                "  say b\n" +
                "end\n" +
                "call pair with \"x, y\", length(append(array(), 1))\n");
        assertNull(r.getError());
        assertEquals(Arrays.asList("x, y", "1"), r.getOutputLines());
    }

    @Test
    void returnInsideNestedBlock_stopsBody() {
        RunResult r = run(
                "func sign n\n" +
                "  if n < 0 then\n" +
                "    return -1\n" +
                "  end\n" +
                "  say \"not reached for negatives\"\n" +
                "  return 1\n" +
                "end\n" +
                "call sign with -5\n");
        assertNull(r.getError());
        assertEquals("-1\n", r.getOutput());
    }

    @Test
    void returnInsideLoop_stopsLoopAndBody() {
        RunResult r = run(
                "func firstOver limit\n" +
                "  for i = 1 to 100\n" +
                "    if i * i > limit then\n" +
                "      return i\n" +
                "    end\n" +
                "  end\n" +
                "end\n" +
                "call firstOver with 50 into n\n" +
                "say n\n");
        assertNull(r.getError());
        assertEquals("8\n", r.getOutput());
    }

    @Test
    void functionFrame_isIsolatedFromCaller() {
        RunResult r = run(
                "let g = 1\n" +
                "func f\n" +
                "  say g\n" +
                "end\n" +
                "call f\n");
        assertNotNull(r.getError());
        assertEquals(ErrorCode.RUNTIME_ERROR, r.getError().getCode());
        assertEquals("Undefined variable 'g'", r.getError().getMessage());
        assertEquals(3, r.getError().getLine(), "errors inside a body keep their own position");
    }

    @Test
    void functionLocals_doNotLeak() {
        Interpreter interp = interpreter(RunSettings.defaults());
        interp.run(new StatementParser(
                "func f a\n  let local = a\nend\ncall f with 3\nlet top = 1\n", 3).parse());
        Map<String, Value> globals = interp.globals();
        assertFalse(globals.containsKey("local"));
        assertFalse(globals.containsKey("a"));
        assertEquals(Value.integer(1), globals.get("top"));
    }

    @Test
    void savePowerInsideFunction_doesNotChangeCallerScale() {
        RunResult plain = run("say 1\n");
        RunResult r = run(
                "func eco\n" +
                "  savePower 50\n" +
                "end\n" +
                "call eco\n" +
                "say 1\n");
        assertNull(r.getError());
        // func 5+5, call 5+20, savePower 5, then say at full price.
        long expected = 10 + 25 + 5 + plain.getEco().getTotalOps();
        assertEquals(expected, r.getEco().getTotalOps());
    }

    @Test
    void unknownFunction_isRuntimeError() {
        RunResult r = run("call nope\n");
        assertEquals(ErrorCode.RUNTIME_ERROR, r.getError().getCode());
        assertEquals("Unknown function 'nope'", r.getError().getMessage());
    }

    @Test
    void argumentCountMismatch_isRuntimeError() {
        RunResult r = run("func f a b\nend\ncall f with 1\n");
        assertEquals(ErrorCode.RUNTIME_ERROR, r.getError().getCode());
        assertEquals("Argument count mismatch", r.getError().getMessage());
        assertEquals(3, r.getError().getLine());
    }

    @Test
    void tooManyParams_isSyntaxError() {
        RunResult r = run("func f a b c d\nend\n");
        assertEquals(ErrorCode.SYNTAX_ERROR, r.getError().getCode());
        assertEquals("Too many params (max 3)", r.getError().getMessage());
    }

    @Test
    void maxFuncParams_comesFromSettings() {
        RunSettings s = RunSettings.builder().maxFuncParams(1).build();
        RunResult r = new EcoLang().execute("func f a b\nend\n", Collections.<String, Object>emptyMap(), s);
        assertEquals("Too many params (max 1)", r.getError().getMessage());
    }

    @Test
    void duplicateParams_isSyntaxError() {
        RunResult r = run("func f a a\nend\n");
        assertEquals(ErrorCode.SYNTAX_ERROR, r.getError().getCode());
        assertEquals("Duplicate parameter 'a'", r.getError().getMessage());
    }

    @Test
    void funcInsideLoop_isDefinedOnce() {
        RunResult r = run(
                "repeat 3 times\n" +
                "  func f\n" +
                "    say 1\n" +
                "  end\n" +
                "end\n" +
                "call f\n");
        assertNull(r.getError());
        assertEquals("1\n", r.getOutput());
        assertEquals(Collections.singletonList("func defined: f"), r.getWarnings());
    }

    @Test
    void redefiningWithDifferentBody_isRuntimeError() {
        RunResult r = run("func f\nend\nfunc f a\nend\n");
        assertEquals(ErrorCode.RUNTIME_ERROR, r.getError().getCode());
        assertEquals("Function 'f' is already defined", r.getError().getMessage());
        assertEquals(3, r.getError().getLine());
    }

    @Test
    void recursion_pastMaxDepthFails() {
        RunResult r = run(
                "func down n\n" +
                "  call down with n + 1\n" +
                "end\n" +
                "call down with 0\n");
        assertEquals(ErrorCode.RUNTIME_ERROR, r.getError().getCode());
        assertEquals("Call depth limit exceeded", r.getError().getMessage());
        assertEquals(2, r.getError().getLine());
    }

    @Test
    void recursion_withinDepthWorks() {
        RunResult r = run(
                "func fact n\n" +
                "  if n <= 1 then\n" +
                "    return 1\n" +
                "  end\n" +
                "  call fact with n - 1 into sub\n" +
                "  return n * sub\n" +
                "end\n" +
                "call fact with 5 into f\n" +
                "say f\n");
        assertNull(r.getError());
        assertEquals("120\n", r.getOutput());
    }

    @Test
    void callDepth_returnsToZeroOnEveryExitPath() {
        Interpreter ok = interpreter(RunSettings.defaults());
        ok.run(new StatementParser("func f\n  return 1\nend\ncall f\n", 3).parse());
        assertEquals(0, ok.callDepth());

        Interpreter failing = interpreter(RunSettings.defaults());
        ScriptError e = assertThrows(ScriptError.class, () -> failing.run(new StatementParser(
                "func f n\n  say 1 / n\nend\ncall f with 0\n", 3).parse()));
        assertEquals("division by zero", e.error().getMessage());
        assertEquals(0, failing.callDepth());

        Interpreter deep = interpreter(RunSettings.defaults());
        assertThrows(ScriptError.class, () -> deep.run(new StatementParser(
                "func f\n  call f\nend\ncall f\n", 3).parse()));
        assertEquals(0, deep.callDepth());
    }

    @Test
    void returnOutsideFunction_isSyntaxError() {
        RunResult r = run("say 1\nreturn 2\n");
        assertEquals(ErrorCode.SYNTAX_ERROR, r.getError().getCode());
        assertEquals(2, r.getError().getLine());
        assertEquals("", r.getOutput());
    }

    @Test
    void intoConst_isRejected() {
        RunResult r = run("const R = 1\nfunc f\n  return 2\nend\ncall f into R\n");
        assertEquals(ErrorCode.RUNTIME_ERROR, r.getError().getCode());
        assertEquals("Cannot reassign const 'R'", r.getError().getMessage());
    }
}

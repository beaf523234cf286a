import org.junit.jupiter.api.Test;

import com.ecolang.script.parser.Statement;
import com.ecolang.script.parser.Statement.Stmt;
import com.ecolang.script.parser.StatementParser;
import com.ecolang.script.runtime.ErrorCode;
import com.ecolang.script.runtime.RunError;
import com.ecolang.script.runtime.ScriptError;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StatementParserTest {

    private static List<Stmt> parse(String src) {
        return new StatementParser(src, 3).parse();
    }

    private static RunError syntax(String src) {
        ScriptError e = assertThrows(ScriptError.class, () -> parse(src));
        assertEquals(ErrorCode.SYNTAX_ERROR, e.code());
        return e.error();
    }

    @Test
    void kindsAndLines() {
        List<Stmt> program = parse(
                "say 1\n" +
                "# comment\n" +
                "let x = 2\n" +
                "const Y = 3\n" +
                "ask z\n" +
                "warn \"w\"\n" +
                "ecoTip\n" +
                "savePower 20\n");
        assertEquals(7, program.size());
        assertEquals(Statement.Kind.SAY, program.get(0).kind());
        assertEquals(Statement.Kind.LET, program.get(1).kind());
        assertEquals(3, program.get(1).line());
        assertEquals(Statement.Kind.CONST, program.get(2).kind());
        assertEquals(Statement.Kind.ASK, program.get(3).kind());
        assertEquals(Statement.Kind.WARN, program.get(4).kind());
        assertEquals(Statement.Kind.ECO_TIP, program.get(5).kind());
        assertEquals(Statement.Kind.SAVE_POWER, program.get(6).kind());
        assertEquals(20.0, ((Statement.SavePower) program.get(6)).level, 0.0);
    }

    @Test
    void nestedBlocks() {
        List<Stmt> program = parse(
                "if a then\n" +
                "  repeat 2 times\n" +
                "    while b then\n" +
                "      say 1\n" +
                "    end\n" +
                "  end\n" +
                "elif c then\n" +
                "  for i = 1 to 3 step 1\n" +
                "  end\n" +
                "else\n" +
                "  say 2\n" +
                "end\n" +
                "say 3\n");
        assertEquals(2, program.size());

        Statement.If ifs = (Statement.If) program.get(0);
        assertEquals(2, ifs.branches.size());
        assertEquals(7, ifs.branches.get(1).line);
        assertEquals(1, ifs.elseBranch.size());

        Statement.Repeat rep = (Statement.Repeat) ifs.branches.get(0).body.get(0);
        assertEquals(2, rep.count);
        assertEquals(Statement.Kind.WHILE, rep.body.get(0).kind());

        Statement.For loop = (Statement.For) ifs.branches.get(1).body.get(0);
        assertEquals("i", loop.variable);
        assertEquals("1", loop.start.source());
        assertEquals("3", loop.end.source());
        assertEquals("1", loop.step.source());
        assertEquals(13, program.get(1).line());
    }

    @Test
    void callHeader() {
        Statement.CallStmt call = (Statement.CallStmt) parse("call f with a + 1, \"x into y\", g(1, 2) into out\n").get(0);
        assertEquals("f", call.name);
        assertEquals("out", call.into);
        assertEquals(Arrays.asList("a + 1", "\"x into y\"", "g(1, 2)"),
                Arrays.asList(call.args.get(0).source(), call.args.get(1).source(), call.args.get(2).source()));
        assertEquals(12, call.args.get(0).offset());

        Statement.CallStmt bare = (Statement.CallStmt) parse("call f\n").get(0);
        assertTrue(bare.args.isEmpty());
        assertNull(bare.into);
    }

    @Test
    void funcHeader() {
        Statement.FuncStmt f = (Statement.FuncStmt) parse("func add a b\n  return a + b\nend\n").get(0);
        assertEquals("add", f.name);
        assertEquals(Arrays.asList("a", "b"), f.params);
        assertEquals(Statement.Kind.RETURN, f.body.get(0).kind());
    }

    @Test
    void expressionOffsetsPointIntoLine() {
        Statement.Assign let = (Statement.Assign) parse("let   total =   1 + 2\n").get(0);
        assertEquals("1 + 2", let.expr.source());
        assertEquals(16, let.expr.offset());
    }

    @Test
    void unknownStatement() {
        RunError e = syntax("say 1\nshout 2\n");
        assertEquals("Unknown statement: shout 2", e.getMessage());
        assertEquals(Integer.valueOf(2), e.getLine());
        assertEquals("Check the command name or syntax.", e.getHint());
    }

    @Test
    void headersNeedTheirKeywords() {
        RunError ifErr = syntax("if x > 1\nend\n");
        assertEquals("Expected 'then' after if condition", ifErr.getMessage());
        assertEquals(Integer.valueOf(9), ifErr.getColumn());
        assertEquals("Write: if <condition> then", ifErr.getHint());

        assertEquals("Expected 'then' after while condition", syntax("while x\nend\n").getMessage());
        assertEquals("Expected 'times' at end of repeat", syntax("repeat 3\nend\n").getMessage());
        assertEquals("Invalid repeat count", syntax("repeat x times\nend\n").getMessage());
        assertEquals("Use: for name = start to end [step s]", syntax("for i in 3\nend\n").getMessage());
        assertEquals("Invalid loop variable name", syntax("for 1i = 1 to 2\nend\n").getMessage());
    }

    @Test
    void unterminatedBlocks() {
        for (String kw : Arrays.asList("if x then", "while x then", "repeat 2 times", "for i = 1 to 2", "func f")) {
            RunError e = syntax("say 0\n" + kw + "\nsay 1\n");
            assertEquals("Missing end for block", e.getMessage());
            assertEquals(Integer.valueOf(2), e.getLine());
            assertEquals(kw, e.getLineText());
            String opener = kw.split(" ")[0];
            assertEquals("Add a matching 'end' for this '" + opener + "'.", e.getHint());
        }
    }

    @Test
    void innerUnterminatedBlock_reportsInnerOpener() {
        RunError e = syntax("if a then\n  repeat 2 times\n  say 1\nend\n");
        // The single 'end' closes the repeat, leaving the if open.
        assertEquals(Integer.valueOf(1), e.getLine());
    }

    @Test
    void strayBlockKeywords() {
        assertEquals("Unexpected 'end'", syntax("say 1\nend\n").getMessage());
        assertEquals("'else' without matching 'if'", syntax("else\n").getMessage());
        assertEquals("'elif' without matching 'if'", syntax("elif x then\n").getMessage());
        assertEquals("'else' without matching 'if'", syntax("repeat 2 times\nelse\nend\n").getMessage());
    }

    @Test
    void assignmentErrors() {
        assertEquals("Expected '=' in let statement", syntax("let x 5\n").getMessage());
        assertEquals("Invalid identifier in let", syntax("let 2x = 5\n").getMessage());
        assertEquals("Invalid identifier in let", syntax("let true = 5\n").getMessage());
        assertEquals("Expected '=' in const", syntax("const X\n").getMessage());
        assertEquals("Invalid const name", syntax("const a-b = 1\n").getMessage());
        assertEquals("Invalid identifier in ask", syntax("ask 9\n").getMessage());
        assertEquals("'_ops_scale' is reserved", syntax("let _ops_scale = 5\n").getMessage());
        assertEquals("'_eco_ops' is reserved", syntax("for _eco_ops = 1 to 2\nend\n").getMessage());
    }

    @Test
    void functionErrors() {
        assertEquals("Missing function name", syntax("func\nend\n").getMessage());
        assertEquals("Invalid function name", syntax("func 1f\nend\n").getMessage());
        assertEquals("Invalid target after 'into'", syntax("call f into 3\n").getMessage());
        assertEquals("'return' outside of a function", syntax("return 1\n").getMessage());
        assertEquals("'return' outside of a function", syntax("if x then\nreturn\nend\n").getMessage());
    }

    @Test
    void savePowerNeedsNumber() {
        assertEquals("Invalid number for savePower", syntax("savePower lots\n").getMessage());
        assertEquals(Statement.Kind.SAVE_POWER, parse("savePower 12.5\n").get(0).kind());
    }

    @Test
    void badExpression_isNotASyntaxError() {
        Statement.Say say = (Statement.Say) parse("say 1 +\n").get(0);
        assertFalse(say.expr.isValid());
    }
}

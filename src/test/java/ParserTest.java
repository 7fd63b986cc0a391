import com.lox.script.LoxScript;
import com.lox.script.parser.Diagnostics;
import com.lox.script.parser.Diagnostics.Diagnostic;
import com.lox.script.parser.Expr;
import com.lox.script.parser.SourcePrinter;
import com.lox.script.parser.Statement;
import com.lox.script.parser.Statement.Stmt;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private final LoxScript lox = new LoxScript();

    private List<Stmt> parseClean(String src) {
        Diagnostics d = new Diagnostics();
        List<Stmt> program = lox.parse(src, d);
        assertFalse(d.hasErrors(), () -> "unexpected diagnostics: " + d.all());
        return program;
    }

    @Test
    void binary_operators_are_left_associative() {
        List<Stmt> program = parseClean("1 - 2 - 3;");
        Expr.Binary outer = (Expr.Binary) ((Statement.ExprStmt) program.get(0)).expression;

        assertTrue(outer.left instanceof Expr.Binary);
        assertTrue(outer.right instanceof Expr.Literal);
    }

    @Test
    void assignment_is_right_associative() {
        List<Stmt> program = parseClean("a = b = 1;");
        Expr.Assign outer = (Expr.Assign) ((Statement.ExprStmt) program.get(0)).expression;

        assertEquals("a", outer.name.lexeme);
        assertTrue(outer.value instanceof Expr.Assign);
    }

    @Test
    void property_assignment_becomes_set() {
        List<Stmt> program = parseClean("a.b.c = 3;");
        Expr.SetExpr set = (Expr.SetExpr) ((Statement.ExprStmt) program.get(0)).expression;

        assertEquals("c", set.name.lexeme);
        assertTrue(set.receiver instanceof Expr.GetExpr);
    }

    @Test
    void chained_calls_and_gets_nest_left_to_right() {
        List<Stmt> program = parseClean("f(1)(2).x(3);");
        Expr.Call last = (Expr.Call) ((Statement.ExprStmt) program.get(0)).expression;

        assertEquals(1, last.arguments.size());
        Expr.GetExpr get = (Expr.GetExpr) last.callee;
        assertEquals("x", get.name.lexeme);
        Expr.Call second = (Expr.Call) get.receiver;
        assertTrue(second.callee instanceof Expr.Call);
    }

    @Test
    void for_loop_desugars_into_block_and_while() {
        List<Stmt> program = parseClean("for (var i = 0; i < 3; i = i + 1) print i;");

        Statement.Block outer = (Statement.Block) program.get(0);
        assertEquals(2, outer.statements.size());
        assertTrue(outer.statements.get(0) instanceof Statement.VarStmt);
        Statement.While loop = (Statement.While) outer.statements.get(1);
        Statement.Block body = (Statement.Block) loop.body;
        assertTrue(body.statements.get(0) instanceof Statement.PrintStmt);
        assertTrue(body.statements.get(1) instanceof Statement.ExprStmt);
    }

    @Test
    void class_with_superclass_and_methods() {
        List<Stmt> program = parseClean("class B < A { init(x) { this.x = x; } get() { return this.x; } }");
        Statement.ClassStmt klass = (Statement.ClassStmt) program.get(0);

        assertEquals("B", klass.name.lexeme);
        assertEquals("A", klass.superclass.name.lexeme);
        assertEquals(2, klass.methods.size());
        assertEquals(1, klass.methods.get(0).params.size());
    }

    @Test
    void invalid_assignment_target_does_not_enter_panic_mode() {
        Diagnostics d = new Diagnostics();
        List<Stmt> program = lox.parse("a + b = c; print 1;", d);

        assertEquals(1, d.all().size());
        Diagnostic diag = d.all().get(0);
        assertEquals(Diagnostics.Phase.SYNTAX, diag.phase);
        assertEquals("Invalid assignment target.", diag.message);
        assertEquals(" at '='", diag.where);
        // both statements still parsed
        assertEquals(2, program.size());
    }

    @Test
    void panic_mode_recovers_and_reports_each_bad_statement() {
        Diagnostics d = new Diagnostics();
        List<Stmt> program = lox.parse(String.join("\n",
            "var = 1;",
            "print 2;",
            "print (3;",
            "var ok = 4;",
            ""
        ), d);

        assertEquals(2, d.all().size());
        assertEquals("[line 1] Error at '=': Expect variable name.", d.all().get(0).toString());
        assertEquals("[line 3] Error at ';': Expect ')' after expression.", d.all().get(1).toString());
        assertEquals(2, program.size());
    }

    @Test
    void missing_semicolon_at_end_reports_at_end() {
        Diagnostics d = new Diagnostics();
        lox.parse("print 1", d);

        assertEquals(1, d.all().size());
        assertEquals("[line 1] Error at end: Expect ';' after value.", d.all().get(0).toString());
    }

    @Test
    void break_outside_loop_is_a_syntax_error() {
        Diagnostics d = new Diagnostics();
        lox.parse("break;", d);
        assertEquals("Can't use 'break' outside of a loop.", d.all().get(0).message);

        Diagnostics nested = new Diagnostics();
        lox.parse("while (true) { fun f() { break; } }", nested);
        assertEquals(1, nested.all().size());
        assertEquals("Can't use 'break' outside of a loop.", nested.all().get(0).message);
    }

    @Test
    void too_many_arguments_is_reported_but_parsing_continues() {
        StringBuilder args = new StringBuilder();
        for (int i = 0; i < 256; i++) {
            if (i > 0) args.append(", ");
            args.append(i);
        }
        Diagnostics d = new Diagnostics();
        List<Stmt> program = lox.parse("f(" + args + "); print 1;", d);

        assertEquals(1, d.all().size());
        assertEquals("Can't have more than 255 arguments.", d.all().get(0).message);
        assertEquals(2, program.size());
    }

    @Test
    void lexical_errors_stop_before_parsing() {
        Diagnostics d = new Diagnostics();
        List<Stmt> program = lox.parse("print 1; @", d);

        assertTrue(program.isEmpty());
        assertTrue(d.has(Diagnostics.Phase.LEXICAL));
        assertFalse(d.has(Diagnostics.Phase.SYNTAX));
    }

    @Test
    void printer_shows_grouping_only_where_source_had_it() {
        List<Stmt> program = parseClean("print (1 + 2) * 3 - -4;");
        assertEquals("print (1 + 2) * 3 - -4;\n", new SourcePrinter().print(program));
    }
}

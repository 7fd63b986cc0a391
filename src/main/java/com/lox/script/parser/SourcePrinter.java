package com.lox.script.parser;

import java.util.List;

import com.lox.script.parser.Expr.Assign;
import com.lox.script.parser.Expr.Binary;
import com.lox.script.parser.Expr.Call;
import com.lox.script.parser.Expr.ExprInterface;
import com.lox.script.parser.Expr.ExprVisitor;
import com.lox.script.parser.Expr.GetExpr;
import com.lox.script.parser.Expr.Grouping;
import com.lox.script.parser.Expr.Literal;
import com.lox.script.parser.Expr.Logical;
import com.lox.script.parser.Expr.SetExpr;
import com.lox.script.parser.Expr.Super;
import com.lox.script.parser.Expr.This;
import com.lox.script.parser.Expr.Unary;
import com.lox.script.parser.Expr.Variable;
import com.lox.script.parser.Statement.Block;
import com.lox.script.parser.Statement.BreakStmt;
import com.lox.script.parser.Statement.ClassStmt;
import com.lox.script.parser.Statement.ExprStmt;
import com.lox.script.parser.Statement.FunctionStmt;
import com.lox.script.parser.Statement.If;
import com.lox.script.parser.Statement.PrintStmt;
import com.lox.script.parser.Statement.ReturnStmt;
import com.lox.script.parser.Statement.Stmt;
import com.lox.script.parser.Statement.StmtVisitor;
import com.lox.script.parser.Statement.VarStmt;
import com.lox.script.parser.Statement.While;

/**
 * Prints an AST back as source text. Parentheses appear exactly where the
 * tree has Grouping nodes, so parsing the output rebuilds the same tree.
 * 'for' loops come out in their desugared block/while form.
 */
public class SourcePrinter implements ExprVisitor<String>, StmtVisitor<String> {
    private static final String INDENT = "  ";

    private int depth = 0;

    public String print(List<Stmt> program) {
        StringBuilder sb = new StringBuilder();
        for (Stmt s : program) sb.append(s.accept(this));
        return sb.toString();
    }

    public String print(ExprInterface expr) {
        return expr.accept(this);
    }

    // -------------------------
    // Statements (each ends with a newline)
    // -------------------------

    @Override
    public String visitExprStmt(ExprStmt stmt) {
        return line(print(stmt.expression) + ";");
    }

    @Override
    public String visitPrintStmt(PrintStmt stmt) {
        return line("print " + print(stmt.expression) + ";");
    }

    @Override
    public String visitVarStmt(VarStmt stmt) {
        if (stmt.initializer == null) return line("var " + stmt.name.lexeme + ";");
        return line("var " + stmt.name.lexeme + " = " + print(stmt.initializer) + ";");
    }

    @Override
    public String visitBlockStmt(Block stmt) {
        return line("{") + nested(stmt.statements) + line("}");
    }

    @Override
    public String visitIfStmt(If stmt) {
        StringBuilder sb = new StringBuilder();
        sb.append(line("if (" + print(stmt.condition) + ")"));
        sb.append(nested(stmt.thenBranch));
        if (stmt.elseBranch != null) {
            sb.append(line("else"));
            sb.append(nested(stmt.elseBranch));
        }
        return sb.toString();
    }

    @Override
    public String visitWhileStmt(While stmt) {
        return line("while (" + print(stmt.condition) + ")") + nested(stmt.body);
    }

    @Override
    public String visitFunctionStmt(FunctionStmt stmt) {
        return function("fun ", stmt);
    }

    @Override
    public String visitClassStmt(ClassStmt stmt) {
        StringBuilder sb = new StringBuilder();
        String header = "class " + stmt.name.lexeme;
        if (stmt.superclass != null) header += " < " + stmt.superclass.name.lexeme;
        sb.append(line(header + " {"));
        depth++;
        for (FunctionStmt method : stmt.methods) sb.append(function("", method));
        depth--;
        sb.append(line("}"));
        return sb.toString();
    }

    @Override
    public String visitReturnStmt(ReturnStmt stmt) {
        if (stmt.value == null) return line("return;");
        return line("return " + print(stmt.value) + ";");
    }

    @Override
    public String visitBreakStmt(BreakStmt stmt) {
        return line("break;");
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public String visitLiteralExpr(Literal expr) {
        if (expr.value == null) return "nil";
        if (expr.value instanceof Double) return Value.formatNumber((Double) expr.value);
        if (expr.value instanceof String) return "\"" + expr.value + "\"";
        return expr.value.toString();
    }

    @Override
    public String visitGroupingExpr(Grouping expr) {
        return "(" + print(expr.expression) + ")";
    }

    @Override
    public String visitUnaryExpr(Unary expr) {
        return expr.operator.lexeme + print(expr.right);
    }

    @Override
    public String visitBinaryExpr(Binary expr) {
        return print(expr.left) + " " + expr.operator.lexeme + " " + print(expr.right);
    }

    @Override
    public String visitLogicalExpr(Logical expr) {
        return print(expr.left) + " " + expr.operator.lexeme + " " + print(expr.right);
    }

    @Override
    public String visitVariableExpr(Variable expr) {
        return expr.name.lexeme;
    }

    @Override
    public String visitAssignExpr(Assign expr) {
        return expr.name.lexeme + " = " + print(expr.value);
    }

    @Override
    public String visitCallExpr(Call expr) {
        StringBuilder sb = new StringBuilder(print(expr.callee)).append('(');
        for (int i = 0; i < expr.arguments.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(print(expr.arguments.get(i)));
        }
        return sb.append(')').toString();
    }

    @Override
    public String visitGetExpr(GetExpr expr) {
        return print(expr.receiver) + "." + expr.name.lexeme;
    }

    @Override
    public String visitSetExpr(SetExpr expr) {
        return print(expr.receiver) + "." + expr.name.lexeme + " = " + print(expr.value);
    }

    @Override
    public String visitThisExpr(This expr) {
        return "this";
    }

    @Override
    public String visitSuperExpr(Super expr) {
        return "super." + expr.method.lexeme;
    }

    // -------------------------
    // Layout
    // -------------------------

    private String function(String keyword, FunctionStmt stmt) {
        StringBuilder params = new StringBuilder();
        for (int i = 0; i < stmt.params.size(); i++) {
            if (i > 0) params.append(", ");
            params.append(stmt.params.get(i).lexeme);
        }
        return line(keyword + stmt.name.lexeme + "(" + params + ") {") + nested(stmt.body) + line("}");
    }

    private String nested(Stmt stmt) {
        depth++;
        try {
            return stmt.accept(this);
        } finally {
            depth--;
        }
    }

    private String nested(List<Stmt> statements) {
        StringBuilder sb = new StringBuilder();
        depth++;
        try {
            for (Stmt s : statements) sb.append(s.accept(this));
        } finally {
            depth--;
        }
        return sb.toString();
    }

    private String line(String text) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < depth; i++) sb.append(INDENT);
        return sb.append(text).append('\n').toString();
    }
}

package com.lox.script.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.lox.debug.Debug;
import com.lox.script.parser.Diagnostics.Phase;
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
 * Static pass that works out, for every local variable reference, how many
 * scopes separate it from its declaration. Mirrors the runtime nesting of
 * blocks, functions and classes with a stack of name -> ready flags.
 */
public class Resolver implements ExprVisitor<Void>, StmtVisitor<Void> {
    private static final String TAG = "Resolver";

    private enum FunctionType { NONE, FUNCTION, METHOD, INITIALIZER }
    private enum ClassType { NONE, CLASS, SUBCLASS }

    private final Diagnostics diagnostics;
    private final Deque<Map<String, Boolean>> scopes = new ArrayDeque<>();
    private IdentityHashMap<ExprInterface, Integer> depths;
    private FunctionType currentFunction = FunctionType.NONE;
    private ClassType currentClass = ClassType.NONE;
    private int lastLine = 0;

    public Resolver(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Resolves a whole program. Semantic errors are reported and resolution
     * carries on, so one pass can surface several of them.
     */
    public ResolutionTable resolve(List<Stmt> program) {
        depths = new IdentityHashMap<>();
        scopes.clear();
        lastLine = 0;
        currentFunction = FunctionType.NONE;
        currentClass = ClassType.NONE;

        try {
            resolveAll(program);
        } catch (StackOverflowError e) {
            diagnostics.report(Phase.SEMANTIC, lastLine, Interpreter.STACK_OVERFLOW);
        }

        Debug.get().d(TAG, "resolved " + depths.size() + " local references");
        return new ResolutionTable(depths);
    }

    private void resolveAll(List<Stmt> statements) {
        for (Stmt s : statements) resolve(s);
    }

    private void resolve(Stmt stmt) { stmt.accept(this); }
    private void resolve(ExprInterface expr) { expr.accept(this); }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public Void visitBlockStmt(Block stmt) {
        beginScope();
        try {
            resolveAll(stmt.statements);
        } finally {
            endScope();
        }
        return null;
    }

    @Override
    public Void visitClassStmt(ClassStmt stmt) {
        ClassType enclosingClass = currentClass;
        currentClass = ClassType.CLASS;

        declare(stmt.name);
        define(stmt.name);

        if (stmt.superclass != null) {
            if (stmt.name.lexeme.equals(stmt.superclass.name.lexeme)) {
                error(stmt.superclass.name, "A class can't inherit from itself.");
            }
            currentClass = ClassType.SUBCLASS;
            resolve(stmt.superclass);

            beginScope();
            scopes.peek().put("super", true);
        }

        beginScope();
        scopes.peek().put("this", true);

        for (FunctionStmt method : stmt.methods) {
            FunctionType type = method.name.lexeme.equals(ClassDescriptor.INITIALIZER)
                    ? FunctionType.INITIALIZER
                    : FunctionType.METHOD;
            resolveFunction(method, type);
        }

        endScope();
        if (stmt.superclass != null) endScope();

        currentClass = enclosingClass;
        return null;
    }

    @Override
    public Void visitExprStmt(ExprStmt stmt) {
        resolve(stmt.expression);
        return null;
    }

    @Override
    public Void visitFunctionStmt(FunctionStmt stmt) {
        // defined before the body so the function can recurse
        declare(stmt.name);
        define(stmt.name);
        resolveFunction(stmt, FunctionType.FUNCTION);
        return null;
    }

    @Override
    public Void visitIfStmt(If stmt) {
        resolve(stmt.condition);
        resolve(stmt.thenBranch);
        if (stmt.elseBranch != null) resolve(stmt.elseBranch);
        return null;
    }

    @Override
    public Void visitPrintStmt(PrintStmt stmt) {
        resolve(stmt.expression);
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt stmt) {
        if (currentFunction == FunctionType.NONE) {
            error(stmt.keyword, "Can't return from top-level code.");
        }
        if (stmt.value != null) {
            if (currentFunction == FunctionType.INITIALIZER) {
                error(stmt.keyword, "Can't return a value from an initializer.");
            }
            resolve(stmt.value);
        }
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt stmt) {
        return null;
    }

    @Override
    public Void visitVarStmt(VarStmt stmt) {
        declare(stmt.name);
        if (stmt.initializer != null) resolve(stmt.initializer);
        define(stmt.name);
        return null;
    }

    @Override
    public Void visitWhileStmt(While stmt) {
        resolve(stmt.condition);
        resolve(stmt.body);
        return null;
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Void visitAssignExpr(Assign expr) {
        resolve(expr.value);
        resolveLocal(expr, expr.name);
        return null;
    }

    @Override
    public Void visitBinaryExpr(Binary expr) {
        resolve(expr.left);
        resolve(expr.right);
        return null;
    }

    @Override
    public Void visitCallExpr(Call expr) {
        resolve(expr.callee);
        for (ExprInterface argument : expr.arguments) resolve(argument);
        return null;
    }

    @Override
    public Void visitGetExpr(GetExpr expr) {
        // property names are looked up dynamically
        resolve(expr.receiver);
        return null;
    }

    @Override
    public Void visitGroupingExpr(Grouping expr) {
        resolve(expr.expression);
        return null;
    }

    @Override
    public Void visitLiteralExpr(Literal expr) {
        return null;
    }

    @Override
    public Void visitLogicalExpr(Logical expr) {
        resolve(expr.left);
        resolve(expr.right);
        return null;
    }

    @Override
    public Void visitSetExpr(SetExpr expr) {
        resolve(expr.value);
        resolve(expr.receiver);
        return null;
    }

    @Override
    public Void visitSuperExpr(Super expr) {
        if (currentClass == ClassType.NONE) {
            error(expr.keyword, "Can't use 'super' outside of a class.");
        } else if (currentClass != ClassType.SUBCLASS) {
            error(expr.keyword, "Can't use 'super' in a class with no superclass.");
        }
        resolveLocal(expr, expr.keyword);
        return null;
    }

    @Override
    public Void visitThisExpr(This expr) {
        if (currentClass == ClassType.NONE) {
            error(expr.keyword, "Can't use 'this' outside of a class.");
            return null;
        }
        resolveLocal(expr, expr.keyword);
        return null;
    }

    @Override
    public Void visitUnaryExpr(Unary expr) {
        resolve(expr.right);
        return null;
    }

    @Override
    public Void visitVariableExpr(Variable expr) {
        if (!scopes.isEmpty() && Boolean.FALSE.equals(scopes.peek().get(expr.name.lexeme))) {
            error(expr.name, "Can't read local variable in its own initializer.");
        }
        resolveLocal(expr, expr.name);
        return null;
    }

    // -------------------------
    // Scope bookkeeping
    // -------------------------

    private void resolveFunction(FunctionStmt function, FunctionType type) {
        FunctionType enclosingFunction = currentFunction;
        currentFunction = type;

        beginScope();
        try {
            for (Token param : function.params) {
                declare(param);
                define(param);
            }
            resolveAll(function.body);
        } finally {
            endScope();
            currentFunction = enclosingFunction;
        }
    }

    private void beginScope() {
        scopes.push(new HashMap<>());
    }

    private void endScope() {
        scopes.pop();
    }

    /** Locals may be redeclared in the same scope; the binding goes back to "not ready". */
    private void declare(Token name) {
        lastLine = name.line;
        if (scopes.isEmpty()) return;
        scopes.peek().put(name.lexeme, false);
    }

    private void define(Token name) {
        if (scopes.isEmpty()) return;
        scopes.peek().put(name.lexeme, true);
    }

    /** Innermost scope first; no hit means the name is global. */
    private void resolveLocal(ExprInterface expr, Token name) {
        lastLine = name.line;
        int hops = 0;
        for (Map<String, Boolean> scope : scopes) {
            if (scope.containsKey(name.lexeme)) {
                depths.put(expr, hops);
                return;
            }
            hops++;
        }
    }

    private void error(Token token, String message) {
        diagnostics.report(Phase.SEMANTIC, token, message);
    }
}

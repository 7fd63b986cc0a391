package com.lox.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import com.lox.debug.Debug;
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
 * Walks the resolved AST. Expressions evaluate to {@link Value}s, statements
 * report how they completed. Runtime errors are thrown as {@link RuntimeError}.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor<Completion> {
    private static final String TAG = "Interpreter";
    public static final String STACK_OVERFLOW = "Stack overflow.";

    final Environment globals;
    Environment env;
    private ResolutionTable locals = ResolutionTable.empty();
    private final Deque<CallFrame> callStack = new ArrayDeque<CallFrame>();
    private final int maxDepth;
    private final Consumer<String> printer;

    public Interpreter(Environment globals, int maxDepth, Consumer<String> printer) {
        this.globals = globals;
        this.env = globals;
        this.maxDepth = maxDepth;
        this.printer = printer;
    }

    /**
     * Executes a program against the given resolution. Tables from earlier runs
     * on this interpreter stay valid, so a prompt can feed it line by line.
     */
    public void run(List<Stmt> program, ResolutionTable table) {
        locals = locals.merge(table);
        env = globals;
        callStack.clear();
        for (Stmt stmt : program) {
            execute(stmt);
        }
    }

    public Environment globals() {
        return globals;
    }

    /** Innermost frame first. */
    public List<String> stackTrace() {
        List<String> out = new ArrayList<>(callStack.size());
        for (CallFrame f : callStack) out.add(f.toString());
        return out;
    }

    private Completion execute(Stmt stmt) {
        return stmt.accept(this);
    }

    private Value eval(ExprInterface expr) {
        return expr.accept(this);
    }

    /** Runs statements in {@code scope}, restoring the current scope on every exit path. */
    Completion executeBlock(List<Stmt> statements, Environment scope) {
        Environment previous = this.env;
        this.env = scope;
        try {
            for (Stmt s : statements) {
                Completion c = execute(s);
                if (!c.isNormal()) return c;
            }
            return Completion.NORMAL;
        } finally {
            this.env = previous;
        }
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public Completion visitExprStmt(ExprStmt stmt) {
        eval(stmt.expression);
        return Completion.NORMAL;
    }

    @Override
    public Completion visitPrintStmt(PrintStmt stmt) {
        Value value = eval(stmt.expression);
        printer.accept(stringify(value));
        return Completion.NORMAL;
    }

    @Override
    public Completion visitVarStmt(VarStmt stmt) {
        Value value = (stmt.initializer == null) ? Value.nil() : eval(stmt.initializer);
        env.define(stmt.name.lexeme, value);
        return Completion.NORMAL;
    }

    @Override
    public Completion visitBlockStmt(Block stmt) {
        return executeBlock(stmt.statements, env.childScope());
    }

    @Override
    public Completion visitIfStmt(If stmt) {
        if (eval(stmt.condition).isTruthy()) return execute(stmt.thenBranch);
        if (stmt.elseBranch != null) return execute(stmt.elseBranch);
        return Completion.NORMAL;
    }

    @Override
    public Completion visitWhileStmt(While stmt) {
        while (eval(stmt.condition).isTruthy()) {
            Completion c = execute(stmt.body);
            if (c.kind == Completion.Kind.BREAK) break;
            if (c.kind == Completion.Kind.RETURN) return c;
        }
        return Completion.NORMAL;
    }

    @Override
    public Completion visitFunctionStmt(FunctionStmt stmt) {
        UserFunction function = new UserFunction(stmt, env, false);
        env.define(stmt.name.lexeme, Value.callable(function));
        return Completion.NORMAL;
    }

    @Override
    public Completion visitClassStmt(ClassStmt stmt) {
        ClassDescriptor superclass = null;
        if (stmt.superclass != null) {
            Value sc = eval(stmt.superclass);
            if (!sc.isClass()) {
                throw new RuntimeError(stmt.superclass.name, "Superclass must be a class.");
            }
            superclass = sc.asClass();
        }

        env.define(stmt.name.lexeme, Value.nil());

        // methods close over a scope holding 'super' when there is a superclass
        Environment methodScope = env;
        if (superclass != null) {
            methodScope = env.childScope();
            methodScope.define("super", Value.callable(superclass));
        }

        Map<String, UserFunction> methods = new LinkedHashMap<>();
        for (FunctionStmt method : stmt.methods) {
            boolean isInit = method.name.lexeme.equals(ClassDescriptor.INITIALIZER);
            methods.put(method.name.lexeme, new UserFunction(method, methodScope, isInit));
        }

        ClassDescriptor klass = new ClassDescriptor(stmt.name.lexeme, superclass, methods);
        env.assign(stmt.name, Value.callable(klass));
        return Completion.NORMAL;
    }

    @Override
    public Completion visitReturnStmt(ReturnStmt stmt) {
        return Completion.returning(stmt.value == null ? Value.nil() : eval(stmt.value));
    }

    @Override
    public Completion visitBreakStmt(BreakStmt stmt) {
        return Completion.BREAK;
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Value visitLiteralExpr(Literal expr) {
        if (expr.value == null) return Value.nil();
        if (expr.value instanceof Boolean) return Value.bool((Boolean) expr.value);
        if (expr.value instanceof Double) return Value.number((Double) expr.value);
        if (expr.value instanceof String) return Value.string((String) expr.value);
        throw new IllegalStateException("Unsupported literal value: " + expr.value);
    }

    @Override
    public Value visitGroupingExpr(Grouping expr) {
        return eval(expr.expression);
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value right = eval(expr.right);
        switch (expr.operator.type) {
            case BANG:
                return Value.bool(!right.isTruthy());
            case MINUS:
                requireNumber(expr.operator, right);
                return Value.number(-right.asNumber());
            default:
                throw new IllegalStateException("Unsupported unary operator: " + expr.operator.type);
        }
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        Token op = expr.operator;

        switch (op.type) {
            case PLUS:
                if (left.getType() == Value.Type.NUMBER && right.getType() == Value.Type.NUMBER) {
                    return Value.number(left.asNumber() + right.asNumber());
                }
                // no implicit coercion: "1" + 1 is an error
                if (left.getType() == Value.Type.STRING && right.getType() == Value.Type.STRING) {
                    return Value.string(left.asString() + right.asString());
                }
                throw new RuntimeError(op, "Operands must be two numbers or two strings.");
            case MINUS:
                requireNumbers(op, left, right);
                return Value.number(left.asNumber() - right.asNumber());
            case STAR:
                requireNumbers(op, left, right);
                return Value.number(left.asNumber() * right.asNumber());
            case SLASH:
                requireNumbers(op, left, right);
                if (right.asNumber() == 0.0) throw new RuntimeError(op, "Division by zero.");
                return Value.number(left.asNumber() / right.asNumber());

            case GREATER:
                requireNumbers(op, left, right);
                return Value.bool(left.asNumber() > right.asNumber());
            case GREATER_EQUAL:
                requireNumbers(op, left, right);
                return Value.bool(left.asNumber() >= right.asNumber());
            case LESS:
                requireNumbers(op, left, right);
                return Value.bool(left.asNumber() < right.asNumber());
            case LESS_EQUAL:
                requireNumbers(op, left, right);
                return Value.bool(left.asNumber() <= right.asNumber());

            case EQUAL_EQUAL:
                return Value.bool(Value.isEqual(left, right));
            case BANG_EQUAL:
                return Value.bool(!Value.isEqual(left, right));

            default:
                throw new IllegalStateException("Unsupported binary operator: " + op.type);
        }
    }

    @Override
    public Value visitLogicalExpr(Logical expr) {
        Value left = eval(expr.left);
        if (expr.operator.type == TokenType.OR) {
            if (left.isTruthy()) return left;
        } else {
            if (!left.isTruthy()) return left;
        }
        return eval(expr.right);
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        return lookUpVariable(expr.name, expr);
    }

    @Override
    public Value visitAssignExpr(Assign expr) {
        Value value = eval(expr.value);
        Integer distance = locals.depthOf(expr);
        if (distance != null) {
            env.assignAt(distance, expr.name, value);
        } else {
            globals.assign(expr.name, value);
        }
        return value;
    }

    @Override
    public Value visitCallExpr(Call expr) {
        Value callee = eval(expr.callee);

        List<Value> args = new ArrayList<Value>(expr.arguments.size());
        for (ExprInterface a : expr.arguments) args.add(eval(a));

        if (callee.getType() != Value.Type.CALLABLE) {
            throw new RuntimeError(expr.paren, "Can only call functions and classes.");
        }
        Callable function = callee.asCallable();
        if (args.size() != function.arity()) {
            throw new RuntimeError(expr.paren,
                    "Expected " + function.arity() + " arguments but got " + args.size() + ".");
        }

        if (callStack.size() >= maxDepth) {
            Debug.get().w(TAG, "call depth limit " + maxDepth + " hit in " + function.name());
            throw new RuntimeError(expr.paren, STACK_OVERFLOW);
        }

        Debug.get().t(TAG, "call " + function.name() + " at line " + expr.paren.line);
        callStack.push(new CallFrame(function.name(), expr.paren.line));
        try {
            return function.call(this, args);
        } catch (RuntimeError e) {
            if (e.frames().isEmpty()) e.recordFrames(stackTrace());
            throw e;
        } catch (StackOverflowError e) {
            // the host stack ran out before the depth limit did
            throw new RuntimeError(expr.paren, STACK_OVERFLOW);
        } finally {
            callStack.pop();
        }
    }

    @Override
    public Value visitGetExpr(GetExpr expr) {
        Value receiver = eval(expr.receiver);
        if (receiver.getType() != Value.Type.INSTANCE) {
            throw new RuntimeError(expr.name, "Only instances have properties.");
        }
        return receiver.asInstance().get(expr.name);
    }

    @Override
    public Value visitSetExpr(SetExpr expr) {
        Value receiver = eval(expr.receiver);
        if (receiver.getType() != Value.Type.INSTANCE) {
            throw new RuntimeError(expr.name, "Only instances have fields.");
        }
        Value value = eval(expr.value);
        receiver.asInstance().set(expr.name, value);
        return value;
    }

    @Override
    public Value visitThisExpr(This expr) {
        return lookUpVariable(expr.keyword, expr);
    }

    @Override
    public Value visitSuperExpr(Super expr) {
        int distance = locals.depthOf(expr);
        ClassDescriptor superclass = env.getAt(distance, "super").asClass();
        // 'this' always lives one scope inside the 'super' scope
        ClassInstance receiver = env.getAt(distance - 1, "this").asInstance();

        UserFunction method = superclass.findMethod(expr.method.lexeme);
        if (method == null) {
            throw new RuntimeError(expr.method, "Undefined property '" + expr.method.lexeme + "'.");
        }
        return Value.callable(method.bind(receiver));
    }

    // -------------------------
    // Helpers
    // -------------------------

    private Value lookUpVariable(Token name, ExprInterface expr) {
        Integer distance = locals.depthOf(expr);
        if (distance != null) {
            return env.getAt(distance, name.lexeme);
        }
        return globals.get(name);
    }

    private static void requireNumber(Token operator, Value operand) {
        if (operand.getType() == Value.Type.NUMBER) return;
        throw new RuntimeError(operator, "Operand must be a number.");
    }

    private static void requireNumbers(Token operator, Value left, Value right) {
        if (left.getType() == Value.Type.NUMBER && right.getType() == Value.Type.NUMBER) return;
        throw new RuntimeError(operator, "Operands must be numbers.");
    }

    public static String stringify(Value value) {
        return value.toString();
    }
}

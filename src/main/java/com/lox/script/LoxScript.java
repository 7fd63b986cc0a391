package com.lox.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import com.lox.debug.Debug;
import com.lox.script.parser.Diagnostics;
import com.lox.script.parser.Diagnostics.Phase;
import com.lox.script.parser.Environment;
import com.lox.script.parser.Interpreter;
import com.lox.script.parser.Lexer;
import com.lox.script.parser.NativeFunction;
import com.lox.script.parser.Parser;
import com.lox.script.parser.ResolutionTable;
import com.lox.script.parser.Resolver;
import com.lox.script.parser.RuntimeError;
import com.lox.script.parser.Statement.Stmt;
import com.lox.script.parser.Token;
import com.lox.script.parser.Value;

/**
 * Core LoxScript engine.
 *
 * - Lox syntax: var / fun / class / if / else / while / for / print / return / break
 * - Types: nil, bool, number (double), string, callable, instance
 * - Classes with single inheritance, initializers ('init'), 'this' and 'super'
 * - Lexical scoping resolved statically before execution
 *
 * Pipeline per run: lex -> parse -> resolve -> interpret. Any lexical,
 * syntax or semantic diagnostic stops the run before execution; the first
 * runtime error ends it. Nothing is thrown to the host for script errors:
 * inspect {@link RunResult#diagnostics()}.
 */
public class LoxScript {
    private static final String TAG = "LoxScript";

    public static final int DEFAULT_MAX_CALL_DEPTH = 256;
    /** Upper bound for {@link #setMaxCallDepth(int)}; deeper script stacks risk the host thread stack. */
    public static final int MAX_CALL_DEPTH_LIMIT = 4096;

    /** Functional interface for host-provided functions. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    private static final class Registration {
        final int arity;
        final BuiltinFunction fn;

        Registration(int arity, BuiltinFunction fn) {
            this.arity = arity;
            this.fn = fn;
        }
    }

    // ===================== ENGINE PUBLIC API =====================

    private final Map<String, Registration> functions = new LinkedHashMap<>();
    private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;
    private Consumer<String> printer = System.out::println;

    public LoxScript() {
        registerCoreBuiltins();
    }

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("max call depth must be positive: " + depth);
        if (depth > MAX_CALL_DEPTH_LIMIT) {
            throw new IllegalArgumentException("max call depth must not exceed " + MAX_CALL_DEPTH_LIMIT + ": " + depth);
        }
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    /** Receives every line written by 'print'. Defaults to System.out. */
    public void setPrinter(Consumer<String> printer) {
        this.printer = (printer == null) ? line -> { } : printer;
    }

    /** Binds a native function in the global scope of every later run. */
    public void registerFunction(String name, int arity, BuiltinFunction fn) {
        if (name == null || name.trim().isEmpty()) throw new IllegalArgumentException("function name must not be empty");
        if (arity < 0) throw new IllegalArgumentException("arity must not be negative: " + arity);
        if (fn == null) throw new IllegalArgumentException("function body must not be null");
        functions.put(name, new Registration(arity, fn));
    }

    /** Runs a program in a fresh global scope. */
    public RunResult run(String source) {
        return newSession().run(source);
    }

    /** A session keeps its globals between runs, as the interactive prompt needs. */
    public Session newSession() {
        return new Session();
    }

    /** Lexes and parses only. Diagnostics land in {@code diagnostics}. */
    public List<Stmt> parse(String source, Diagnostics diagnostics) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        List<Token> tokens = new Lexer(source, diagnostics).tokenize();
        if (diagnostics.hasErrors()) return Collections.emptyList();
        return new Parser(tokens, diagnostics).parse();
    }

    /** Lexes, parses and resolves without executing anything. */
    public Diagnostics check(String source) {
        Diagnostics diagnostics = new Diagnostics();
        List<Stmt> program = parse(source, diagnostics);
        if (!diagnostics.hasErrors()) {
            new Resolver(diagnostics).resolve(program);
        }
        return diagnostics;
    }

    public final class Session {
        private final Interpreter interpreter;
        private final List<String> captured = new ArrayList<>();

        private Session() {
            Environment globals = new Environment();
            for (Map.Entry<String, Registration> e : functions.entrySet()) {
                Registration r = e.getValue();
                globals.define(e.getKey(), Value.callable(new NativeFunction(e.getKey(), r.arity, r.fn)));
            }
            Consumer<String> sink = printer;
            this.interpreter = new Interpreter(globals, maxCallDepth, line -> {
                captured.add(line);
                sink.accept(line);
            });
        }

        public RunResult run(String source) {
            Diagnostics diagnostics = new Diagnostics();
            captured.clear();

            List<Stmt> program = parse(source, diagnostics);
            if (diagnostics.hasErrors()) {
                return aborted("parse", diagnostics);
            }
            Debug.get().d(TAG, "parsed " + program.size() + " top-level statements");

            ResolutionTable table = new Resolver(diagnostics).resolve(program);
            if (diagnostics.hasErrors()) {
                return aborted("resolve", diagnostics);
            }

            try {
                interpreter.run(program, table);
            } catch (RuntimeError e) {
                diagnostics.report(Phase.RUNTIME, e.line(), e.getMessage());
                Debug.get().w(TAG, "runtime error: " + e.getMessage() + " at " + e.frames());
            } catch (StackOverflowError e) {
                // nesting without calls (blocks, expressions) never reaches the call depth check
                diagnostics.report(Phase.RUNTIME, 0, Interpreter.STACK_OVERFLOW);
                Debug.get().w(TAG, "host stack exhausted while interpreting");
            }
            return result(diagnostics);
        }

        public Map<String, Value> globals() {
            return interpreter.globals().snapshot();
        }

        private RunResult aborted(String stage, Diagnostics diagnostics) {
            Debug.get().w(TAG, "run stopped after " + stage + " with "
                    + diagnostics.all().size() + " diagnostic(s)");
            return result(diagnostics);
        }

        private RunResult result(Diagnostics diagnostics) {
            return new RunResult(globals(), new ArrayList<>(captured), diagnostics);
        }
    }

    private void registerCoreBuiltins() {
        registerFunction("clock", 0, args -> Value.number(System.currentTimeMillis() / 1000.0));
    }
}

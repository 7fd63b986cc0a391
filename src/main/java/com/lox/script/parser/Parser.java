package com.lox.script.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.lox.script.parser.Diagnostics.Phase;
import com.lox.script.parser.Expr.Assign;
import com.lox.script.parser.Expr.Binary;
import com.lox.script.parser.Expr.GetExpr;
import com.lox.script.parser.Expr.Grouping;
import com.lox.script.parser.Expr.Literal;
import com.lox.script.parser.Expr.Logical;
import com.lox.script.parser.Expr.SetExpr;
import com.lox.script.parser.Expr.Unary;
import com.lox.script.parser.Expr.Variable;
import com.lox.script.parser.Statement.Block;
import com.lox.script.parser.Statement.ExprStmt;
import com.lox.script.parser.Statement.FunctionStmt;
import com.lox.script.parser.Statement.Stmt;
import com.lox.script.parser.Statement.While;

public class Parser {
    static final int MAX_ARGUMENTS = 255;

    /** Unwinds to the nearest declaration after a syntax error has been reported. */
    private static final class ParseError extends RuntimeException {
        ParseError() {
            super(null, null, false, false);
        }
    }

    private final List<Token> tokens;
    private final Diagnostics diagnostics;
    private int current = 0;
    private int loopDepth = 0;

    public Parser(List<Token> tokens, Diagnostics diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses a whole program. Syntax errors are reported to the diagnostics
     * sink; the returned list then only holds the declarations that parsed.
     */
    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<Stmt>();
        try {
            while (!isAtEnd()) {
                Stmt stmt = declaration();
                if (stmt != null) statements.add(stmt);
            }
        } catch (StackOverflowError e) {
            // nesting deeper than the host stack allows; the rest of the input is dropped
            diagnostics.report(Phase.SYNTAX, peek(), Interpreter.STACK_OVERFLOW);
        }
        return statements;
    }

    private Stmt declaration() {
        try {
            if (match(TokenType.CLASS)) return classDeclaration();
            if (match(TokenType.FUN)) return function("function");
            if (match(TokenType.VAR)) return varDeclaration();
            return statement();
        } catch (ParseError error) {
            synchronize();
            return null;
        }
    }

    private Stmt classDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect class name.");

        Variable superclass = null;
        if (match(TokenType.LESS)) {
            consume(TokenType.IDENTIFIER, "Expect superclass name.");
            superclass = new Variable(previous());
        }

        consume(TokenType.LEFT_BRACE, "Expect '{' before class body.");

        List<FunctionStmt> methods = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            methods.add(function("method"));
        }

        consume(TokenType.RIGHT_BRACE, "Expect '}' after class body.");
        return new Statement.ClassStmt(name, superclass, methods);
    }

    private FunctionStmt function(String kind) {
        Token name = consume(TokenType.IDENTIFIER, "Expect " + kind + " name.");
        consume(TokenType.LEFT_PAREN, "Expect '(' after " + kind + " name.");

        List<Token> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (params.size() >= MAX_ARGUMENTS) {
                    error(peek(), "Can't have more than " + MAX_ARGUMENTS + " parameters.");
                }
                params.add(consume(TokenType.IDENTIFIER, "Expect parameter name."));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");

        consume(TokenType.LEFT_BRACE, "Expect '{' before " + kind + " body.");

        // a loop around the declaration does not make 'break' legal inside the body
        int enclosingLoops = loopDepth;
        loopDepth = 0;
        try {
            List<Stmt> body = block();
            return new FunctionStmt(name, params, body);
        } finally {
            loopDepth = enclosingLoops;
        }
    }

    private Stmt varDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect variable name.");
        Expr.ExprInterface initializer = null;
        if (match(TokenType.EQUAL)) {
            initializer = expression();
        }
        consume(TokenType.SEMICOLON, "Expect ';' after variable declaration.");
        return new Statement.VarStmt(name, initializer);
    }

    private Stmt statement() {
        if (match(TokenType.FOR)) return forStatement();
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.PRINT)) return printStatement();
        if (match(TokenType.RETURN)) return returnStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.BREAK)) return breakStatement();
        if (match(TokenType.LEFT_BRACE)) return new Block(block());
        return exprStatement();
    }

    private Stmt breakStatement() {
        Token keyword = previous();
        if (loopDepth <= 0) {
            error(keyword, "Can't use 'break' outside of a loop.");
        }
        consume(TokenType.SEMICOLON, "Expect ';' after 'break'.");
        return new Statement.BreakStmt(keyword);
    }

    private Stmt printStatement() {
        Expr.ExprInterface value = expression();
        consume(TokenType.SEMICOLON, "Expect ';' after value.");
        return new Statement.PrintStmt(value);
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        Expr.ExprInterface value = null;
        if (!check(TokenType.SEMICOLON)) {
            value = expression();
        }
        consume(TokenType.SEMICOLON, "Expect ';' after return value.");
        return new Statement.ReturnStmt(keyword, value);
    }

    private Stmt ifStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'if'.");
        Expr.ExprInterface condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after if condition.");
        Stmt thenBranch = statement();
        Stmt elseBranch = null;
        if (match(TokenType.ELSE)) elseBranch = statement();
        return new Statement.If(condition, thenBranch, elseBranch);
    }

    private Stmt whileStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'while'.");
        Expr.ExprInterface condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after condition.");

        loopDepth++;
        try {
            Stmt body = statement();
            return new While(condition, body);
        } finally {
            loopDepth--;
        }
    }

    // for (init; cond; inc) body
    // => { init; while (cond) { body; inc; } }
    private Stmt forStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'for'.");

        Stmt initializer;
        if (match(TokenType.SEMICOLON)) {
            initializer = null;
        } else if (match(TokenType.VAR)) {
            initializer = varDeclaration();
        } else {
            initializer = exprStatement();
        }

        Expr.ExprInterface condition = null;
        if (!check(TokenType.SEMICOLON)) {
            condition = expression();
        }
        consume(TokenType.SEMICOLON, "Expect ';' after loop condition.");

        Expr.ExprInterface increment = null;
        if (!check(TokenType.RIGHT_PAREN)) {
            increment = expression();
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after for clauses.");

        loopDepth++;
        Stmt body;
        try {
            body = statement();
        } finally {
            loopDepth--;
        }

        if (increment != null) {
            body = new Block(Arrays.asList(body, new ExprStmt(increment)));
        }

        if (condition == null) condition = new Literal(Boolean.TRUE);
        body = new While(condition, body);

        if (initializer != null) {
            body = new Block(Arrays.asList(initializer, body));
        }

        return body;
    }

    private List<Stmt> block() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            Stmt stmt = declaration();
            if (stmt != null) statements.add(stmt);
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after block.");
        return statements;
    }

    private Stmt exprStatement() {
        Expr.ExprInterface expr = expression();
        consume(TokenType.SEMICOLON, "Expect ';' after expression.");
        return new ExprStmt(expr);
    }

    private Expr.ExprInterface expression() { return assignment(); }

    private Expr.ExprInterface assignment() {
        Expr.ExprInterface expr = or();
        if (match(TokenType.EQUAL)) {
            Token equals = previous();
            Expr.ExprInterface value = assignment();
            if (expr instanceof Variable) {
                Token name = ((Variable) expr).name;
                return new Assign(name, value);
            }
            if (expr instanceof GetExpr) {
                GetExpr get = (GetExpr) expr;
                return new SetExpr(get.receiver, get.name, value);
            }
            // reported, but the parser is not lost: no synchronization needed
            error(equals, "Invalid assignment target.");
        }
        return expr;
    }

    private Expr.ExprInterface or() {
        Expr.ExprInterface expr = and();
        while (match(TokenType.OR)) {
            Token op = previous();
            Expr.ExprInterface right = and();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface and() {
        Expr.ExprInterface expr = equality();
        while (match(TokenType.AND)) {
            Token op = previous();
            Expr.ExprInterface right = equality();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface equality() {
        Expr.ExprInterface expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = comparison();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface comparison() {
        Expr.ExprInterface expr = term();
        while (match(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = term();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface term() {
        Expr.ExprInterface expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = factor();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface factor() {
        Expr.ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface unary() {
        if (match(TokenType.BANG, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            return new Unary(op, right);
        }
        return call();
    }

    private Expr.ExprInterface call() {
        Expr.ExprInterface expr = primary();

        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                expr = finishCall(expr);
            } else if (match(TokenType.DOT)) {
                Token name = consume(TokenType.IDENTIFIER, "Expect property name after '.'.");
                expr = new GetExpr(expr, name);
            } else {
                break;
            }
        }

        return expr;
    }

    private Expr.ExprInterface finishCall(Expr.ExprInterface callee) {
        List<Expr.ExprInterface> arguments = new ArrayList<>();

        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (arguments.size() >= MAX_ARGUMENTS) {
                    error(peek(), "Can't have more than " + MAX_ARGUMENTS + " arguments.");
                }
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }

        Token paren = consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
        return new Expr.Call(callee, paren, arguments);
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Boolean.FALSE);
        if (match(TokenType.TRUE)) return new Literal(Boolean.TRUE);
        if (match(TokenType.NIL)) return new Literal(null);
        if (match(TokenType.NUMBER, TokenType.STRING)) return new Literal(previous().literal);

        if (match(TokenType.SUPER)) {
            Token keyword = previous();
            consume(TokenType.DOT, "Expect '.' after 'super'.");
            Token method = consume(TokenType.IDENTIFIER, "Expect superclass method name.");
            return new Expr.Super(keyword, method);
        }

        if (match(TokenType.THIS)) return new Expr.This(previous());
        if (match(TokenType.IDENTIFIER)) return new Variable(previous());

        if (match(TokenType.LEFT_PAREN)) {
            Expr.ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return new Grouping(expr);
        }

        throw error(peek(), "Expect expression.");
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ParseError error(Token token, String message) {
        diagnostics.report(Phase.SYNTAX, token, message);
        return new ParseError();
    }

    /** Skips to the next statement boundary after a syntax error. */
    private void synchronize() {
        advance();

        while (!isAtEnd()) {
            if (previous().type == TokenType.SEMICOLON) return;

            switch (peek().type) {
                case CLASS:
                case FUN:
                case VAR:
                case FOR:
                case IF:
                case WHILE:
                case PRINT:
                case RETURN:
                    return;
                default:
                    advance();
            }
        }
    }
}

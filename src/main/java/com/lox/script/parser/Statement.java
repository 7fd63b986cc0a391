package com.lox.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        <R> R accept(StmtVisitor<R> visitor);
    }

    public interface StmtVisitor<R> {
        R visitExprStmt(ExprStmt stmt);
        R visitPrintStmt(PrintStmt stmt);
        R visitVarStmt(VarStmt stmt);
        R visitBlockStmt(Block stmt);
        R visitIfStmt(If stmt);
        R visitWhileStmt(While stmt);
        R visitFunctionStmt(FunctionStmt stmt);
        R visitClassStmt(ClassStmt stmt);
        R visitReturnStmt(ReturnStmt stmt);
        R visitBreakStmt(BreakStmt stmt);
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;
        ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitExprStmt(this); }
    }

    public static final class PrintStmt implements Stmt {
        public final Expr.ExprInterface expression;
        PrintStmt(Expr.ExprInterface expression) { this.expression = expression; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitPrintStmt(this); }
    }

    public static final class VarStmt implements Stmt {
        public final Token name;
        public final Expr.ExprInterface initializer; // may be null
        VarStmt(Token name, Expr.ExprInterface initializer) { this.name = name; this.initializer = initializer; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitVarStmt(this); }
    }

    public static final class Block implements Stmt {
        public final List<Stmt> statements;
        Block(List<Stmt> statements) { this.statements = statements; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBlockStmt(this); }
    }

    public static final class If implements Stmt {
        public final Expr.ExprInterface condition;
        public final Stmt thenBranch;
        public final Stmt elseBranch; // may be null
        If(Expr.ExprInterface condition, Stmt thenBranch, Stmt elseBranch) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIfStmt(this); }
    }

    public static final class While implements Stmt {
        public final Expr.ExprInterface condition;
        public final Stmt body;
        While(Expr.ExprInterface condition, Stmt body) {
            this.condition = condition;
            this.body = body;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitWhileStmt(this); }
    }

    public static final class FunctionStmt implements Stmt {
        public final Token name;
        public final List<Token> params;
        public final List<Stmt> body;

        FunctionStmt(Token name, List<Token> params, List<Stmt> body) {
            this.name = name;
            this.params = params;
            this.body = body;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitFunctionStmt(this); }
    }

    public static final class ClassStmt implements Stmt {
        public final Token name;
        public final Expr.Variable superclass; // may be null
        public final List<FunctionStmt> methods;

        ClassStmt(Token name, Expr.Variable superclass, List<FunctionStmt> methods) {
            this.name = name;
            this.superclass = superclass;
            this.methods = methods;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitClassStmt(this); }
    }

    public static final class ReturnStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface value; // may be null

        ReturnStmt(Token keyword, Expr.ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitReturnStmt(this); }
    }

    public static final class BreakStmt implements Stmt {
        public final Token keyword;
        BreakStmt(Token keyword) { this.keyword = keyword; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBreakStmt(this); }
    }
}

package com.lunar.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        <R> R accept(StmtVisitor<R> visitor, Environment env);
    }

    public interface StmtVisitor<R> {
        R visitExprStmt(ExprStmt stmt, Environment env);
        R visitAssignmentStmt(Assignment stmt, Environment env);
        R visitReturnStmt(ReturnStmt stmt, Environment env);
        R visitFunctionStmt(FunctionStmt stmt, Environment env);
        R visitIfStmt(If stmt, Environment env);
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;
        ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }
        public <R> R accept(StmtVisitor<R> visitor, Environment env) { return visitor.visitExprStmt(this, env); }
    }

    /** {@code a, b = expr}: one right-hand expression distributed over the targets. */
    public static final class Assignment implements Stmt {
        public final List<Token> targets;
        public final Expr.ExprInterface value;
        Assignment(List<Token> targets, Expr.ExprInterface value) {
            this.targets = targets;
            this.value = value;
        }
        public <R> R accept(StmtVisitor<R> visitor, Environment env) { return visitor.visitAssignmentStmt(this, env); }
    }

    public static final class ReturnStmt implements Stmt {
        public final Token keyword;
        public final List<Expr.ExprInterface> values;
        ReturnStmt(Token keyword, List<Expr.ExprInterface> values) {
            this.keyword = keyword;
            this.values = values;
        }
        public <R> R accept(StmtVisitor<R> visitor, Environment env) { return visitor.visitReturnStmt(this, env); }
    }

    public static final class FunctionStmt implements Stmt {
        public final Token name;
        public final List<Token> params;
        public final List<Stmt> body;
        /** Declaration form only; both forms bind in the current scope. */
        public final boolean local;

        FunctionStmt(Token name, List<Token> params, List<Stmt> body, boolean local) {
            this.name = name;
            this.params = params;
            this.body = body;
            this.local = local;
        }

        public <R> R accept(StmtVisitor<R> visitor, Environment env) { return visitor.visitFunctionStmt(this, env); }
    }

    public static final class If implements Stmt {
        public final Expr.ExprInterface condition;
        public final List<Stmt> thenBranch;
        public final List<Stmt> elseBranch; // null when there is no else
        If(Expr.ExprInterface condition, List<Stmt> thenBranch, List<Stmt> elseBranch) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
        public <R> R accept(StmtVisitor<R> visitor, Environment env) { return visitor.visitIfStmt(this, env); }
    }
}

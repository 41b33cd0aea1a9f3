package com.lunar.script.parser;

import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor, Environment env);
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr, Environment env);
        R visitVariableExpr(Variable expr, Environment env);
        R visitBinaryExpr(Binary expr, Environment env);
        R visitLogicalExpr(Logical expr, Environment env);
        R visitUnaryExpr(Unary expr, Environment env);
        R visitCallExpr(Call expr, Environment env);
    }

    public static final class Literal implements ExprInterface {
        public final Value value;

        public Literal(Value value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor, Environment env) {
            return visitor.visitLiteralExpr(this, env);
        }
    }

    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor, Environment env) {
            return visitor.visitVariableExpr(this, env);
        }
    }

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor, Environment env) {
            return visitor.visitBinaryExpr(this, env);
        }
    }

    /** {@code and} / {@code or}; the right side is evaluated only when needed. */
    public static final class Logical implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Logical(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor, Environment env) {
            return visitor.visitLogicalExpr(this, env);
        }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor, Environment env) {
            return visitor.visitUnaryExpr(this, env);
        }
    }

    public static final class Call implements ExprInterface {
        public final ExprInterface callee;
        public final Token paren;
        public final List<ExprInterface> arguments;

        public Call(ExprInterface callee, Token paren, List<ExprInterface> arguments) {
            this.callee = callee;
            this.paren = paren;
            this.arguments = arguments;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor, Environment env) {
            return visitor.visitCallExpr(this, env);
        }
    }
}

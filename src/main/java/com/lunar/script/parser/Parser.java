package com.lunar.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.lunar.script.parser.Expr.Binary;
import com.lunar.script.parser.Expr.Call;
import com.lunar.script.parser.Expr.Literal;
import com.lunar.script.parser.Expr.Logical;
import com.lunar.script.parser.Expr.Unary;
import com.lunar.script.parser.Expr.Variable;
import com.lunar.script.parser.Statement.Assignment;
import com.lunar.script.parser.Statement.ExprStmt;
import com.lunar.script.parser.Statement.FunctionStmt;
import com.lunar.script.parser.Statement.If;
import com.lunar.script.parser.Statement.ReturnStmt;
import com.lunar.script.parser.Statement.Stmt;

/**
 * Recursive-descent parser for one logical line.
 *
 * Precedence, lowest first: or, and, comparison, concatenation (..),
 * additive, multiplicative, unary (not, -), primary. Tokens left over after
 * the statement are not inspected. Nesting of blocks, parentheses and unary
 * operators is capped at {@link #MAX_NESTING} so a pathological line fails as
 * a parse error instead of exhausting the stack.
 */
public class Parser {
    public static final int MAX_NESTING = 200;

    private final List<Token> tokens;
    private int current = 0;
    private int nesting = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    /** Parses exactly one top-level statement. */
    public Stmt parse() {
        return declaration();
    }

    private Stmt declaration() {
        nesting++;
        try {
            checkNesting();
            return declarationBody();
        } finally {
            nesting--;
        }
    }

    private Stmt declarationBody() {
        if (match(TokenType.LOCAL)) {
            if (match(TokenType.FUNCTION)) return functionDeclaration(true);
            if (check(TokenType.IDENTIFIER)) return assignment();
            throw error("Expected 'function' or variable name after 'local'.");
        }
        if (match(TokenType.FUNCTION)) return functionDeclaration(false);
        if (match(TokenType.IF)) return ifStatement();
        return statement();
    }

    private Stmt functionDeclaration(boolean local) {
        Token name = consume(TokenType.IDENTIFIER, "Expected function name.");
        consume(TokenType.LEFT_PAREN, "Expected '(' after function name.");

        List<Token> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                params.add(consume(TokenType.IDENTIFIER, "Expected parameter name."));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after parameters.");

        List<Stmt> body = new ArrayList<>();
        while (!check(TokenType.END) && !isAtEnd()) {
            body.add(declaration());
        }
        consume(TokenType.END, "Expected 'end' after function body.");
        return new FunctionStmt(name, params, body, local);
    }

    private Stmt ifStatement() {
        Expr.ExprInterface condition = expression();
        consume(TokenType.THEN, "Expected 'then' after condition.");

        List<Stmt> thenBranch = new ArrayList<>();
        while (!check(TokenType.ELSE) && !check(TokenType.END) && !isAtEnd()) {
            thenBranch.add(declaration());
        }

        List<Stmt> elseBranch = null;
        if (match(TokenType.ELSE)) {
            elseBranch = new ArrayList<>();
            while (!check(TokenType.END) && !isAtEnd()) {
                elseBranch.add(declaration());
            }
        }

        consume(TokenType.END, "Expected 'end' after if statement.");
        return new If(condition, thenBranch, elseBranch);
    }

    private Stmt statement() {
        if (match(TokenType.RETURN)) return returnStatement();
        if (check(TokenType.IDENTIFIER)
                && (peekNext().type == TokenType.EQUAL || peekNext().type == TokenType.COMMA)) {
            return assignment();
        }
        return new ExprStmt(expression());
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        List<Expr.ExprInterface> values = new ArrayList<>();
        // bare 'return' before 'end'/'else' or at end of line
        if (check(TokenType.END) || check(TokenType.ELSE) || isAtEnd()) {
            return new ReturnStmt(keyword, values);
        }
        do {
            values.add(expression());
        } while (match(TokenType.COMMA));
        return new ReturnStmt(keyword, values);
    }

    private Stmt assignment() {
        List<Token> targets = new ArrayList<>();
        do {
            targets.add(consume(TokenType.IDENTIFIER, "Expected variable name."));
        } while (match(TokenType.COMMA));
        consume(TokenType.EQUAL, "Expected '=' after variable name(s).");
        Expr.ExprInterface value = expression();
        return new Assignment(targets, value);
    }

    public Expr.ExprInterface expression() {
        nesting++;
        try {
            checkNesting();
            return or();
        } finally {
            nesting--;
        }
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
        Expr.ExprInterface expr = comparison();
        while (match(TokenType.AND)) {
            Token op = previous();
            Expr.ExprInterface right = comparison();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface comparison() {
        Expr.ExprInterface expr = concat();
        while (match(TokenType.EQUAL_EQUAL, TokenType.TILDE_EQUAL,
                TokenType.LESS, TokenType.LESS_EQUAL,
                TokenType.GREATER, TokenType.GREATER_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = concat();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface concat() {
        Expr.ExprInterface expr = term();
        while (match(TokenType.DOT_DOT)) {
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
        if (match(TokenType.NOT, TokenType.MINUS)) {
            Token op = previous();
            nesting++;
            try {
                checkNesting();
                return new Unary(op, unary());
            } finally {
                nesting--;
            }
        }
        return primary();
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.LEFT_PAREN)) {
            Expr.ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expected ')' after expression.");
            return expr;
        }

        if (match(TokenType.NUMBER)) return new Literal(Value.number((Double) previous().literal));
        if (match(TokenType.STRING)) return new Literal(Value.string((String) previous().literal));
        if (match(TokenType.TRUE)) return new Literal(Value.bool(true));
        if (match(TokenType.FALSE)) return new Literal(Value.bool(false));
        if (match(TokenType.NIL)) return new Literal(Value.nil());

        if (match(TokenType.IDENTIFIER)) {
            Expr.ExprInterface expr = new Variable(previous());
            if (match(TokenType.LEFT_PAREN)) {
                expr = finishCall(expr);
            }
            return expr;
        }

        throw error("Unexpected token in primary expression: " + describe(peek()));
    }

    private Expr.ExprInterface finishCall(Expr.ExprInterface callee) {
        List<Expr.ExprInterface> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        Token paren = consume(TokenType.RIGHT_PAREN, "Expected ')' after function arguments.");
        return new Call(callee, paren, arguments);
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
        throw error(message);
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

    private Token peekNext() {
        if (current + 1 < tokens.size()) return tokens.get(current + 1);
        return tokens.get(tokens.size() - 1);
    }

    private static String describe(Token token) {
        return token.type == TokenType.EOF ? "end of line" : "'" + token.lexeme + "'";
    }

    private void checkNesting() {
        if (nesting > MAX_NESTING) throw error("Nesting too deep (more than " + MAX_NESTING + " levels).");
    }

    private ScriptError error(String message) {
        return ScriptError.parse(message);
    }
}

import org.junit.jupiter.api.Test;

import com.lunar.script.parser.Lexer;
import com.lunar.script.parser.ScriptError;
import com.lunar.script.parser.Token;
import com.lunar.script.parser.TokenType;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LunarLexerTest {

    private static List<TokenType> types(String src) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : new Lexer(src).tokenize()) out.add(t.type);
        return out;
    }

    @Test
    void operators_and_punctuation() {
        assertEquals(List.of(
                TokenType.IDENTIFIER, TokenType.COMMA, TokenType.IDENTIFIER, TokenType.EQUAL,
                TokenType.IDENTIFIER, TokenType.LEFT_PAREN, TokenType.NUMBER, TokenType.RIGHT_PAREN,
                TokenType.DOT_DOT, TokenType.STRING, TokenType.EOF),
                types("a, b = f(1) .. \"x\""));

        assertEquals(List.of(
                TokenType.EQUAL_EQUAL, TokenType.TILDE_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL,
                TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.PLUS, TokenType.MINUS,
                TokenType.STAR, TokenType.SLASH, TokenType.EOF),
                types("== ~= < <= > >= + - * /"));
    }

    @Test
    void keywords_are_reclassified_but_lookalikes_are_identifiers() {
        assertEquals(List.of(
                TokenType.LOCAL, TokenType.FUNCTION, TokenType.RETURN, TokenType.END, TokenType.IF,
                TokenType.THEN, TokenType.ELSE, TokenType.TRUE, TokenType.FALSE, TokenType.NIL,
                TokenType.AND, TokenType.OR, TokenType.NOT, TokenType.EOF),
                types("local function return end if then else true false nil and or not"));

        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF),
                types("ends _local nil2"));
    }

    @Test
    void literals_carry_typed_payloads() {
        List<Token> tokens = new Lexer("x = 42 .. \"hi there\"").tokenize();

        Token num = tokens.get(2);
        assertEquals(TokenType.NUMBER, num.type);
        assertEquals("42", num.lexeme);
        assertEquals(42.0, (Double) num.literal, 1e-9);

        Token str = tokens.get(4);
        assertEquals(TokenType.STRING, str.type);
        assertEquals("\"hi there\"", str.lexeme);
        assertEquals("hi there", str.literal);
    }

    @Test
    void strings_have_no_escape_processing() {
        List<Token> tokens = new Lexer("\"a\\nb\"").tokenize();
        assertEquals("a\\nb", tokens.get(0).literal);
    }

    @Test
    void whitespace_is_skipped_and_eof_always_terminates() {
        assertEquals(List.of(TokenType.EOF), types(""));
        assertEquals(List.of(TokenType.EOF), types(" \t  "));
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.PLUS, TokenType.NUMBER, TokenType.EOF),
                types("\ta\t+ 1  "));
    }

    @Test
    void unexpected_characters_are_lexical_errors() {
        ScriptError e = assertThrows(ScriptError.class, () -> new Lexer("x = 1 @ 2").tokenize());
        assertEquals(ScriptError.Kind.LEXICAL, e.kind());
        assertTrue(e.getMessage().contains("@"));

        // no fractional numbers: the lone '.' is rejected
        assertThrows(ScriptError.class, () -> new Lexer("x = 3.5").tokenize());
        assertThrows(ScriptError.class, () -> new Lexer("x ~ y").tokenize());
        assertThrows(ScriptError.class, () -> new Lexer("x = {}").tokenize());
    }

    @Test
    void unterminated_string_is_a_lexical_error() {
        ScriptError e = assertThrows(ScriptError.class, () -> new Lexer("print(\"oops)").tokenize());
        assertEquals(ScriptError.Kind.LEXICAL, e.kind());
        assertTrue(e.getMessage().contains("Unterminated"));
    }
}

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.oxlang.script.ErrorKind;
import com.oxlang.script.LexError;
import com.oxlang.script.parser.Lexer;
import com.oxlang.script.parser.Token;
import com.oxlang.script.parser.TokenType;

public class OxLexerTest {

    private static List<TokenType> types(String src) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : new Lexer(src).tokenize()) out.add(t.type);
        return out;
    }

    @Test
    void tokens_carryLexemeLiteralAndPosition() {
        List<Token> toks = new Lexer("x += 1.5 // note\n'a\"b'").tokenize();

        assertEquals(5, toks.size());
        assertEquals(TokenType.IDENTIFIER, toks.get(0).type);
        assertEquals("x", toks.get(0).lexeme);
        assertEquals(1, toks.get(0).line);
        assertEquals(1, toks.get(0).column);

        assertEquals(TokenType.PLUS_EQUAL, toks.get(1).type);
        assertEquals(3, toks.get(1).column);

        assertEquals(TokenType.NUMBER, toks.get(2).type);
        assertEquals(1.5, (Double) toks.get(2).literal, 1e-9);

        assertEquals(TokenType.STRING, toks.get(3).type);
        assertEquals("a\"b", toks.get(3).literal);
        assertEquals(2, toks.get(3).line);
        assertEquals(1, toks.get(3).column);

        assertEquals(TokenType.EOF, toks.get(4).type);
    }

    @Test
    void keywordsAndOperators() {
        assertEquals(List.of(
                TokenType.FUNC, TokenType.IDENTIFIER, TokenType.COLON, TokenType.IDENTIFIER,
                TokenType.LEFT_PAREN, TokenType.IDENTIFIER, TokenType.RIGHT_PAREN,
                TokenType.LEFT_BRACE, TokenType.RETURN, TokenType.NIL, TokenType.RIGHT_BRACE,
                TokenType.EOF),
                types("func P:m(self) { return nil }"));

        assertEquals(List.of(
                TokenType.AND_AND, TokenType.OR_OR, TokenType.BANG_EQUAL, TokenType.EQUAL_EQUAL,
                TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL, TokenType.CARET_EQUAL, TokenType.CARET,
                TokenType.SLASH_EQUAL, TokenType.EOF),
                types("&& || != == <= >= ^= ^ /="));

        assertTrue(Lexer.isKeyword("inherits"));
        assertFalse(Lexer.isKeyword("self"));
    }

    @Test
    void tokens_isLazyAndRestartable() {
        Lexer lexer = new Lexer("a = [1, 2]\nfor x in a { }");
        List<Token> first = new ArrayList<>();
        for (Token t : lexer.tokens()) first.add(t);
        List<Token> second = new ArrayList<>();
        for (Token t : lexer.tokens()) second.add(t);

        assertEquals(first, second);
        assertEquals(TokenType.EOF, first.get(first.size() - 1).type);
        assertEquals(1, first.stream().filter(t -> t.type == TokenType.EOF).count());
    }

    @Test
    void emptySource_isJustEof() {
        assertEquals(List.of(TokenType.EOF), types("  // only a comment"));
    }

    @Test
    void unexpectedCharacter_reportsPosition() {
        LexError e = assertThrows(LexError.class, () -> new Lexer("x = 1 # 2").tokenize());
        assertEquals(ErrorKind.LEX, e.kind());
        assertEquals('#', e.offending());
        assertEquals(1, e.line());
        assertEquals(7, e.column());
    }

    @Test
    void loneAmpersandOrPipe_isLexError() {
        assertThrows(LexError.class, () -> new Lexer("a & b").tokenize());
        assertThrows(LexError.class, () -> new Lexer("a | b").tokenize());
    }

    @Test
    void unterminatedString_isLexError() {
        LexError e = assertThrows(LexError.class, () -> new Lexer("s = 'abc").tokenize());
        assertEquals(5, e.column());
        assertTrue(e.getMessage().contains("Unterminated"));
    }
}

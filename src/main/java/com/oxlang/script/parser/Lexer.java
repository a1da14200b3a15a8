package com.oxlang.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import com.oxlang.script.LexError;

/**
 * Converts source text into tokens.
 *
 * {@link #tokens()} is lazy: each iterator scans the source from the start and
 * produces one token per {@code next()}, ending with a single EOF token. Two
 * iterations over the same lexer yield identical sequences.
 */
public class Lexer {
    private final String source;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("func", TokenType.FUNC);
        map.put("struct", TokenType.STRUCT);
        map.put("inherits", TokenType.INHERITS);
        map.put("if", TokenType.IF);
        map.put("else", TokenType.ELSE);
        map.put("while", TokenType.WHILE);
        map.put("for", TokenType.FOR);
        map.put("in", TokenType.IN);
        map.put("return", TokenType.RETURN);
        map.put("break", TokenType.BREAK);
        map.put("continue", TokenType.CONTINUE);
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        map.put("nil", TokenType.NIL);
        map.put("import", TokenType.IMPORT);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        this.source = source;
    }

    /** Lazy, restartable token sequence. */
    public Iterable<Token> tokens() {
        return Scanner::new;
    }

    /** Eagerly scans the whole source. */
    public List<Token> tokenize() {
        List<Token> out = new ArrayList<>();
        for (Token t : tokens()) out.add(t);
        return out;
    }

    public static boolean isKeyword(String word) {
        return keywords.containsKey(word);
    }

    private final class Scanner implements Iterator<Token> {
        private int start = 0;
        private int current = 0;
        private int line = 1;
        private int lineStart = 0;
        private int startLine = 1;
        private int startColumn = 1;
        private boolean finished = false;

        @Override
        public boolean hasNext() {
            return !finished;
        }

        @Override
        public Token next() {
            if (finished) throw new NoSuchElementException();
            while (true) {
                skipTrivia();
                if (isAtEnd()) {
                    finished = true;
                    return new Token(TokenType.EOF, "", null, line, current - lineStart + 1);
                }
                start = current;
                startLine = line;
                startColumn = current - lineStart + 1;
                Token t = scanToken();
                if (t != null) return t;
            }
        }

        private void skipTrivia() {
            while (!isAtEnd()) {
                char c = peek();
                switch (c) {
                    case ' ': case '\r': case '\t':
                        current++;
                        break;
                    case '\n':
                        current++;
                        newLine();
                        break;
                    case '/':
                        if (peekNext() != '/') return;
                        while (!isAtEnd() && peek() != '\n') current++;
                        break;
                    default:
                        return;
                }
            }
        }

        private Token scanToken() {
            char c = advance();
            switch (c) {
                case '(': return token(TokenType.LEFT_PAREN);
                case ')': return token(TokenType.RIGHT_PAREN);
                case '{': return token(TokenType.LEFT_BRACE);
                case '}': return token(TokenType.RIGHT_BRACE);
                case '[': return token(TokenType.LEFT_BRACKET);
                case ']': return token(TokenType.RIGHT_BRACKET);
                case ',': return token(TokenType.COMMA);
                case '.': return token(TokenType.DOT);
                case ':': return token(TokenType.COLON);
                case ';': return token(TokenType.SEMICOLON);
                case '+': return token(match('=') ? TokenType.PLUS_EQUAL : TokenType.PLUS);
                case '-': return token(match('=') ? TokenType.MINUS_EQUAL : TokenType.MINUS);
                case '*': return token(match('=') ? TokenType.STAR_EQUAL : TokenType.STAR);
                case '/': return token(match('=') ? TokenType.SLASH_EQUAL : TokenType.SLASH);
                case '^': return token(match('=') ? TokenType.CARET_EQUAL : TokenType.CARET);
                case '!': return token(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG);
                case '=': return token(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL);
                case '<': return token(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
                case '>': return token(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
                case '&':
                    if (match('&')) return token(TokenType.AND_AND);
                    throw error(c, "Unexpected '&' (did you mean '&&'?)");
                case '|':
                    if (match('|')) return token(TokenType.OR_OR);
                    throw error(c, "Unexpected '|' (did you mean '||'?)");
                case '"':
                case '\'':
                    return string(c);
                default:
                    if (isDigit(c)) return number();
                    if (isAlpha(c)) return identifier();
                    throw error(c, "Unexpected character: " + c);
            }
        }

        private Token identifier() {
            while (isAlphaNumeric(peek())) advance();
            String text = source.substring(start, current);
            return token(keywords.getOrDefault(text, TokenType.IDENTIFIER));
        }

        private Token number() {
            while (isDigit(peek())) advance();
            if (peek() == '.' && isDigit(peekNext())) {
                advance();
                while (isDigit(peek())) advance();
            }
            double value = Double.parseDouble(source.substring(start, current));
            return token(TokenType.NUMBER, value);
        }

        // The other quote character is ordinary text inside the literal.
        private Token string(char quote) {
            while (!isAtEnd() && peek() != quote) {
                if (advance() == '\n') newLine();
            }
            if (isAtEnd()) {
                throw new LexError(quote, "Unterminated string", startLine, startColumn);
            }
            advance();
            String value = source.substring(start + 1, current - 1);
            return token(TokenType.STRING, value);
        }

        private void newLine() {
            line++;
            lineStart = current;
        }

        private boolean isAtEnd() { return current >= source.length(); }
        private char advance() { return source.charAt(current++); }

        private boolean match(char expected) {
            if (isAtEnd()) return false;
            if (source.charAt(current) != expected) return false;
            current++;
            return true;
        }

        private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
        private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

        private Token token(TokenType type) { return token(type, null); }
        private Token token(TokenType type, Object literal) {
            String text = source.substring(start, current);
            return new Token(type, text, literal, startLine, startColumn);
        }

        private LexError error(char c, String msg) {
            return new LexError(c, msg, startLine, startColumn);
        }
    }

    private static boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}

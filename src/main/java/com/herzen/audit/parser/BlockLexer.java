package com.herzen.audit.parser;

import com.herzen.audit.parser.ParserDtos.SourcePosition;
import com.herzen.audit.parser.ParserDtos.Token;
import com.herzen.audit.parser.ParserDtos.TokenType;

import java.util.*;

/**
 * Tokenizer for block source. Every call to {@link #iterator()} restarts scanning from the
 * beginning; tokens are produced on demand and the sequence always ends with one EOF token.
 */
public class BlockLexer implements Iterable<Token> {
    static final Set<String> KEYWORDS = Set.of(
            "block", "major", "minor", "core", "concentration",
            "all-of", "any-of", "of", "courses", "course", "credits", "credit",
            "min", "max", "grade", "at-least", "label",
            "if", "then", "else", "and", "or", "not",
            "total-credits", "gpa", "count-of", "credits-of",
            "ref", "shared", "exclusive");

    private final String source;

    public BlockLexer(String source) {
        this.source = source == null ? "" : source;
    }

    @Override
    public Iterator<Token> iterator() {
        return new Scanner();
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        for (Token token : this) {
            tokens.add(token);
        }
        return tokens;
    }

    private final class Scanner implements Iterator<Token> {
        private int pos;
        private int line = 1;
        private int column = 1;
        private boolean done;

        @Override
        public boolean hasNext() {
            return !done;
        }

        @Override
        public Token next() {
            if (done) throw new NoSuchElementException();
            skipTrivia();
            SourcePosition start = position();
            if (pos >= source.length()) {
                done = true;
                return new Token(TokenType.EOF, "", start);
            }

            char c = source.charAt(pos);
            if (Character.isLetter(c) || c == '_') return word(start);
            if (Character.isDigit(c)) return number(start);
            if (c == '"') return string(start);

            switch (c) {
                case '*' -> {
                    advance();
                    return new Token(TokenType.WILDCARD, "*", start);
                }
                case '{' -> { return single(TokenType.LBRACE, start); }
                case '}' -> { return single(TokenType.RBRACE, start); }
                case '(' -> { return single(TokenType.LPAREN, start); }
                case ')' -> { return single(TokenType.RPAREN, start); }
                case ',' -> { return single(TokenType.COMMA, start); }
                case ';' -> { return single(TokenType.SEMICOLON, start); }
                case '-' -> { return single(TokenType.DASH, start); }
                case '>', '<', '!' -> { return comparator(start); }
                case '=' -> {
                    if (peek(1) == '=') return comparator(start);
                    return single(TokenType.EQUALS, start);
                }
                default -> throw new LexException(start, String.valueOf(c), "Unexpected character '" + c + "'");
            }
        }

        private Token word(SourcePosition start) {
            int begin = pos;
            while (pos < source.length()) {
                char c = source.charAt(pos);
                if (Character.isLetterOrDigit(c) || c == '_') {
                    advance();
                } else if (c == '-' && pos + 1 < source.length() && Character.isLetter(source.charAt(pos + 1))
                        && pos > begin && Character.isLetter(source.charAt(pos - 1))) {
                    advance();
                } else {
                    break;
                }
            }
            String text = source.substring(begin, pos);
            if (pos < source.length() && source.charAt(pos) == '*') {
                advance();
                return new Token(TokenType.WILDCARD, text + "*", start);
            }
            return new Token(KEYWORDS.contains(text) ? TokenType.KEYWORD : TokenType.IDENT, text, start);
        }

        private Token number(SourcePosition start) {
            int begin = pos;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) advance();
            if (peek(0) == '.' && Character.isDigit(peek(1))) {
                advance();
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) advance();
            }
            return new Token(TokenType.NUMBER, source.substring(begin, pos), start);
        }

        private Token string(SourcePosition start) {
            advance();
            StringBuilder sb = new StringBuilder();
            while (pos < source.length()) {
                char c = source.charAt(pos);
                if (c == '"') {
                    advance();
                    return new Token(TokenType.STRING, sb.toString(), start);
                }
                if (c == '\n') break;
                if (c == '\\') {
                    SourcePosition escapeAt = position();
                    advance();
                    char n = peek(0);
                    switch (n) {
                        case '"' -> sb.append('"');
                        case '\\' -> sb.append('\\');
                        case 'n' -> sb.append('\n');
                        case 't' -> sb.append('\t');
                        default -> throw new LexException(escapeAt, "\\" + n, "Unknown escape \\" + n);
                    }
                    advance();
                } else {
                    sb.append(c);
                    advance();
                }
            }
            throw new LexException(start, "\"", "Unterminated string literal");
        }

        private Token comparator(SourcePosition start) {
            char c = source.charAt(pos);
            advance();
            if (peek(0) == '=') {
                advance();
                return new Token(TokenType.COMPARATOR, c + "=", start);
            }
            if (c == '!') throw new LexException(start, "!", "Expected '!='");
            return new Token(TokenType.COMPARATOR, String.valueOf(c), start);
        }

        private Token single(TokenType type, SourcePosition start) {
            String text = String.valueOf(source.charAt(pos));
            advance();
            return new Token(type, text, start);
        }

        private void skipTrivia() {
            while (pos < source.length()) {
                char c = source.charAt(pos);
                if (Character.isWhitespace(c)) {
                    advance();
                } else if (c == '#' || (c == '/' && peek(1) == '/')) {
                    while (pos < source.length() && source.charAt(pos) != '\n') advance();
                } else {
                    return;
                }
            }
        }

        private char peek(int ahead) {
            int i = pos + ahead;
            return i < source.length() ? source.charAt(i) : '\0';
        }

        private void advance() {
            if (source.charAt(pos) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            pos++;
        }

        private SourcePosition position() {
            return new SourcePosition(pos, line, column);
        }
    }
}

package org.finos.legend.sqldialect.sql;

import java.util.List;
import java.util.Locale;

/**
 * SQL Lexer with SavePoint backtracking, inspired by Alibaba Druid.
 *
 * Features:
 * - SavePoint for backtracking: mark(), reset()
 * - FNV-1a hash for O(1) built-in keyword lookup
 * - Dialect keyword and operator registrations ({@link TokenizerSettings});
 *   dialect operators are matched longest first, before the built-in ones
 * - Dialect-specific identifier quotes, string quotes and byte strings
 */
public final class Lexer {

    private final String text;
    private final TokenizerSettings settings;
    private final List<String> dialectOperators;
    private int pos;
    private char ch;

    // Current token state
    private Token token;
    private String stringVal;
    private long hash;
    private int tokenPos;

    public Lexer(String sql) {
        this(sql, TokenizerSettings.ANSI);
    }

    public Lexer(String sql, TokenizerSettings settings) {
        this.text = sql;
        this.settings = settings;
        this.dialectOperators = settings.operatorsLongestFirst();
        this.pos = 0;
        this.ch = pos < text.length() ? text.charAt(pos) : '\0';
        nextToken(); // Prime the lexer
    }

    // ==================== SavePoint for Backtracking ====================

    public record SavePoint(int pos, Token token, String stringVal, long hash, int tokenPos) {}

    public SavePoint mark() {
        return new SavePoint(pos, token, stringVal, hash, tokenPos);
    }

    public void reset(SavePoint sp) {
        this.pos = sp.pos;
        this.token = sp.token;
        this.stringVal = sp.stringVal;
        this.hash = sp.hash;
        this.tokenPos = sp.tokenPos;
        this.ch = pos < text.length() ? text.charAt(pos) : '\0';
    }

    // ==================== Token Access ====================

    public Token token() {
        return token;
    }

    public String stringVal() {
        return stringVal;
    }

    public int tokenPos() {
        return tokenPos;
    }

    public String info() {
        return "pos " + tokenPos + ": " + token + (stringVal != null ? "(" + stringVal + ")" : "");
    }

    // ==================== Scanning ====================

    public void nextToken() {
        skipWhitespaceAndComments();

        tokenPos = pos;
        stringVal = null;
        hash = 0;

        if (pos >= text.length()) {
            token = Token.EOF;
            return;
        }

        // Byte string: e'value', single quotes only
        if (settings.byteStringPrefixes().contains(ch) && peek() == '\'') {
            advance(); // skip prefix
            scanString(Token.BYTE_STRING);
            return;
        }

        // Identifier or keyword
        if (isIdentifierStart(ch)) {
            scanIdentifier();
            return;
        }

        // Quoted identifier: "name" or `name`
        if (settings.identifierQuotes().contains(ch)) {
            scanQuotedIdentifier();
            return;
        }

        // String literal: 'value'
        if (settings.stringQuotes().contains(ch)) {
            scanString(Token.STRING);
            return;
        }

        // Number
        if (isDigit(ch)) {
            scanNumber();
            return;
        }

        // Dialect operators win over built-in ones sharing a prefix
        if (scanDialectOperator()) {
            return;
        }

        scanOperator();
    }

    private void scanIdentifier() {
        int start = pos;
        long h = Token.FNV_OFFSET;

        while (isIdentifierPart(ch)) {
            char c = ch;
            if (c >= 'A' && c <= 'Z') {
                c = (char) (c + 32); // lowercase for hash
            }
            h ^= c;
            h *= Token.FNV_PRIME;
            advance();
        }

        stringVal = text.substring(start, pos);
        hash = h;

        Token kw = settings.keywords().get(stringVal.toUpperCase(Locale.ROOT));
        if (kw == null) {
            kw = Token.keyword(h);
        }
        token = (kw != null) ? kw : Token.IDENTIFIER;
    }

    private void scanQuotedIdentifier() {
        char quote = ch;
        int start = pos;
        advance(); // skip opening quote
        StringBuilder sb = new StringBuilder();

        while (true) {
            if (pos >= text.length()) {
                throw new SQLParseException("Unterminated quoted identifier", start);
            }
            if (ch == quote) {
                if (peek() == quote) {
                    sb.append(quote); // escaped quote
                    advance();
                    advance();
                    continue;
                }
                break;
            }
            sb.append(ch);
            advance();
        }

        advance(); // skip closing quote
        stringVal = sb.toString();
        token = Token.QUOTED_IDENTIFIER;
    }

    private void scanString(Token kind) {
        char quote = ch;
        int start = pos;
        advance(); // skip opening quote
        StringBuilder sb = new StringBuilder();

        while (true) {
            if (pos >= text.length()) {
                throw new SQLParseException("Unterminated string literal", start);
            }
            if (ch == quote) {
                if (peek() == quote) {
                    sb.append(quote);
                    advance();
                    advance();
                    continue;
                }
                break;
            }
            sb.append(ch);
            advance();
        }

        advance(); // skip closing quote
        stringVal = sb.toString();
        token = kind;
    }

    private void scanNumber() {
        int start = pos;
        boolean isDecimal = false;

        while (isDigit(ch)) advance();

        if (ch == '.' && isDigit(peek())) {
            isDecimal = true;
            advance(); // .
            while (isDigit(ch)) advance();
        }

        // Scientific notation: 1e10, 1E-5
        if (ch == 'e' || ch == 'E') {
            isDecimal = true;
            advance();
            if (ch == '+' || ch == '-') advance();
            while (isDigit(ch)) advance();
        }

        stringVal = text.substring(start, pos);
        token = isDecimal ? Token.DECIMAL : Token.INTEGER;
    }

    private boolean scanDialectOperator() {
        for (String op : dialectOperators) {
            if (text.startsWith(op, pos)) {
                for (int i = 0; i < op.length(); i++) {
                    advance();
                }
                stringVal = op;
                token = settings.operators().get(op);
                return true;
            }
        }
        return false;
    }

    private void scanOperator() {
        switch (ch) {
            case '(' -> { advance(); token = Token.LPAREN; }
            case ')' -> { advance(); token = Token.RPAREN; }
            case '[' -> { advance(); token = Token.LBRACKET; }
            case ']' -> { advance(); token = Token.RBRACKET; }
            case ',' -> { advance(); token = Token.COMMA; }
            case ';' -> { advance(); token = Token.SEMICOLON; }
            case '.' -> { advance(); token = Token.DOT; }
            case '+' -> { advance(); token = Token.PLUS; }
            case '-' -> { advance(); token = Token.MINUS; }
            case '*' -> { advance(); token = Token.STAR; }
            case '/' -> { advance(); token = Token.SLASH; }
            case '%' -> { advance(); token = Token.PERCENT; }
            case '=' -> { advance(); token = Token.EQ; }
            case '<' -> {
                advance();
                if (ch == '=') { advance(); token = Token.LE; }
                else if (ch == '>') { advance(); token = Token.NE; }
                else { token = Token.LT; }
            }
            case '>' -> {
                advance();
                if (ch == '=') { advance(); token = Token.GE; }
                else { token = Token.GT; }
            }
            case '!' -> {
                advance();
                if (ch == '=') { advance(); token = Token.NE; }
                else throw new SQLParseException("Expected = after !", pos);
            }
            case '|' -> {
                advance();
                if (ch == '|') { advance(); token = Token.CONCAT; }
                else throw new SQLParseException("Expected | after |", pos);
            }
            case ':' -> {
                advance();
                if (ch == ':') { advance(); token = Token.DOUBLE_COLON; }
                else { token = Token.COLON; }
            }
            default -> throw new SQLParseException("Unexpected character: " + ch, pos);
        }
    }

    // ==================== Helpers ====================

    private void advance() {
        pos++;
        ch = pos < text.length() ? text.charAt(pos) : '\0';
    }

    private char peek() {
        return pos + 1 < text.length() ? text.charAt(pos + 1) : '\0';
    }

    private void skipWhitespaceAndComments() {
        while (true) {
            while (pos < text.length() && Character.isWhitespace(ch)) advance();

            if (ch == '-' && peek() == '-') {
                skipLineComment();
            } else if (ch == '/' && peek() == '*') {
                skipBlockComment();
            } else {
                break;
            }
        }
    }

    private void skipLineComment() {
        while (pos < text.length() && ch != '\n') advance();
        if (ch == '\n') advance();
    }

    private void skipBlockComment() {
        int start = pos;
        advance(); // /
        advance(); // *
        while (pos < text.length()) {
            if (ch == '*' && peek() == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
        throw new SQLParseException("Unterminated block comment", start);
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9') || c == '$';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}

package com.sassed.lexer;

import com.sassed.error.LexException;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.primitive.IntLists;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Single forward pass over SCSS text. Line comments are dropped, block comments are kept as
 * {@link TokenKind#COMMENT} tokens, and interpolations inside strings are tokenized recursively
 * so that braces inside them never end a block.
 */
public class Lexer {
    private final String source;
    private final String sourceName;
    private final MutableIntList lineStarts = IntLists.mutable.empty();
    private int pos;

    public Lexer(String source) {
        this(source, "stdin");
    }

    public Lexer(String source, String sourceName) {
        this.source = source;
        this.sourceName = sourceName;
        lineStarts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                lineStarts.add(i + 1);
            }
        }
    }

    public static List<Token> tokenize(String text) {
        return new Lexer(text).tokenize();
    }

    public List<Token> tokenize() {
        pos = 0;
        MutableList<Token> tokens = Lists.mutable.empty();
        lex(tokens, false);
        tokens.add(new Token(TokenKind.EOF, "", position(source.length()), source.length(), true));
        return tokens;
    }

    public SourcePosition position(int offset) {
        int index = lineStarts.binarySearch(offset);
        int line = index >= 0 ? index : -index - 2;
        return new SourcePosition(sourceName, line + 1, offset - lineStarts.get(line) + 1, offset);
    }

    /**
     * Tokenizes until the end of input or, inside an interpolation, until its closing brace.
     */
    private void lex(MutableList<Token> tokens, boolean insideInterpolation) {
        Deque<Boolean> braces = new ArrayDeque<>();
        while (true) {
            boolean space = skipWhitespaceAndLineComments();
            if (pos >= source.length()) {
                return;
            }
            char c = source.charAt(pos);
            int start = pos;

            if (c == '}') {
                if (braces.isEmpty()) {
                    if (insideInterpolation) {
                        return;
                    }
                    pos++;
                    tokens.add(token(TokenKind.RBRACE, start, space));
                } else {
                    pos++;
                    tokens.add(token(braces.pop() ? TokenKind.INTERPOLATION_END : TokenKind.RBRACE, start, space));
                }
                continue;
            }
            if (c == '#' && peek(1) == '{') {
                pos += 2;
                braces.push(true);
                tokens.add(token(TokenKind.INTERPOLATION_START, start, space));
                continue;
            }
            if (c == '{') {
                pos++;
                braces.push(false);
                tokens.add(token(TokenKind.LBRACE, start, space));
                continue;
            }
            tokens.add(next(tokens, space));
        }
    }

    private Token next(MutableList<Token> tokens, boolean space) {
        int start = pos;
        char c = source.charAt(pos);

        if (c == '/' && peek(1) == '*') {
            int close = source.indexOf("*/", pos + 2);
            if (close < 0) {
                throw new LexException("Unterminated comment", position(start));
            }
            pos = close + 2;
            return token(TokenKind.COMMENT, start, space);
        }
        if (c == '"' || c == '\'') {
            return string(c, space);
        }
        if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
            return number(space);
        }
        if ((c == '-' || c == '+') && startsNumber(pos + 1) && signAllowed(tokens, space)) {
            pos++;
            return number(start, space);
        }
        if (c == '$' && isNameStart(peek(1))) {
            pos++;
            readName();
            // $a-$b subtracts
            if (source.charAt(pos - 1) == '-' && peek(0) == '$') {
                pos--;
            }
            return token(TokenKind.VARIABLE, start, space);
        }
        if (c == '@' && (isNameStart(peek(1)) || peek(1) == '-')) {
            pos++;
            readName();
            return token(TokenKind.AT_KEYWORD, start, space);
        }
        if (c == '!' && peek(1) != '=') {
            pos++;
            while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
                pos++;
            }
            if (isNameStart(peekAt(pos))) {
                readName();
                return token(TokenKind.FLAG, start, space);
            }
            pos = start + 1;
            return token(TokenKind.DELIM, start, space);
        }
        if (c == '#' && isNameChar(peek(1))) {
            pos++;
            readName();
            return token(TokenKind.HASH, start, space);
        }
        if (isIdentifierStart(pos)) {
            readName();
            if (source.regionMatches(true, start, "url", 0, 3) && pos - start == 3 && peek(0) == '(') {
                Token url = url(start, space);
                if (url != null) {
                    return url;
                }
            }
            return token(TokenKind.IDENTIFIER, start, space);
        }

        pos++;
        return switch (c) {
            case '(' -> token(TokenKind.LPAREN, start, space);
            case ')' -> token(TokenKind.RPAREN, start, space);
            case '[' -> token(TokenKind.LBRACKET, start, space);
            case ']' -> token(TokenKind.RBRACKET, start, space);
            case ';' -> token(TokenKind.SEMICOLON, start, space);
            case ':' -> token(TokenKind.COLON, start, space);
            case ',' -> token(TokenKind.COMMA, start, space);
            case '.' -> {
                if (peek(0) == '.' && peek(1) == '.') {
                    pos += 2;
                    yield token(TokenKind.ELLIPSIS, start, space);
                }
                yield token(TokenKind.DELIM, start, space);
            }
            case '=', '!', '<', '>' -> {
                if (peek(0) == '=') {
                    pos++;
                }
                yield token(TokenKind.OPERATOR, start, space);
            }
            case '+', '-', '*', '/', '%' -> token(TokenKind.OPERATOR, start, space);
            default -> token(TokenKind.DELIM, start, space);
        };
    }

    private Token string(char quote, boolean space) {
        int start = pos;
        pos++;
        MutableList<StringPart> parts = Lists.mutable.empty();
        StringBuilder literal = new StringBuilder();
        while (true) {
            if (pos >= source.length()) {
                throw new LexException("Unterminated string", position(start));
            }
            char c = source.charAt(pos);
            if (c == quote) {
                pos++;
                break;
            }
            if (c == '\n') {
                throw new LexException("Unterminated string", position(start));
            }
            if (c == '\\' && pos + 1 < source.length()) {
                if (source.charAt(pos + 1) == '\n') {
                    pos += 2;
                    continue;
                }
                literal.append(c).append(source.charAt(pos + 1));
                pos += 2;
                continue;
            }
            if (c == '#' && peek(1) == '{') {
                flush(literal, parts);
                parts.add(interpolation());
                continue;
            }
            literal.append(c);
            pos++;
        }
        flush(literal, parts);
        return new Token(TokenKind.STRING, source.substring(start, pos), position(start), pos, space, parts);
    }

    /**
     * Unquoted {@code url(...)}. Returns null when the argument is quoted so that the caller
     * lexes it as an ordinary function call.
     */
    private Token url(int start, boolean space) {
        int save = pos;
        pos++;
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
        char first = peek(0);
        if (first == '"' || first == '\'' || first == '$') {
            pos = save;
            return null;
        }
        MutableList<StringPart> parts = Lists.mutable.empty();
        StringBuilder literal = new StringBuilder("url(");
        while (true) {
            if (pos >= source.length()) {
                throw new LexException("Unterminated url", position(start));
            }
            char c = source.charAt(pos);
            if (c == ')') {
                pos++;
                break;
            }
            if (c == '#' && peek(1) == '{') {
                flush(literal, parts);
                parts.add(interpolation());
                continue;
            }
            if (!Character.isWhitespace(c)) {
                literal.append(c);
            }
            pos++;
        }
        literal.append(')');
        flush(literal, parts);
        return new Token(TokenKind.URL, source.substring(start, pos), position(start), pos, space, parts);
    }

    private StringPart.Interpolation interpolation() {
        int start = pos;
        pos += 2;
        MutableList<Token> inner = Lists.mutable.empty();
        lex(inner, true);
        if (pos >= source.length()) {
            throw new LexException("Unterminated interpolation", position(start));
        }
        inner.add(new Token(TokenKind.EOF, "}", position(pos), pos + 1, false));
        pos++;
        return new StringPart.Interpolation(List.copyOf(inner), position(start));
    }

    private Token number(boolean space) {
        return number(pos, space);
    }

    private Token number(int start, boolean space) {
        while (isDigit(peek(0))) {
            pos++;
        }
        if (peek(0) == '.' && isDigit(peek(1))) {
            pos++;
            while (isDigit(peek(0))) {
                pos++;
            }
        }
        if (peek(0) == '%') {
            pos++;
        } else {
            while (Character.isLetter(peek(0))) {
                pos++;
            }
        }
        return token(TokenKind.NUMBER, start, space);
    }

    private boolean startsNumber(int at) {
        char c = peekAt(at);
        return isDigit(c) || (c == '.' && isDigit(peekAt(at + 1)));
    }

    /**
     * A sign directly before a digit belongs to the number when nothing it could subtract
     * from precedes it, or when it follows whitespace (space-separated list element).
     */
    private boolean signAllowed(MutableList<Token> tokens, boolean space) {
        if (tokens.isEmpty()) {
            return true;
        }
        Token previous = tokens.getLast();
        return switch (previous.kind()) {
            case NUMBER, IDENTIFIER, VARIABLE, RPAREN, RBRACKET, STRING, HASH, INTERPOLATION_END, URL -> space;
            default -> true;
        };
    }

    private boolean skipWhitespaceAndLineComments() {
        boolean skipped = false;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
                skipped = true;
            } else if (c == '/' && peek(1) == '/') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    pos++;
                }
                skipped = true;
            } else {
                break;
            }
        }
        return skipped;
    }

    private void readName() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\' && pos + 1 < source.length()) {
                pos += 2;
            } else if (isNameChar(c)) {
                pos++;
            } else {
                break;
            }
        }
    }

    private boolean isIdentifierStart(int at) {
        char c = peekAt(at);
        if (isNameStart(c) || c == '\\') {
            return true;
        }
        if (c == '-') {
            char next = peekAt(at + 1);
            return isNameStart(next) || next == '-' || next == '\\';
        }
        return false;
    }

    private static void flush(StringBuilder literal, MutableList<StringPart> parts) {
        if (literal.length() > 0) {
            parts.add(new StringPart.Literal(literal.toString()));
            literal.setLength(0);
        }
    }

    private Token token(TokenKind kind, int start, boolean space) {
        return new Token(kind, source.substring(start, pos), position(start), pos, space);
    }

    private char peek(int ahead) {
        return peekAt(pos + ahead);
    }

    private char peekAt(int at) {
        return at < source.length() ? source.charAt(at) : '\0';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_' || c > 0x7F;
    }

    private static boolean isNameChar(char c) {
        return isNameStart(c) || isDigit(c) || c == '-';
    }
}

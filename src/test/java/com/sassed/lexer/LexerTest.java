package com.sassed.lexer;

import com.sassed.error.LexException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private List<TokenKind> kinds(String text) {
        return Lexer.tokenize(text).stream().map(Token::kind).collect(Collectors.toList());
    }

    private List<String> texts(String text) {
        return Lexer.tokenize(text).stream()
                .filter(token -> token.kind() != TokenKind.EOF)
                .map(Token::text)
                .collect(Collectors.toList());
    }

    // ============================================================
    // Basic tokens
    // ============================================================

    @Test
    public void testVariableDeclaration() {
        assertEquals(List.of(TokenKind.VARIABLE, TokenKind.COLON, TokenKind.NUMBER, TokenKind.SEMICOLON, TokenKind.EOF),
                kinds("$a: 10px;"));
    }

    @Test
    public void testRuleWithDeclaration() {
        assertEquals(List.of("a", "{", "color", ":", "red", ";", "}"), texts("a { color: red; }"));
    }

    @Test
    public void testLineCommentsAreDroppedBlockCommentsKept() {
        List<Token> tokens = Lexer.tokenize("a: b; // gone\n/* kept */");
        assertEquals(TokenKind.COMMENT, tokens.get(4).kind());
        assertEquals("/* kept */", tokens.get(4).text());
        assertEquals(TokenKind.EOF, tokens.get(5).kind());
    }

    @Test
    public void testFlags() {
        List<Token> tokens = Lexer.tokenize("$a: 1 !default; b: c ! important");
        assertEquals(TokenKind.FLAG, tokens.get(3).kind());
        assertEquals("default", tokens.get(3).name());
        Token important = tokens.get(8);
        assertEquals(TokenKind.FLAG, important.kind());
        assertEquals("important", important.name());
    }

    @Test
    public void testNotEqualsIsAnOperator() {
        List<Token> tokens = Lexer.tokenize("$a != $b");
        assertTrue(tokens.get(1).is(TokenKind.OPERATOR, "!="));
    }

    // ============================================================
    // Numbers and signs
    // ============================================================

    @Test
    public void testNegativeNumberAfterSpaceIsOneToken() {
        assertEquals(List.of("10px", "-5px"), texts("10px -5px"));
    }

    @Test
    public void testGluedMinusIsSubtraction() {
        assertEquals(List.of("10px", "-", "5px"), texts("10px-5px"));
    }

    @Test
    public void testVariableMinusVariable() {
        assertEquals(List.of("$a", "-", "$b"), texts("$a-$b"));
    }

    @Test
    public void testHyphenatedVariableName() {
        assertEquals(List.of("$font-size"), texts("$font-size"));
    }

    @Test
    public void testPercentageAndDecimal() {
        assertEquals(List.of("50%", ".5em"), texts("50% .5em"));
    }

    // ============================================================
    // Strings, urls and interpolation
    // ============================================================

    @Test
    public void testStringInterpolationIsTokenizedRecursively() {
        Token string = Lexer.tokenize("\"a#{$b + 1}c\"").get(0);
        assertEquals(TokenKind.STRING, string.kind());
        assertEquals(3, string.parts().size());
        assertEquals(new StringPart.Literal("a"), string.parts().get(0));
        StringPart.Interpolation interpolation = (StringPart.Interpolation) string.parts().get(1);
        assertEquals(List.of(TokenKind.VARIABLE, TokenKind.OPERATOR, TokenKind.NUMBER, TokenKind.EOF),
                interpolation.tokens().stream().map(Token::kind).collect(Collectors.toList()));
        assertEquals(new StringPart.Literal("c"), string.parts().get(2));
    }

    @Test
    public void testBracesInsideInterpolationDoNotCloseBlocks() {
        assertEquals(List.of(TokenKind.DELIM, TokenKind.IDENTIFIER, TokenKind.INTERPOLATION_START, TokenKind.VARIABLE,
                        TokenKind.INTERPOLATION_END, TokenKind.LBRACE, TokenKind.RBRACE, TokenKind.EOF),
                kinds(".a-#{$b} { }"));
    }

    @Test
    public void testUnquotedUrlKeepsSlashes() {
        Token url = Lexer.tokenize("url(http://example.com/a.png)").get(0);
        assertEquals(TokenKind.URL, url.kind());
        assertEquals("url(http://example.com/a.png)", url.text());
    }

    @Test
    public void testQuotedUrlIsAFunctionCall() {
        assertEquals(List.of(TokenKind.IDENTIFIER, TokenKind.LPAREN, TokenKind.STRING, TokenKind.RPAREN, TokenKind.EOF),
                kinds("url(\"a.png\")"));
    }

    // ============================================================
    // Positions and errors
    // ============================================================

    @Test
    public void testPositionsAreOneBased() {
        Token b = Lexer.tokenize("a {\n  b: c;\n}").get(2);
        assertEquals("b", b.text());
        assertEquals(2, b.position().line());
        assertEquals(3, b.position().column());
    }

    @Test
    public void testUnterminatedString() {
        LexException e = assertThrows(LexException.class, () -> Lexer.tokenize("a: \"abc"));
        assertEquals("Unterminated string", e.reason());
        assertEquals(3, e.position().orElseThrow().offset());
    }

    @Test
    public void testUnterminatedComment() {
        LexException e = assertThrows(LexException.class, () -> Lexer.tokenize("/* open"));
        assertEquals(0, e.position().orElseThrow().offset());
    }
}

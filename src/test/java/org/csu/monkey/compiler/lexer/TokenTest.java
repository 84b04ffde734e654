package org.csu.monkey.compiler.lexer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TokenTest {

    @Test
    void testTokenIsValue() {
        Token a = new Token(TokenType.INT, "5");
        Token b = new Token(TokenType.INT, "5");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new Token(TokenType.STRING, "5"));
    }

    @Test
    void testLiteralOf() {
        assertEquals("let", Token.literalOf(new Token(TokenType.LET, "let")));
        assertEquals("", Token.literalOf(null));
        assertEquals("", Token.literalOf(new Token(TokenType.ILLEGAL, null)));
    }

    @Test
    void testToString() {
        String text = new Token(TokenType.IDENT, "foo").toString();
        System.out.println("Token: " + text);
        assertTrue(text.startsWith("Token[Type=IDENT"));
        assertTrue(text.contains("Literal='foo'"));
    }
}

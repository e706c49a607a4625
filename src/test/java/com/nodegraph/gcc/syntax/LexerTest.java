package com.nodegraph.gcc.syntax;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.Test;

import static org.junit.Assert.*;

public class LexerTest {

    private static List<TokenType> types(String source) {
        return Lexer.tokenize(source).stream().map(Token::type).collect(Collectors.toList());
    }

    @Test
    public void testSimpleAssignment() {
        List<Token> tokens = Lexer.tokenize("value = MakeValue()\n");
        assertEquals(TokenType.NAME, tokens.get(0).type());
        assertEquals("value", tokens.get(0).text());
        assertTrue(tokens.get(1).isOp("="));
        assertTrue(tokens.get(2).isName("MakeValue"));
        assertEquals(TokenType.NEWLINE, tokens.get(5).type());
        assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).type());
    }

    @Test
    public void testIndentAndDedent() {
        List<TokenType> t = types("if x:\n    y()\nz()\n");
        assertEquals(1, t.stream().filter(tt -> tt == TokenType.INDENT).count());
        assertEquals(1, t.stream().filter(tt -> tt == TokenType.DEDENT).count());
        assertTrue(t.indexOf(TokenType.INDENT) < t.indexOf(TokenType.DEDENT));
    }

    @Test
    public void testCommentsAndBlankLinesSkipped() {
        List<TokenType> t = types("# header\n\n   \na()  # trailing\n");
        assertEquals(List.of(TokenType.NAME, TokenType.OP, TokenType.OP, TokenType.NEWLINE, TokenType.EOF), t);
    }

    @Test
    public void testNewlinesInsideBracketsIgnored() {
        List<TokenType> t = types("Print(\n    value=1,\n)\n");
        assertEquals(1, t.stream().filter(tt -> tt == TokenType.NEWLINE).count());
        assertFalse(t.contains(TokenType.INDENT));
    }

    @Test
    public void testStringsAndNumbers() {
        List<Token> tokens = Lexer.tokenize("f(\"a\\\"b\", 'c', 1.5, -2)\n");
        assertEquals(TokenType.STRING, tokens.get(2).type());
        assertEquals(TokenType.STRING, tokens.get(4).type());
        assertEquals(TokenType.NUMBER, tokens.get(6).type());
        assertEquals("1.5", tokens.get(6).text());
    }

    @Test
    public void testLineNumbers() {
        List<Token> tokens = Lexer.tokenize("a()\n\nb()\n");
        Token b = tokens.stream().filter(t -> t.isName("b")).findFirst().orElseThrow();
        assertEquals(3, b.line());
    }

    @Test
    public void testInconsistentDedent() {
        try {
            Lexer.tokenize("if x:\n        a()\n    b()\n");
            fail("Expected GraphSyntaxException");
        } catch (GraphSyntaxException e) {
            assertEquals(3, e.getLine());
        }
    }
}

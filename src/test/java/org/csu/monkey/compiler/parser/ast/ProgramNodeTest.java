package org.csu.monkey.compiler.parser.ast;

import org.csu.monkey.compiler.lexer.Token;
import org.csu.monkey.compiler.lexer.TokenType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.csu.monkey.compiler.parser.ast.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 根节点 Program 的聚合行为测试
 */
public class ProgramNodeTest {

    private ProgramNode program;

    @BeforeEach
    void setUp() {
        // let add = fn(a, b) { return a + b; };  add(1, 2 * 3);
        FunctionLiteralNode add = new FunctionLiteralNode(
                new Token(TokenType.FUNCTION, "fn"),
                List.of(ident("a"), ident("b")),
                block(ret(infix(ident("a"), "+", ident("b")))));
        CallExpressionNode call = new CallExpressionNode(
                new Token(TokenType.LPAREN, "("),
                ident("add"),
                List.of(integer(1), infix(integer(2), "*", integer(3))));
        program = new ProgramNode(List.of(
                let("add", add),
                new ExpressionStatementNode(new Token(TokenType.IDENT, "add"), call)));
    }

    @Test
    void testRenderConcatenatesStatements() {
        System.out.println("--- Test: Program render ---");
        String text = program.render();
        System.out.println("Rendered: " + text);
        assertEquals("let add = fn(a, b)return  (a + b);;add(1, (2 * 3))", text);
    }

    @Test
    void testTokenLiteralConcatenatesStatements() {
        assertEquals("letadd", program.tokenLiteral());
    }

    @Test
    void testEmptyProgram() {
        ProgramNode empty = new ProgramNode(List.of());
        assertEquals("", empty.render());
        assertEquals("", empty.tokenLiteral());
        assertTrue(new ProgramNode(null).statements().isEmpty());
    }

    @Test
    void testSingleLetStatement() {
        ProgramNode single = new ProgramNode(List.of(let("myVar", ident("anotherVar"))));
        assertEquals("let myVar = anotherVar;", single.render());
    }

    @Test
    void testConcurrentReaders() throws Exception {
        String expected = program.render();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                results.add(pool.submit(() -> program.render()));
            }
            for (Future<String> result : results) {
                assertEquals(expected, result.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }
}

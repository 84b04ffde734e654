package org.csu.monkey.compiler.parser.ast;

import org.csu.monkey.compiler.lexer.Token;

/**
 * AST 节点: 表达式语句, 例如单独一行的 x + 10;
 *
 * @param token      表达式的第一个 token
 * @param expression 被包装的表达式
 */
public record ExpressionStatementNode(
        Token token,
        ExpressionNode expression
) implements StatementNode {

    @Override
    public String render() {
        return AstStrings.render(expression);
    }
}

package org.csu.monkey.compiler.parser.ast;

import org.csu.monkey.compiler.lexer.Token;

/**
 * AST 节点: 表示一个二元运算表达式 (e.g., a + b, x == y)
 *
 * @param token    运算符 token
 * @param left     左操作数
 * @param operator 运算符文本
 * @param right    右操作数
 */
public record InfixExpressionNode(
        Token token,
        ExpressionNode left,
        String operator,
        ExpressionNode right
) implements ExpressionNode {

    @Override
    public String render() {
        return "(" + AstStrings.render(left)
                + " " + (operator == null ? "" : operator) + " "
                + AstStrings.render(right) + ")";
    }
}

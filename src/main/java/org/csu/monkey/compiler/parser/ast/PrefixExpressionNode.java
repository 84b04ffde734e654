package org.csu.monkey.compiler.parser.ast;

import org.csu.monkey.compiler.lexer.Token;

/**
 * AST 节点: 前缀表达式 (e.g., -5, !ok)
 *
 * @param token    前缀运算符 token
 * @param operator 运算符文本, "-" 或 "!"
 * @param right    操作数
 */
public record PrefixExpressionNode(
        Token token,
        String operator,
        ExpressionNode right
) implements ExpressionNode {

    // 总是加括号, 不依赖优先级表
    @Override
    public String render() {
        return "(" + (operator == null ? "" : operator) + AstStrings.render(right) + ")";
    }
}

package org.csu.monkey.compiler.parser.ast;

import org.csu.monkey.compiler.lexer.Token;

/**
 * AST 节点: 数组或哈希的下标访问, e.g., arr[0], map["key"]
 *
 * @param token "[" 分隔符
 * @param left  被索引的集合表达式
 * @param index 下标表达式
 */
public record IndexExpressionNode(
        Token token,
        ExpressionNode left,
        ExpressionNode index
) implements ExpressionNode {

    @Override
    public String render() {
        return "(" + AstStrings.render(left) + "[" + AstStrings.render(index) + "])";
    }
}

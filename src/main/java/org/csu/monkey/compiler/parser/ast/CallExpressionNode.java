package org.csu.monkey.compiler.parser.ast;

import org.csu.monkey.compiler.lexer.Token;

import java.util.List;

/**
 * AST 节点: 函数调用表达式
 *
 * @param token     "(" 分隔符
 * @param function  被调用者, 标识符或函数字面量
 * @param arguments 实参列表
 */
public record CallExpressionNode(
        Token token,
        ExpressionNode function,
        List<ExpressionNode> arguments
) implements ExpressionNode {

    public CallExpressionNode {
        arguments = AstStrings.ownedCopy(arguments);
    }

    @Override
    public String render() {
        return AstStrings.render(function) + "(" + AstStrings.join(arguments, ", ") + ")";
    }
}

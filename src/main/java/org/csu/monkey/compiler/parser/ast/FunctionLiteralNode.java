package org.csu.monkey.compiler.parser.ast;

import org.csu.monkey.compiler.lexer.Token;

import java.util.List;

/**
 * AST 节点: 函数字面量, e.g., fn(x, y) { x + y; }
 *
 * @param token      "fn" 关键字
 * @param parameters 形参列表
 * @param body       函数体
 */
public record FunctionLiteralNode(
        Token token,
        List<IdentifierNode> parameters,
        BlockStatementNode body
) implements ExpressionNode {

    public FunctionLiteralNode {
        parameters = AstStrings.ownedCopy(parameters);
    }

    // 函数体同样不带花括号: fn(x, y)(x + y)
    @Override
    public String render() {
        return tokenLiteral() + "(" + AstStrings.join(parameters, ", ") + ")" + AstStrings.render(body);
    }
}

package org.csu.monkey.compiler.parser.ast;

import org.csu.monkey.compiler.lexer.Token;

/**
 * AST 节点: 整数字面量
 *
 * @param token INT token, 保留源码中的原始写法
 * @param value 解析后的 64 位有符号整数值
 */
public record IntegerLiteralNode(Token token, long value) implements ExpressionNode {

    // 输出源码写法而不是重新格式化的数值, 例如 007 仍然是 007
    @Override
    public String render() {
        return tokenLiteral();
    }
}

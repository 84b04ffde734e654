package org.csu.monkey.compiler.parser.ast;

import org.csu.monkey.compiler.lexer.Token;

/**
 * AST 节点: 字符串字面量
 *
 * @param token STRING token, 词素值为去掉引号后的内容
 * @param value 字符串内容
 */
public record StringLiteralNode(Token token, String value) implements ExpressionNode {

    @Override
    public String render() {
        return tokenLiteral();
    }
}

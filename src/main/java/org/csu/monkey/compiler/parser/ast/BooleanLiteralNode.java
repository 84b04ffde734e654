package org.csu.monkey.compiler.parser.ast;

import org.csu.monkey.compiler.lexer.Token;

/**
 * AST 节点: 布尔字面量 true / false
 */
public record BooleanLiteralNode(Token token, boolean value) implements ExpressionNode {

    @Override
    public String render() {
        return value ? "true" : "false";
    }
}

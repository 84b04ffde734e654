package org.csu.monkey.compiler.parser.ast;

import org.csu.monkey.compiler.lexer.Token;

/**
 * AST 节点: 表示一个标识符, 如变量名或函数参数名
 *
 * @param token IDENT token
 * @param value 标识符名称
 */
public record IdentifierNode(Token token, String value) implements ExpressionNode {

    @Override
    public String render() {
        return value == null ? "" : value;
    }
}

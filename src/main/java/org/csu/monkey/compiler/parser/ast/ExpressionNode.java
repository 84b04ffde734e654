package org.csu.monkey.compiler.parser.ast;

import org.csu.monkey.compiler.lexer.Token;

/**
 * AST 节点: 表达式, 产生一个值
 */
public sealed interface ExpressionNode extends Node
        permits IdentifierNode, IntegerLiteralNode, StringLiteralNode, BooleanLiteralNode,
                PrefixExpressionNode, InfixExpressionNode, IfExpressionNode, FunctionLiteralNode,
                CallExpressionNode, ArrayLiteralNode, IndexExpressionNode, HashLiteralNode {

    Token token();

    @Override
    default String tokenLiteral() {
        return Token.literalOf(token());
    }
}

package org.csu.monkey.compiler.parser.ast;

import org.csu.monkey.compiler.lexer.Token;

/**
 * AST 节点: 语句, 不产生值
 */
public sealed interface StatementNode extends Node
        permits LetStatementNode, ReturnStatementNode, ExpressionStatementNode, BlockStatementNode {

    Token token();

    @Override
    default String tokenLiteral() {
        return Token.literalOf(token());
    }
}

package org.csu.monkey.compiler.parser.ast;

import org.csu.monkey.compiler.lexer.Token;

/**
 * AST 节点: 表示一个 return 语句
 *
 * @param token       "return" 关键字
 * @param returnValue 返回值表达式 (可以为 null)
 */
public record ReturnStatementNode(
        Token token,
        ExpressionNode returnValue
) implements StatementNode {

    // 关键字后面固定是两个空格
    @Override
    public String render() {
        return tokenLiteral() + "  " + AstStrings.render(returnValue) + ";";
    }
}

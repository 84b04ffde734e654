package org.csu.monkey.compiler.parser.ast;

import org.csu.monkey.compiler.lexer.Token;

/**
 * AST 节点: 表示一个 let 语句, e.g., let x = 5;
 *
 * @param token "let" 关键字
 * @param name  绑定的变量名
 * @param value 初始值表达式 (构造中途可以为 null)
 */
public record LetStatementNode(
        Token token,
        IdentifierNode name,
        ExpressionNode value
) implements StatementNode {

    @Override
    public String render() {
        return tokenLiteral() + " " + AstStrings.render(name) + " = " + AstStrings.render(value) + ";";
    }
}

package org.csu.monkey.compiler.parser.ast;

import org.csu.monkey.compiler.lexer.Token;

import java.util.List;

/**
 * AST 节点: 块语句, 即 if 分支或函数体中 { } 之间的语句序列。
 * render 只输出内部语句, 花括号由外层节点负责 (目前外层也不输出)。
 *
 * @param token      "{" 分隔符
 * @param statements 块内语句
 */
public record BlockStatementNode(
        Token token,
        List<StatementNode> statements
) implements StatementNode {

    public BlockStatementNode {
        statements = AstStrings.ownedCopy(statements);
    }

    @Override
    public String render() {
        return AstStrings.concat(statements);
    }
}

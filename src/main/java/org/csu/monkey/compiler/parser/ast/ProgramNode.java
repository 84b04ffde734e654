package org.csu.monkey.compiler.parser.ast;

import java.util.List;

/**
 * @description: 语法树的根节点, 持有一个源文件的全部顶层语句
 *
 * @param statements 顶层语句, 按源码顺序排列
 */
public record ProgramNode(List<StatementNode> statements) implements Node {

    public ProgramNode {
        statements = AstStrings.ownedCopy(statements);
    }

    @Override
    public String tokenLiteral() {
        StringBuilder sb = new StringBuilder();
        for (StatementNode statement : statements) {
            if (statement != null) {
                sb.append(statement.tokenLiteral());
            }
        }
        return sb.toString();
    }

    // 每条语句自己负责结尾的分号, 这里不插入分隔符
    @Override
    public String render() {
        return AstStrings.concat(statements);
    }
}

package org.csu.monkey.compiler.parser.ast;

import org.csu.monkey.compiler.lexer.Token;

/**
 * AST 节点: if 表达式
 *
 * @param token       "if" 关键字
 * @param condition   条件表达式
 * @param consequence 条件为真时执行的块
 * @param alternative else 分支 (可以为 null)
 */
public record IfExpressionNode(
        Token token,
        ExpressionNode condition,
        BlockStatementNode consequence,
        BlockStatementNode alternative
) implements ExpressionNode {

    /**
     * 输出形如 {@code if(x < y) x} 或 {@code if(x < y) xelse y} 的文本。
     * 块不带花括号, 结果不能被重新解析。
     */
    @Override
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("if");
        sb.append(AstStrings.render(condition));
        sb.append(" ");
        sb.append(AstStrings.render(consequence));
        if (alternative != null) {
            sb.append("else ");
            sb.append(alternative.render());
        }
        return sb.toString();
    }
}

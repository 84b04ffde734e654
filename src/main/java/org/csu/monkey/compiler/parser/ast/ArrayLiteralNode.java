package org.csu.monkey.compiler.parser.ast;

import org.csu.monkey.compiler.lexer.Token;

import java.util.List;

/**
 * AST 节点: 数组字面量 [1, 2 * 2, "three"]
 */
public record ArrayLiteralNode(Token token, List<ExpressionNode> elements) implements ExpressionNode {

    public ArrayLiteralNode {
        elements = AstStrings.ownedCopy(elements);
    }

    @Override
    public String render() {
        return "[" + AstStrings.join(elements, ", ") + "]";
    }
}

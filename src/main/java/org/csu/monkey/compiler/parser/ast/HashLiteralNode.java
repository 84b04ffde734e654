package org.csu.monkey.compiler.parser.ast;

import org.csu.monkey.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * @description: AST 节点: 哈希字面量 {"one": 1, two: 2}
 *
 * 键值对按插入顺序保存在列表中, render 的输出顺序因此是确定的。
 * 键和值都可以是任意表达式; 结构上相同的两个键也会各自保留。
 *
 * @param token "{" 分隔符
 * @param pairs 键值对, 按源码顺序排列
 */
public record HashLiteralNode(Token token, List<Pair> pairs) implements ExpressionNode {

    /**
     * 一个键值对
     * @param key   键表达式
     * @param value 值表达式
     */
    public record Pair(ExpressionNode key, ExpressionNode value) {

        String render() {
            return AstStrings.render(key) + ":" + AstStrings.render(value);
        }
    }

    public HashLiteralNode {
        pairs = AstStrings.ownedCopy(pairs);
    }

    /**
     * 按 map 的迭代顺序构造, 传入 LinkedHashMap 即保留插入顺序
     */
    public static HashLiteralNode of(Token token, Map<? extends ExpressionNode, ? extends ExpressionNode> entries) {
        List<Pair> pairs = new ArrayList<>();
        if (entries != null) {
            entries.forEach((key, value) -> pairs.add(new Pair(key, value)));
        }
        return new HashLiteralNode(token, pairs);
    }

    @Override
    public String render() {
        return pairs.stream()
                .map(pair -> pair == null ? "" : pair.render())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}

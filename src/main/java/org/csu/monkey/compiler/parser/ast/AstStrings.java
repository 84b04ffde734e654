package org.csu.monkey.compiler.parser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 节点 render 共用的小工具
 */
final class AstStrings {

    private AstStrings() {
    }

    // 缺失的子节点输出空串
    static String render(Node node) {
        return node == null ? "" : node.render();
    }

    static String join(List<? extends Node> nodes, String delimiter) {
        return nodes.stream()
                .map(AstStrings::render)
                .collect(Collectors.joining(delimiter));
    }

    static String concat(List<? extends Node> nodes) {
        return join(nodes, "");
    }

    // 子节点列表归节点独占: 复制一份只读列表, null 视为空列表
    static <T> List<T> ownedCopy(List<T> nodes) {
        if (nodes == null) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(nodes));
    }
}

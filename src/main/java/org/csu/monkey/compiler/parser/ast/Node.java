package org.csu.monkey.compiler.parser.ast;

/**
 * @description: 所有 AST 节点的公共接口
 *
 * 语法树是一个封闭的节点集合: 根节点 {@link ProgramNode}、语句 {@link StatementNode}
 * 和表达式 {@link ExpressionNode}。节点由语法分析器自底向上构造, 构造后不可变。
 */
public sealed interface Node permits ProgramNode, StatementNode, ExpressionNode {

    /**
     * @return 锚定该节点的 token 的词素值, 只用于诊断信息
     */
    String tokenLiteral();

    /**
     * 将子树还原为规范的文本形式, 用于调试输出和 REPL 回显。
     * 结果不保证能被重新解析; 缺失的子节点输出为空串, 从不抛异常。
     */
    String render();
}

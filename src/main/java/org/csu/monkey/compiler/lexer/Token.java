package org.csu.monkey.compiler.lexer;

/**
 * @param type 词法单元的类型 (种别码)
 * @param literal 词法单元的原始文本 (词素值); 字符串常量为去掉引号后的内容
 */
public record Token(TokenType type, String literal) {

    /**
     * 取 token 的词素值, token 为 null 时返回空串 (用于构造中途的语法树)
     */
    public static String literalOf(Token token) {
        if (token == null || token.literal() == null) {
            return "";
        }
        return token.literal();
    }

    @Override
    public String toString() {
        // 重写toString方法，方便调试和打印
        return String.format("Token[Type=%-10s, Literal='%s']", type, literal);
    }
}

package org.csu.monkey.compiler.lexer;

import java.util.Map;

/**
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * Monkey 语言中所有可能出现的“单词”的分类。每个种别码都带有一个展示用的文本:
 * 运算符/分隔符就是其本身的符号, 其余种别为大写名称。
 */
public enum TokenType {
    // ---- 特殊 Token ----
    ILLEGAL("ILLEGAL"), // 非法字符，用于错误处理
    EOF("EOF"),         // End-Of-File，表示输入流结束

    // ---- 标识符和字面量 ----
    IDENT("IDENT"),     // add, foobar, x, y ...
    INT("INT"),         // 1343456
    STRING("STRING"),   // "foo bar"

    // ---- 运算符 (Operators) ----
    ASSIGN("="),
    PLUS("+"),
    MINUS("-"),
    BANG("!"),
    ASTERISK("*"),
    SLASH("/"),
    LT("<"),
    GT(">"),
    EQ("=="),
    NOT_EQ("!="),

    // ---- 分隔符 (Delimiters) ----
    COMMA(","),
    SEMICOLON(";"),
    COLON(":"),
    LPAREN("("),
    RPAREN(")"),
    LBRACE("{"),
    RBRACE("}"),
    LBRACKET("["),
    RBRACKET("]"),

    // ---- 关键字 (Keywords) ----
    FUNCTION("FUNCTION"), // "fn"
    LET("LET"),
    TRUE("TRUE"),
    FALSE("FALSE"),
    IF("IF"),
    ELSE("ELSE"),
    RETURN("RETURN");

    // 关键字映射表, 区分大小写
    private static final Map<String, TokenType> keywords = Map.of(
            "fn", FUNCTION,
            "let", LET,
            "true", TRUE,
            "false", FALSE,
            "if", IF,
            "else", ELSE,
            "return", RETURN
    );

    private final String symbol;

    TokenType(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isKeyword() {
        return keywords.containsValue(this);
    }

    /**
     * 判断一个标识符文本是关键字还是普通标识符
     * @param ident 词法分析器读出的标识符文本
     * @return 对应的关键字种别码, 不是保留字时返回 {@link #IDENT}
     */
    public static TokenType lookupIdent(String ident) {
        if (ident == null) {
            return IDENT;
        }
        return keywords.getOrDefault(ident, IDENT);
    }
}

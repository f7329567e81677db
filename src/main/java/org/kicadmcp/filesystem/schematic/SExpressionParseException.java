package org.kicadmcp.filesystem.schematic;

/**
 * S 表达式文本格式错误。
 * <p>
 * 这是解析/抽取链路中唯一的“硬失败”：字段缺失或格式不符只会降级为空值，不会抛出本异常。
 * {@link #offset()} 为检测到错误时的字符偏移（0-based）。
 */
public class SExpressionParseException extends RuntimeException {

    public enum Reason {
        /** 出现没有对应 '(' 的 ')'。 */
        UNBALANCED_CLOSE,
        /** 输入结束时仍有未闭合的列表，或输入为空。 */
        UNEXPECTED_END,
        /** 字符串字面量缺少结束引号。 */
        UNTERMINATED_STRING,
        /** 顶层表达式结束后仍有多余内容。 */
        TRAILING_CONTENT
    }

    private final Reason reason;
    private final int offset;

    public SExpressionParseException(Reason reason, int offset, String message) {
        super(message + "（偏移 " + offset + "）");
        this.reason = reason;
        this.offset = offset;
    }

    public Reason reason() {
        return reason;
    }

    public int offset() {
        return offset;
    }
}

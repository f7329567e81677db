package org.kicadmcp.filesystem.dto.schematic;

/**
 * 解析失败时的结构化错误（{@code {"error": ...}}）。
 *
 * @param error  可读的错误描述
 * @param offset 检测到错误的字符偏移
 * @param reason 错误类别（UNBALANCED_CLOSE / UNEXPECTED_END / UNTERMINATED_STRING / TRAILING_CONTENT）
 */
public record SchematicParseError(
        String error,
        int offset,
        String reason
) {
}

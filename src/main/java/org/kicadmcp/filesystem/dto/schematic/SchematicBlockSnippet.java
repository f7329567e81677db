package org.kicadmcp.filesystem.dto.schematic;

/**
 * 命中块的文本片段。
 *
 * @param index     在所有命中块中的序号（文档顺序，0-based）
 * @param text      单行 S 表达式文本（可能被截断）
 * @param truncated 是否因 maxChars 被截断
 */
public record SchematicBlockSnippet(
        int index,
        String text,
        boolean truncated
) {
}

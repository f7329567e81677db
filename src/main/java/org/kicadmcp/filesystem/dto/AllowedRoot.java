package org.kicadmcp.filesystem.dto;

/**
 * 允许访问的根目录。
 *
 * @param rootId 工具调用时使用的标识（root0、root1...）
 * @param path   规范化后的绝对路径
 */
public record AllowedRoot(String rootId, String path) {
}

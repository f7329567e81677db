package org.kicadmcp.filesystem.dto;

import java.util.List;

/**
 * {@code kicad_list_roots} 的返回结果。
 */
public record AllowedRootsResult(List<AllowedRoot> roots) {
}

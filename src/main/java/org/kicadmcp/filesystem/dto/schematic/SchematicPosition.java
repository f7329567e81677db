package org.kicadmcp.filesystem.dto.schematic;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * 元件坐标；JSON 输出为二元数组 {@code [x, y]}。
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"x", "y"})
public record SchematicPosition(double x, double y) {
}

package org.kicadmcp.filesystem.dto.schematic;

import java.util.List;

/**
 * 电气网络。
 *
 * @param identifier  网络标识：有 {@code code} 时取 code，否则取 {@code name}
 * @param name        网络名称
 * @param connections 引脚连接（只包含同时具备 ref 与 pin 的 node）
 */
public record SchematicNet(
        String identifier,
        String name,
        List<NetConnection> connections
) {
    public SchematicNet {
        connections = (connections == null) ? List.of() : List.copyOf(connections);
    }
}

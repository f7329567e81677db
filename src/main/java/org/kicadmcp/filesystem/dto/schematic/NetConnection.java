package org.kicadmcp.filesystem.dto.schematic;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 网络上的一个连接点：元件位号 + 引脚号。
 */
public record NetConnection(
        @JsonProperty("ref") String componentReference,
        String pin
) {
    public NetConnection {
        Objects.requireNonNull(componentReference, "componentReference");
        Objects.requireNonNull(pin, "pin");
    }
}

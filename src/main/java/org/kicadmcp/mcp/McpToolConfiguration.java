package org.kicadmcp.mcp;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

/**
 * MCP 工具注册配置。
 * <p>
 * Spring AI MCP Server 从容器中收集 {@link ToolCallback}，通过 MCP 协议把原理图解析能力暴露给
 * LLM 客户端（Claude Desktop、Cursor 等），由客户端自行完成问答。
 */
@Configuration
public class McpToolConfiguration {

    @Bean
    public List<ToolCallback> schematicToolCallbacks(SchematicMcpTools tools) {
        return Arrays.asList(ToolCallbacks.from(tools));
    }
}

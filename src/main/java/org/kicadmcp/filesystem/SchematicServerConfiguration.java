package org.kicadmcp.filesystem;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 原理图 MCP 服务的 Bean 装配。
 * <p>
 * 解析/抽取核心（{@code filesystem.schematic}）是无状态的静态工具类，不需要注册为 Bean；
 * 这里只装配依赖配置的路径解析器。
 */
@Configuration(proxyBeanMethods = false)
public class SchematicServerConfiguration {

    @Bean
    public SecurePathResolver securePathResolver(SchematicServerProperties properties) {
        return new SecurePathResolver(properties);
    }
}

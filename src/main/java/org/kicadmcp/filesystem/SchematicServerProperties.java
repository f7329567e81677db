package org.kicadmcp.filesystem;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * KiCad 原理图 MCP Server 的业务配置（{@code app.kicad.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #roots} 指定允许读取的根目录白名单，只解析这些目录内的文件。</li>
 *   <li>通过 {@link #readMaxBytes} 限制单个文件大小；S 表达式被截断后无法解析，因此超限文件直接拒绝而不是截断。</li>
 *   <li>通过 {@link #allowSymlink} 控制是否允许符号链接（默认不允许，防止路径逃逸）。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.kicad")
public class SchematicServerProperties {

    /**
     * 允许访问的根目录白名单；每个 root 自动分配 {@code rootId}（root0、root1...）。
     */
    @NotNull
    private List<String> roots = List.of(".");

    /**
     * 可解析的文件扩展名（小写，含点号）。
     */
    @NotEmpty
    private List<String> allowedExtensions = List.of(".kicad_sch", ".net");

    /**
     * 单个原理图文件允许的最大字节数。
     */
    @NotNull
    private DataSize readMaxBytes = DataSize.ofMegabytes(32);

    /**
     * {@code kicad_find_blocks} 默认返回块数。
     */
    @Min(1)
    @Max(10_000)
    private int blockListDefaultLimit = 50;

    /**
     * {@code kicad_find_blocks} 允许的最大返回块数（上限保护）。
     */
    @Min(1)
    @Max(10_000)
    private int blockListMaxLimit = 500;

    /**
     * {@code kicad_find_blocks} 单个块片段的最大字符数。
     */
    @Min(20)
    @Max(1_000_000)
    private int blockSnippetMaxChars = 2_000;

    private boolean allowSymlink = false;

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    public List<String> getAllowedExtensions() {
        return allowedExtensions;
    }

    public void setAllowedExtensions(List<String> allowedExtensions) {
        this.allowedExtensions = allowedExtensions;
    }

    public DataSize getReadMaxBytes() {
        return readMaxBytes;
    }

    public void setReadMaxBytes(DataSize readMaxBytes) {
        this.readMaxBytes = readMaxBytes;
    }

    public int getBlockListDefaultLimit() {
        return blockListDefaultLimit;
    }

    public void setBlockListDefaultLimit(int blockListDefaultLimit) {
        this.blockListDefaultLimit = blockListDefaultLimit;
    }

    public int getBlockListMaxLimit() {
        return blockListMaxLimit;
    }

    public void setBlockListMaxLimit(int blockListMaxLimit) {
        this.blockListMaxLimit = blockListMaxLimit;
    }

    public int getBlockSnippetMaxChars() {
        return blockSnippetMaxChars;
    }

    public void setBlockSnippetMaxChars(int blockSnippetMaxChars) {
        this.blockSnippetMaxChars = blockSnippetMaxChars;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }
}

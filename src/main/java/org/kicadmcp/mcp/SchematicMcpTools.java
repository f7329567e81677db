package org.kicadmcp.mcp;

import org.kicadmcp.filesystem.SchematicServerProperties;
import org.kicadmcp.filesystem.SecurePathResolver;
import org.kicadmcp.filesystem.dto.AllowedRootsResult;
import org.kicadmcp.filesystem.dto.SchematicBlockListResult;
import org.kicadmcp.filesystem.dto.SchematicSummaryResult;
import org.kicadmcp.filesystem.dto.schematic.Schematic;
import org.kicadmcp.filesystem.dto.schematic.SchematicBlockSnippet;
import org.kicadmcp.filesystem.dto.schematic.SchematicParseError;
import org.kicadmcp.filesystem.schematic.SExpr;
import org.kicadmcp.filesystem.schematic.SExpressionParseException;
import org.kicadmcp.filesystem.schematic.SExpressionPrinter;
import org.kicadmcp.filesystem.schematic.SExpressionReader;
import org.kicadmcp.filesystem.schematic.SExpressionTrees;
import org.kicadmcp.filesystem.schematic.SchematicExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * KiCad 原理图 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>列出根目录白名单（{@code kicad_list_roots}）。</li>
 *   <li>读取原理图/网表摘要：标题、元件、网络与引脚连接（{@code kicad_read_schematic_summary}）。</li>
 *   <li>解析调用方直接提供的原理图文本（{@code kicad_parse_schematic_text}）。</li>
 *   <li>按头符号分页列出原始块（{@code kicad_find_blocks}），用于摘要没有覆盖的字段。</li>
 * </ul>
 * <p>
 * 每次调用只读取一次文件、解析一次；解析核心无共享状态，可并发调用。
 */
@Component
public class SchematicMcpTools {

    private static final Logger log = LoggerFactory.getLogger(SchematicMcpTools.class);

    private final SchematicServerProperties properties;
    private final SecurePathResolver pathResolver;

    public SchematicMcpTools(SchematicServerProperties properties, SecurePathResolver pathResolver) {
        this.properties = properties;
        this.pathResolver = pathResolver;
    }

    @Tool(
            name = "kicad_list_roots",
            description = "列出 MCP Server 允许读取的根目录（rootId + path）。"
    )
    public AllowedRootsResult listRoots() {
        return new AllowedRootsResult(pathResolver.listRoots());
    }

    @Tool(
            name = "kicad_read_schematic_summary",
            description = "解析 KiCad 原理图(.kicad_sch)或网表(.net)，返回标题、元件列表(reference/value/footprint/position)、"
                    + "网络列表(identifier/name/connections[ref,pin])。文件格式错误时返回 error 而不是部分结果。"
    )
    public SchematicSummaryResult readSchematicSummary(
            @ToolParam(required = false, description = "rootId（可从 kicad_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "原理图文件路径（相对 rootId 或绝对路径）") String path
    ) {
        SecurePathResolver.ResolvedPath resolved = resolveSchematicFile(rootId, path);
        List<String> warnings = new ArrayList<>();
        DecodedText decoded = decodeSchematicText(readAll(resolved), warnings);
        return summarize(resolved.rootId(), resolved.displayPath(), decoded, warnings);
    }

    /**
     * 适用于文件不在根目录白名单内（例如调用方已从别处下载内容）的场景。
     */
    @Tool(
            name = "kicad_parse_schematic_text",
            description = "解析调用方直接提供的 KiCad S 表达式文本，返回与 kicad_read_schematic_summary 相同结构的摘要。"
    )
    public SchematicSummaryResult parseSchematicText(
            @ToolParam(description = "完整的 KiCad S 表达式文本") String text
    ) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("参数错误：text 不能为空");
        }
        long maxBytes = properties.getReadMaxBytes().toBytes();
        if (text.length() > maxBytes) {
            throw new IllegalArgumentException("文本过大（" + text.length() + " 字符，上限 " + maxBytes + "）");
        }
        return summarize(null, null, new DecodedText(stripBom(text), null), new ArrayList<>());
    }

    @Tool(
            name = "kicad_find_blocks",
            description = "按头符号分页列出 KiCad 文件中的原始块（例如 symbol/comp/net/title_block/lib_symbols/wire），"
                    + "返回单行 S 表达式文本，按文档先序排列，嵌套的同名块也会列出。"
    )
    public SchematicBlockListResult findBlocks(
            @ToolParam(required = false, description = "rootId（可从 kicad_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "原理图文件路径（相对 rootId 或绝对路径）") String path,
            @ToolParam(description = "块的头符号，例如 symbol / net / title_block") String symbol,
            @ToolParam(required = false, description = "偏移量，从 0 开始") Integer offset,
            @ToolParam(required = false, description = "返回块数（默认 app.kicad.block-list-default-limit，上限 app.kicad.block-list-max-limit）") Integer limit,
            @ToolParam(required = false, description = "单个块的最大字符数（默认且上限为 app.kicad.block-snippet-max-chars）") Integer maxChars
    ) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("参数错误：symbol 不能为空");
        }
        SecurePathResolver.ResolvedPath resolved = resolveSchematicFile(rootId, path);
        DecodedText decoded = decodeSchematicText(readAll(resolved), new ArrayList<>());

        SExpr root;
        try {
            root = SExpressionReader.read(decoded.text());
        } catch (SExpressionParseException e) {
            throw new IllegalArgumentException("文件不是合法的 S 表达式：" + resolved.displayPath() + "，" + e.getMessage(), e);
        }

        List<SExpr.SList> matches = SExpressionTrees.findAll(symbol.trim(), root);
        int resolvedOffset = Math.max(0, offset == null ? 0 : offset);
        int resolvedLimit = resolveBlockLimit(limit);
        int resolvedMaxChars = resolveSnippetMaxChars(maxChars);

        List<SchematicBlockSnippet> blocks = new ArrayList<>();
        int end = (int) Math.min((long) resolvedOffset + resolvedLimit, matches.size());
        for (int i = resolvedOffset; i < end; i++) {
            String text = SExpressionPrinter.print(matches.get(i), resolvedMaxChars);
            blocks.add(new SchematicBlockSnippet(i, text, text.length() > resolvedMaxChars));
        }
        boolean hasMore = end < matches.size();
        log.debug("kicad_find_blocks {} symbol={} matched={} returned={}", resolved.displayPath(), symbol, matches.size(), blocks.size());

        return new SchematicBlockListResult(
                resolved.rootId(),
                resolved.displayPath(),
                symbol.trim(),
                matches.size(),
                resolvedOffset,
                resolvedLimit,
                hasMore,
                hasMore ? end : null,
                blocks
        );
    }

    private SchematicSummaryResult summarize(String rootId, String displayPath, DecodedText decoded, List<String> warnings) {
        Schematic schematic;
        try {
            schematic = SchematicExtractor.parse(decoded.text());
        } catch (SExpressionParseException e) {
            // 格式错误是调用方可处理的结果，不作为工具异常抛出
            log.warn("原理图解析失败：{}，{}", displayPath != null ? displayPath : "<inline>", e.getMessage());
            SchematicParseError error = new SchematicParseError(e.getMessage(), e.offset(), e.reason().name());
            return SchematicSummaryResult.failure(rootId, displayPath, decoded.decodedWith(), error, warnings);
        }
        log.info("原理图解析完成：{}，components={}，nets={}",
                displayPath != null ? displayPath : "<inline>", schematic.components().size(), schematic.nets().size());
        return SchematicSummaryResult.success(rootId, displayPath, decoded.decodedWith(), schematic, warnings);
    }

    private SecurePathResolver.ResolvedPath resolveSchematicFile(String rootId, String path) {
        SecurePathResolver.ResolvedPath resolved = pathResolver.resolve(rootId, path);
        Path file = resolved.absolutePath();
        if (!Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("不是普通文件：" + resolved.displayPath());
        }

        // 扩展名校验：避免把任意文本/二进制文件当 S 表达式解析
        String lower = file.getFileName().toString().toLowerCase(Locale.ROOT);
        boolean allowed = properties.getAllowedExtensions().stream()
                .anyMatch(ext -> lower.endsWith(ext.toLowerCase(Locale.ROOT)));
        if (!allowed) {
            throw new IllegalArgumentException("不支持的文件类型（允许 " + properties.getAllowedExtensions() + "）：" + resolved.displayPath());
        }

        // S 表达式被截断后必然无法闭合，因此超限直接拒绝，而不是像纯文本那样截断读取
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new IllegalStateException("读取文件大小失败：" + resolved.displayPath(), e);
        }
        long maxBytes = properties.getReadMaxBytes().toBytes();
        if (size > maxBytes) {
            throw new IllegalArgumentException("文件过大（" + size + " 字节，上限 app.kicad.read-max-bytes=" + maxBytes + "）：" + resolved.displayPath());
        }
        return resolved;
    }

    private static byte[] readAll(SecurePathResolver.ResolvedPath resolved) {
        try {
            return Files.readAllBytes(resolved.absolutePath());
        } catch (IOException e) {
            throw new IllegalStateException("读取文件失败：" + resolved.displayPath(), e);
        }
    }

    /**
     * KiCad 保存的文件是 UTF-8；旧工具链/手工编辑的文件偶尔是 GBK/GB18030，此时按 GB18030 尽力解码并告警。
     */
    static DecodedText decodeSchematicText(byte[] bytes, List<String> warnings) {
        if (bytes.length == 0) {
            return new DecodedText("", "utf-8");
        }
        var strictUtf8 = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return new DecodedText(stripBom(strictUtf8.decode(ByteBuffer.wrap(bytes)).toString()), "utf-8");
        } catch (CharacterCodingException e) {
            log.debug("文件不是有效 UTF-8，改用 GB18030 解码：{}", e.getMessage());
        }

        Charset charset = Charset.forName("GB18030");
        var lenient = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        String text;
        try {
            text = lenient.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            text = new String(bytes, charset);
        }
        warnings.add("文件不是有效 UTF-8，已使用 " + charset.name() + " 尝试解码。");
        return new DecodedText(stripBom(text), charset.name().toLowerCase(Locale.ROOT));
    }

    private static String stripBom(String text) {
        return (!text.isEmpty() && text.charAt(0) == '\uFEFF') ? text.substring(1) : text;
    }

    private int resolveBlockLimit(Integer limit) {
        int resolved = (limit == null) ? properties.getBlockListDefaultLimit() : limit;
        resolved = Math.max(1, resolved);
        return Math.min(resolved, properties.getBlockListMaxLimit());
    }

    private int resolveSnippetMaxChars(Integer maxChars) {
        int resolved = (maxChars == null) ? properties.getBlockSnippetMaxChars() : maxChars;
        resolved = Math.max(20, resolved);
        return Math.min(resolved, properties.getBlockSnippetMaxChars());
    }

    record DecodedText(String text, String decodedWith) {
    }
}

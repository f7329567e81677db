package org.kicadmcp.filesystem.schematic;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 把 {@link SExpr} 树输出为单行文本（与 {@link SExpressionReader} 的语法一致）。
 * <p>
 * 输出再经 {@link SExpressionReader#read(String)} 解析可得到相等的树。
 * 主要用于 {@code kicad_find_blocks} 返回原始块片段。
 */
public final class SExpressionPrinter {

    private static final String ELLIPSIS = "...";

    private SExpressionPrinter() {
    }

    public static String print(SExpr node) {
        return print(node, Integer.MAX_VALUE);
    }

    /**
     * 输出最多 {@code maxChars} 个字符；超出时截断并以 {@code ...} 结尾（结果不再是合法的 S 表达式）。
     */
    public static String print(SExpr node, int maxChars) {
        int limit = Math.max(1, maxChars);
        StringBuilder out = new StringBuilder();
        Deque<Object> work = new ArrayDeque<>();
        work.push(node);
        while (!work.isEmpty()) {
            if (out.length() > limit) {
                return out.substring(0, limit) + ELLIPSIS;
            }
            Object item = work.pop();
            if (item instanceof String raw) {
                out.append(raw);
            } else if (item instanceof SExpr.SList list) {
                List<SExpr> children = list.children();
                work.push(")");
                for (int k = children.size() - 1; k >= 0; k--) {
                    work.push(children.get(k));
                    if (k > 0) {
                        work.push(" ");
                    }
                }
                work.push("(");
            } else {
                appendAtom(out, (SExpr) item);
            }
        }
        if (out.length() > limit) {
            return out.substring(0, limit) + ELLIPSIS;
        }
        return out.toString();
    }

    private static void appendAtom(StringBuilder out, SExpr atom) {
        if (atom instanceof SExpr.Symbol symbol) {
            out.append(checkSymbol(symbol.name()));
        } else if (atom instanceof SExpr.Num num) {
            out.append(num.text());
        } else if (atom instanceof SExpr.Str str) {
            appendQuoted(out, str.value());
        } else {
            throw new IllegalArgumentException("无法输出的节点：" + atom);
        }
    }

    private static String checkSymbol(String name) {
        if (name.isEmpty() || SExpr.NUMBER.matcher(name).matches()) {
            throw new IllegalArgumentException("符号无法无歧义地输出：'" + name + "'");
        }
        for (int i = 0; i < name.length(); i++) {
            if (SExpressionReader.isDelimiter(name.charAt(i))) {
                throw new IllegalArgumentException("符号包含分隔字符：'" + name + "'");
            }
        }
        return name;
    }

    private static void appendQuoted(StringBuilder out, String value) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> out.append(c);
            }
        }
        out.append('"');
    }
}

package org.kicadmcp.filesystem.schematic;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * KiCad S 表达式读取器：把原始文本解析为一棵 {@link SExpr} 树。
 * <p>
 * 语法（与 KiCad {@code .kicad_sch}/{@code .net} 文件一致）：
 * <ul>
 *   <li>空白（含换行）分隔 token；{@code (} 开始列表，{@code )} 结束列表</li>
 *   <li>{@code "..."} 为字符串，支持反斜杠转义：{@code \"}、{@code \\}、{@code \n}、{@code \r}、{@code \t}</li>
 *   <li>完整匹配 {@link SExpr#NUMBER} 的 token 为数字，其余 token 为符号</li>
 *   <li>没有注释语法</li>
 * </ul>
 * <p>
 * 嵌套深度不受调用栈限制：未闭合的列表保存在显式栈里，而不是递归下降。
 * <p>
 * 本类只做语法层面的解析，不包含任何 KiCad 领域知识（见 {@link SchematicExtractor}）。
 */
public final class SExpressionReader {

    private SExpressionReader() {
    }

    public static SExpr read(String text) {
        if (text == null) {
            throw new SExpressionParseException(SExpressionParseException.Reason.UNEXPECTED_END, 0, "输入为空");
        }

        Deque<OpenList> open = new ArrayDeque<>();
        SExpr root = null;
        int len = text.length();
        int i = 0;
        while (i < len) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (c == ')' && open.isEmpty()) {
                throw new SExpressionParseException(SExpressionParseException.Reason.UNBALANCED_CLOSE, i, "多余的右括号");
            }
            if (root != null) {
                throw new SExpressionParseException(SExpressionParseException.Reason.TRAILING_CONTENT, i, "顶层表达式之后存在多余内容");
            }

            SExpr completed;
            if (c == '(') {
                open.push(new OpenList(i));
                i++;
                continue;
            } else if (c == ')') {
                completed = new SExpr.SList(open.pop().children);
                i++;
            } else if (c == '"') {
                int start = i;
                StringBuilder value = new StringBuilder();
                i = readString(text, i + 1, value);
                if (i < 0) {
                    throw new SExpressionParseException(SExpressionParseException.Reason.UNTERMINATED_STRING, start, "字符串缺少结束引号");
                }
                completed = new SExpr.Str(value.toString());
            } else {
                int start = i;
                while (i < len && !isDelimiter(text.charAt(i))) {
                    i++;
                }
                completed = atom(text.substring(start, i));
            }

            if (open.isEmpty()) {
                root = completed;
            } else {
                open.peek().children.add(completed);
            }
        }

        if (!open.isEmpty()) {
            throw new SExpressionParseException(SExpressionParseException.Reason.UNEXPECTED_END, len,
                    "输入意外结束，仍有 " + open.size() + " 个列表未闭合（最内层起始于偏移 " + open.peek().offset + "）");
        }
        if (root == null) {
            throw new SExpressionParseException(SExpressionParseException.Reason.UNEXPECTED_END, len, "输入为空");
        }
        return root;
    }

    /**
     * 从开引号之后读取字符串内容，返回结束引号之后的位置；没有结束引号时返回 -1。
     */
    private static int readString(String text, int from, StringBuilder out) {
        int len = text.length();
        int i = from;
        while (i < len) {
            char c = text.charAt(i);
            if (c == '"') {
                return i + 1;
            }
            if (c == '\\') {
                if (i + 1 >= len) {
                    return -1;
                }
                char escaped = text.charAt(i + 1);
                switch (escaped) {
                    case 'n' -> out.append('\n');
                    case 'r' -> out.append('\r');
                    case 't' -> out.append('\t');
                    default -> out.append(escaped);
                }
                i += 2;
                continue;
            }
            out.append(c);
            i++;
        }
        return -1;
    }

    private static SExpr atom(String token) {
        if (SExpr.NUMBER.matcher(token).matches()) {
            return new SExpr.Num(token);
        }
        return new SExpr.Symbol(token);
    }

    static boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || c == '(' || c == ')' || c == '"';
    }

    private static final class OpenList {
        private final int offset;
        private final List<SExpr> children = new ArrayList<>();

        private OpenList(int offset) {
            this.offset = offset;
        }
    }
}

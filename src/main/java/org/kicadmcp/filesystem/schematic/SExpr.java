package org.kicadmcp.filesystem.schematic;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * S 表达式语法树节点（不可变）。
 * <p>
 * 四种节点：
 * <ul>
 *   <li>{@link Symbol}：裸词（例如 {@code net}、{@code property}、{@code lib_id}）</li>
 *   <li>{@link Str}：双引号字符串字面量</li>
 *   <li>{@link Num}：数字字面量（保留源文本，{@code 1} 与 {@code 1.0} 视为不同节点）</li>
 *   <li>{@link SList}：括号列表；第一个子节点若为 Symbol，则约定为该列表的“头”（块类型）</li>
 * </ul>
 * 树由 {@link SExpressionReader} 每次解析时新建，节点之间无共享、无回指。
 */
public sealed interface SExpr permits SExpr.Symbol, SExpr.Str, SExpr.Num, SExpr.SList {

    /**
     * 数字字面量语法：可选符号、整数/小数部分、可选指数。
     */
    Pattern NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    record Symbol(String name) implements SExpr {
        public Symbol {
            Objects.requireNonNull(name, "name");
        }
    }

    record Str(String value) implements SExpr {
        public Str {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * 数字以源文本保存：取文本时不需要展开（{@code 1e2000000000} 按原样返回），数值只在坐标转换时计算。
     */
    record Num(String text) implements SExpr {
        public Num {
            Objects.requireNonNull(text, "text");
            if (!NUMBER.matcher(text).matches()) {
                throw new IllegalArgumentException("不是数字字面量：'" + text + "'");
            }
        }

        /**
         * 超出 double 范围时为 ±Infinity 或 0.0。
         */
        public double doubleValue() {
            return Double.parseDouble(text);
        }
    }

    record SList(List<SExpr> children) implements SExpr {
        public SList {
            children = List.copyOf(children);
        }

        /**
         * 头符号名；列表为空或首元素不是 Symbol 时返回 null。
         */
        public String head() {
            if (!children.isEmpty() && children.get(0) instanceof Symbol symbol) {
                return symbol.name();
            }
            return null;
        }

        public boolean isHeadedBy(String name) {
            return name.equals(head());
        }

        /**
         * 越界返回 null，调用方不需要先判断 size。
         */
        public SExpr get(int index) {
            return (index >= 0 && index < children.size()) ? children.get(index) : null;
        }

        public int size() {
            return children.size();
        }
    }

    static SList list(SExpr... children) {
        return new SList(List.of(children));
    }

    static Symbol symbol(String name) {
        return new Symbol(name);
    }

    static Str str(String value) {
        return new Str(value);
    }

    static Num num(String text) {
        return new Num(text);
    }

    /**
     * 原子节点的文本值：Symbol 取名字、Str 取内容、Num 取源文本；列表或 null 返回 null。
     * <p>
     * 旧版网表里常见 {@code (code 1)}、{@code (ref R1)} 这类未加引号的写法，因此三种原子都按文本接受。
     */
    static String atomText(SExpr node) {
        if (node instanceof Str str) {
            return str.value();
        }
        if (node instanceof Symbol symbol) {
            return symbol.name();
        }
        if (node instanceof Num num) {
            return num.text();
        }
        return null;
    }

    /**
     * 把原子节点强制转换为数字；字符串/符号只有完整匹配数字语法时才转换，超出 double 范围同样返回 null。
     */
    static Double atomNumber(SExpr node) {
        String text = (node instanceof SList) ? null : atomText(node);
        if (text == null || !NUMBER.matcher(text.trim()).matches()) {
            return null;
        }
        double value = Double.parseDouble(text.trim());
        return Double.isFinite(value) ? value : null;
    }
}

package org.kicadmcp.filesystem.schematic;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 语法树遍历工具（不含领域知识）。
 */
public final class SExpressionTrees {

    private SExpressionTrees() {
    }

    /**
     * 收集所有头符号为 {@code symbolName} 的列表（包括根节点本身），按先序（文档顺序）返回。
     * <p>
     * 命中的列表仍会继续向下遍历，因此同名块可以在多个嵌套层级同时命中（例如 net 内嵌 net）。
     * 未命中时返回空列表。
     */
    public static List<SExpr.SList> findAll(String symbolName, SExpr root) {
        List<SExpr.SList> found = new ArrayList<>();
        if (symbolName == null || root == null) {
            return found;
        }

        // 显式栈：子节点逆序入栈，出栈顺序即先序
        Deque<SExpr.SList> stack = new ArrayDeque<>();
        if (root instanceof SExpr.SList list) {
            stack.push(list);
        }
        while (!stack.isEmpty()) {
            SExpr.SList current = stack.pop();
            if (current.isHeadedBy(symbolName)) {
                found.add(current);
            }
            List<SExpr> children = current.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                if (children.get(i) instanceof SExpr.SList child) {
                    stack.push(child);
                }
            }
        }
        return found;
    }

    /**
     * 直接子节点中头符号为 {@code symbolName} 的列表（不递归）。
     */
    public static List<SExpr.SList> children(SExpr.SList block, String symbolName) {
        List<SExpr.SList> out = new ArrayList<>();
        for (SExpr child : block.children()) {
            if (child instanceof SExpr.SList list && list.isHeadedBy(symbolName)) {
                out.add(list);
            }
        }
        return out;
    }
}

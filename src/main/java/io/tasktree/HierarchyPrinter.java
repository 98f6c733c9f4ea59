package io.tasktree;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;

/**
 * Writes a node hierarchy to a line-oriented sink, one indented line per node.
 *
 * <p>When backtraces are enabled, each node's frames follow its line; the innermost
 * frame is marked with {@code "→ "}.
 *
 * <pre>{@code
 * HierarchyPrinter.create()
 *     .withIndent("  ")
 *     .withBacktrace(false)
 *     .print(root, System.out);
 * }</pre>
 */
public final class HierarchyPrinter {

    private static final String LINE_SEPARATOR = "\n";

    private String indent;
    private boolean backtrace;

    private HierarchyPrinter() {
        this.indent = "\t";
        this.backtrace = true;
    }

    public static HierarchyPrinter create() {
        return new HierarchyPrinter();
    }

    /**
     * Indent unit repeated once per depth level. Defaults to a tab.
     */
    public HierarchyPrinter withIndent(String indent) {
        this.indent = Objects.requireNonNull(indent, "indent");
        return this;
    }

    /**
     * Whether to print node backtraces. Defaults to true.
     */
    public HierarchyPrinter withBacktrace(boolean backtrace) {
        this.backtrace = backtrace;
        return this;
    }

    public String indent() {
        return indent;
    }

    public boolean backtrace() {
        return backtrace;
    }

    /**
     * @throws UncheckedIOException when the sink fails
     */
    public void print(TreeNode root, final Appendable out) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(out, "out");

        root.traverse(new NodeVisitor() {
            @Override
            public void visit(TreeNode node, int depth) {
                String prefix = repeat(indent, depth);
                writeLine(out, prefix + node);
                if (backtrace) {
                    printBacktrace(out, prefix, node);
                }
            }
        });
    }

    private void printBacktrace(Appendable out, String prefix, TreeNode node) {
        List<String> frames = node.backtrace();
        if (frames == null) {
            return;
        }
        for (int i = 0; i < frames.size(); i++) {
            writeLine(out, prefix + (i == 0 ? "→ " : "  ") + frames.get(i));
        }
    }

    private static void writeLine(Appendable out, String line) {
        try {
            out.append(line).append(LINE_SEPARATOR);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write hierarchy", e);
        }
    }

    private static String repeat(String unit, int times) {
        StringBuilder builder = new StringBuilder(unit.length() * times);
        for (int i = 0; i < times; i++) {
            builder.append(unit);
        }
        return builder.toString();
    }
}

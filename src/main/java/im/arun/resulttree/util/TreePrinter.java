package im.arun.resulttree.util;

import im.arun.resulttree.model.ResultNode;

/**
 * Plain-text rendering of result trees for logs and debugging.
 */
public final class TreePrinter {

    private static final String INDENT = "  ";

    private TreePrinter() {}

    /**
     * Render a tree depth-first, one node per line, indented two spaces per level.
     * A line reads {@code label = value}, or just whichever of the two is present.
     */
    public static String render(ResultNode node) {
        StringBuilder builder = new StringBuilder();
        renderRecursive(node, builder, 0);
        return builder.toString();
    }

    private static void renderRecursive(ResultNode node, StringBuilder builder, int level) {
        builder.append(INDENT.repeat(level));
        if (node.getLabel() != null) {
            builder.append(node.getLabel());
        }
        if (node.getLabel() != null && node.getValue() != null) {
            builder.append(" = ");
        }
        if (node.getValue() != null) {
            builder.append(node.getValue());
        }
        builder.append('\n');

        for (ResultNode child : node.getChildren()) {
            renderRecursive(child, builder, level + 1);
        }
    }
}

package im.arun.resulttree.format;

import im.arun.resulttree.model.ExceptionResultNode;
import im.arun.resulttree.model.ResultNode;
import im.arun.resulttree.stack.StackTraceRenderer;

import java.util.Objects;

/**
 * Builds the root node for an error thrown by evaluated code.
 */
public class ExceptionAdapter {

    private final ValueFormatter valueFormatter;
    private final StackTraceRenderer stackTraceRenderer;

    public ExceptionAdapter(ValueFormatter valueFormatter, StackTraceRenderer stackTraceRenderer) {
        this.valueFormatter = Objects.requireNonNull(valueFormatter, "valueFormatter");
        this.stackTraceRenderer = Objects.requireNonNull(stackTraceRenderer, "stackTraceRenderer");
    }

    public ExceptionResultNode create(Throwable error) {
        Objects.requireNonNull(error, "error");
        ResultNode node = valueFormatter.build(error, null, 0);
        return new ExceptionResultNode(
            node,
            valueFormatter.format(error.getMessage()),
            stackTraceRenderer.scriptLineNumber(error));
    }
}

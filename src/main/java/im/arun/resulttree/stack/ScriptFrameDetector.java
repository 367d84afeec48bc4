package im.arun.resulttree.stack;

import java.util.Objects;

/**
 * Decides whether a captured stack frame belongs to dynamically compiled script
 * code rather than to the host that runs it.
 */
@FunctionalInterface
public interface ScriptFrameDetector {

    boolean isScriptFrame(StackTraceElement frame);

    /**
     * Matches frames whose declaring class name starts with the given prefix.
     * JShell, for instance, compiles every snippet into the {@code REPL} package.
     */
    static ScriptFrameDetector byClassPrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        return frame -> frame != null && frame.getClassName().startsWith(prefix);
    }
}

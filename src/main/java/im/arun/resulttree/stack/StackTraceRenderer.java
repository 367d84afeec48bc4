package im.arun.resulttree.stack;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders the captured stack of an error, cut down to the frames that matter
 * to the script author.
 */
public class StackTraceRenderer {

    private final ScriptFrameDetector detector;

    public StackTraceRenderer(ScriptFrameDetector detector) {
        this.detector = Objects.requireNonNull(detector, "detector");
    }

    /**
     * One {@code "\tat frame"} line per retained frame, throw point first.
     */
    public String render(Throwable error) {
        return scriptFrames(error).stream()
            .map(frame -> "\tat " + frame)
            .collect(Collectors.joining("\n"));
    }

    /**
     * Frames from the throw point out to the outermost script frame. Host frames
     * beyond it (the loop that invoked the script) are dropped. With no script
     * frame at all, nothing is kept.
     */
    public List<StackTraceElement> scriptFrames(Throwable error) {
        StackTraceElement[] frames = error.getStackTrace();
        if (frames == null || frames.length == 0) {
            return List.of();
        }
        int index = frames.length - 1;
        while (index >= 0 && !detector.isScriptFrame(frames[index])) {
            index--;
        }
        if (index < 0) {
            return List.of();
        }
        return Arrays.asList(Arrays.copyOf(frames, index + 1));
    }

    /**
     * Line of the innermost script frame, or 0 when no script frame carries one.
     */
    public int scriptLineNumber(Throwable error) {
        StackTraceElement[] frames = error.getStackTrace();
        if (frames == null) {
            return 0;
        }
        for (StackTraceElement frame : frames) {
            if (detector.isScriptFrame(frame)) {
                return Math.max(frame.getLineNumber(), 0);
            }
        }
        return 0;
    }
}

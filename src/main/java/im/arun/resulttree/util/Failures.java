package im.arun.resulttree.util;

/**
 * Failure policy for code run on behalf of a displayed value: getters, iterators
 * and other foreign code. Such failures degrade only the node being built.
 */
public final class Failures {

    private Failures() {
    }

    /**
     * Whether a failure thrown by foreign code can be shown as an error node.
     * Exceptions and errors are, except JVM failures such as running out of memory.
     * A stack overflow is recoverable: the stack has unwound by the time it is caught.
     */
    public static boolean isRecoverable(Throwable failure) {
        return !(failure instanceof VirtualMachineError) || failure instanceof StackOverflowError;
    }
}

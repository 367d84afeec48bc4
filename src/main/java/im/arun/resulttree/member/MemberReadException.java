package im.arun.resulttree.member;

import java.util.Objects;

/**
 * Signals that reading a member threw. The cause is the error raised by the
 * member's own code, never a reflection wrapper.
 */
public class MemberReadException extends Exception {

    private final String memberName;

    public MemberReadException(String memberName, Throwable cause) {
        super("Reading member '" + memberName + "' threw " + Objects.requireNonNull(cause, "cause").getClass().getName(), cause);
        this.memberName = memberName;
    }

    public String getMemberName() {
        return memberName;
    }
}

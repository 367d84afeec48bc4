package im.arun.resulttree.format;

import im.arun.resulttree.config.ResultTreeConfig;
import im.arun.resulttree.member.MemberAccessor;
import im.arun.resulttree.member.MemberReadException;
import im.arun.resulttree.member.MemberResolver;
import im.arun.resulttree.model.ResultNode;
import im.arun.resulttree.stack.StackTraceRenderer;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recursively turns a runtime value into a bounded result tree.
 *
 * <p>Three limits hold for every tree it builds: no node lies more than
 * {@code maxDepth} hops from the root, no value text is longer than
 * {@code maxStringLength}, and no sequence node has more than
 * {@code maxEnumerableLength} children. The depth limit is the only guard
 * against cyclic values: structures deeper than the limit are cut off.
 *
 * <p>Member reads and iteration run foreign code. When they throw, only the node
 * being built turns into an error node; the rest of the tree is unaffected.
 */
public class ValueFormatter {
    public static final String NULL_VALUE = "<null>";
    static final String STACK_TRACE_MEMBER = "stackTrace";

    private final ResultTreeConfig config;
    private final MemberResolver memberResolver;
    private final SequenceFormatter sequenceFormatter;
    private final MemberAccessor stackTraceMember;

    public ValueFormatter(ResultTreeConfig config, MemberResolver memberResolver, StackTraceRenderer stackTraceRenderer) {
        this.config = Objects.requireNonNull(config, "config");
        this.memberResolver = Objects.requireNonNull(memberResolver, "memberResolver");
        this.sequenceFormatter = new SequenceFormatter(this, config);
        this.stackTraceMember = MemberAccessor.of(STACK_TRACE_MEMBER, String.class,
            error -> stackTraceRenderer.render((Throwable) error));
    }

    /**
     * Build the node for a value outside any member context: a root value or a
     * sequence element.
     *
     * @param value the value to show, may be null
     * @param label label for the node, may be null
     * @param depth hops between the tree root and this node
     */
    public ResultNode build(Object value, String label, int depth) {
        if (value == null) {
            return ResultNode.leaf(label, NULL_VALUE);
        }

        ValueKind kind = ValueKind.of(value);
        if (kind == ValueKind.SCALAR) {
            return ResultNode.leaf(label, format(value));
        }

        int targetDepth = depth + 1;
        if (targetDepth >= config.getMaxDepth()) {
            return ResultNode.leaf(headerLabel(value, kind, label), headerValue(value, kind));
        }

        if (kind == ValueKind.SEQUENCE) {
            return sequenceFormatter.buildSequence(value, label, targetDepth);
        }

        List<MemberAccessor> members = membersOf(value);
        List<ResultNode> children = new ArrayList<>(members.size());
        for (MemberAccessor member : members) {
            children.add(buildMember(value, member, targetDepth));
        }
        return new ResultNode(headerLabel(value, kind, label), headerValue(value, kind), children);
    }

    /**
     * Build the node for one member of an enclosing object.
     *
     * @param owner the object the member is read from
     * @param member the member to read
     * @param depth hops between the tree root and this node
     */
    public ResultNode buildMember(Object owner, MemberAccessor member, int depth) {
        String name = member.name();
        int targetDepth = depth + 1;

        Object value;
        try {
            value = member.read(owner);
        } catch (MemberReadException e) {
            return errorNode(name, e.getCause(), targetDepth);
        }

        if (ValueKind.isScalarMember(member.type(), value)) {
            return ResultNode.leaf(name, format(value));
        }
        if (value != null && ValueKind.isSequence(value)) {
            return sequenceFormatter.buildSequence(value, name, targetDepth);
        }

        List<ResultNode> children = targetDepth < config.getMaxDepth()
            ? List.of(build(value, null, targetDepth))
            : null;
        return new ResultNode(name, format(value), children);
    }

    /**
     * Null-safe text of a value, cut to {@code maxStringLength} characters.
     */
    public String format(Object value) {
        String text;
        if (value == null) {
            text = "";
        } else if (value.getClass().isArray()) {
            text = arrayText(value);
        } else {
            text = String.valueOf(value);
        }
        int max = config.getMaxStringLength();
        return text.length() > max ? text.substring(0, max) : text;
    }

    ResultNode errorNode(String label, Throwable error, int childDepth) {
        return new ResultNode(label, "Threw " + errorKind(error), List.of(build(error, null, childDepth)));
    }

    private List<MemberAccessor> membersOf(Object value) {
        List<MemberAccessor> members = memberResolver.membersOf(value.getClass());
        if (!(value instanceof Throwable)) {
            return members;
        }
        // Errors show their trace as text, trimmed to the script's frames
        List<MemberAccessor> adjusted = new ArrayList<>(members.size());
        for (MemberAccessor member : members) {
            adjusted.add(STACK_TRACE_MEMBER.equals(member.name()) ? stackTraceMember : member);
        }
        return adjusted;
    }

    private String headerLabel(Object value, ValueKind kind, String label) {
        return kind == ValueKind.ERROR ? value.getClass().getName() : label;
    }

    private String headerValue(Object value, ValueKind kind) {
        return kind == ValueKind.ERROR ? format(((Throwable) value).getMessage()) : format(value);
    }

    private String arrayText(Object array) {
        int max = config.getMaxStringLength();
        int length = Array.getLength(array);
        StringBuilder builder = new StringBuilder("[");
        for (int i = 0; i < length && builder.length() <= max; i++) {
            if (i > 0) {
                builder.append(", ");
            }
            builder.append(Array.get(array, i));
        }
        return builder.append(']').toString();
    }

    private static String errorKind(Throwable error) {
        String simpleName = error.getClass().getSimpleName();
        return simpleName.isEmpty() ? error.getClass().getName() : simpleName;
    }
}

package im.arun.resulttree.member;

import im.arun.resulttree.util.Failures;

import java.lang.reflect.Type;
import java.util.Objects;
import java.util.function.Function;

/**
 * A publicly readable member of some type: its name, its declared type and a
 * read operation that may fail.
 */
public interface MemberAccessor {

    String name();

    /**
     * Declared type of the member. Decides whether the member is shown as a
     * plain scalar leaf.
     */
    Type type();

    Object read(Object target) throws MemberReadException;

    /**
     * Wraps a getter function. Exceptions and recoverable errors thrown by the
     * getter are reported as {@link MemberReadException}.
     */
    static MemberAccessor of(String name, Type type, Function<Object, ?> getter) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(getter, "getter");
        return new MemberAccessor() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Type type() {
                return type;
            }

            @Override
            public Object read(Object target) throws MemberReadException {
                try {
                    return getter.apply(target);
                } catch (RuntimeException | Error e) {
                    if (!Failures.isRecoverable(e)) {
                        throw e;
                    }
                    throw new MemberReadException(name, e);
                }
            }

            @Override
            public String toString() {
                return "MemberAccessor[" + name + "]";
            }
        };
    }
}

package im.arun.resulttree.format;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;
import java.util.UUID;

/**
 * How a value is laid out in a result tree. Decided once per value.
 */
public enum ValueKind {
    /** A thrown error: labelled with its class name, valued with its message. */
    ERROR,
    /** Anything iterable: expanded element by element. */
    SEQUENCE,
    /** Atomic for display: always a leaf. */
    SCALAR,
    /** Any other object: expanded member by member. */
    COMPOSITE;

    private static final Set<Class<?>> SCALAR_TYPES = Set.of(
        String.class, Boolean.class, Character.class,
        Byte.class, Short.class, Integer.class, Long.class, Float.class, Double.class,
        UUID.class, OptionalInt.class, OptionalLong.class, OptionalDouble.class);

    public static ValueKind of(Object value) {
        Objects.requireNonNull(value, "value");
        if (isSimpleType(value.getClass()) || isScalarOptional(value)) {
            return SCALAR;
        }
        if (isSequence(value)) {
            return SEQUENCE;
        }
        if (value instanceof Throwable) {
            return ERROR;
        }
        return COMPOSITE;
    }

    public static boolean isSequence(Object value) {
        return value instanceof Iterable || value instanceof Map || value.getClass().isArray();
    }

    /**
     * Whether a declared type is atomic for display: primitives and their boxes,
     * characters, enums, text, UUIDs, and optionals of any of these.
     */
    public static boolean isSimpleType(Type type) {
        if (type instanceof Class) {
            Class<?> cls = (Class<?>) type;
            return cls.isPrimitive() || Enum.class.isAssignableFrom(cls) || SCALAR_TYPES.contains(cls);
        }
        if (type instanceof ParameterizedType) {
            ParameterizedType parameterized = (ParameterizedType) type;
            return parameterized.getRawType() == Optional.class
                && isSimpleType(parameterized.getActualTypeArguments()[0]);
        }
        return false;
    }

    /**
     * Whether a member value is shown as a scalar leaf. The declared type decides,
     * except for type variables erased at runtime, where the value itself does.
     */
    public static boolean isScalarMember(Type declaredType, Object value) {
        if (declaredType instanceof TypeVariable || declaredType instanceof WildcardType) {
            return value != null && of(value) == SCALAR;
        }
        return isSimpleType(declaredType);
    }

    private static boolean isScalarOptional(Object value) {
        if (!(value instanceof Optional)) {
            return false;
        }
        Optional<?> optional = (Optional<?>) value;
        return optional.isEmpty() || of(optional.get()) == SCALAR;
    }
}

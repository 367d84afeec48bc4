package im.arun.resulttree.member;

import im.arun.resulttree.util.Failures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.beans.Introspector;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Discovers readable members through reflection.
 *
 * <p>Records expose their components in declaration order. Other classes expose
 * their public bean getters ({@code getX()}, {@code isX()} for booleans) and public
 * instance fields, ordered by field declaration from the topmost superclass down;
 * getters without a backing field follow in name order.
 *
 * <p>A getter declared by a class outside the caller's reach (a non-public class or a
 * package the module does not export) is read through the public interface or
 * superclass that declares it. Members that stay unreadable are skipped.
 */
public class ReflectiveMemberResolver implements MemberResolver {
    private static final Logger logger = LoggerFactory.getLogger(ReflectiveMemberResolver.class);

    private final ClassValue<List<MemberAccessor>> cache = new ClassValue<>() {
        @Override
        protected List<MemberAccessor> computeValue(Class<?> type) {
            return List.copyOf(resolve(type));
        }
    };

    @Override
    public List<MemberAccessor> membersOf(Class<?> type) {
        return cache.get(type);
    }

    private List<MemberAccessor> resolve(Class<?> type) {
        if (type.isPrimitive() || type.isArray()) {
            return List.of();
        }
        if (type.isRecord()) {
            return resolveRecord(type);
        }

        Map<String, MemberAccessor> getters = new TreeMap<>();
        for (Method method : type.getMethods()) {
            String name = propertyName(method);
            if (name == null || getters.containsKey(name)) {
                continue;
            }
            Method readable = accessibleMethod(method);
            if (readable == null) {
                logger.debug("Skipping member {} of {}: not accessible", name, type.getName());
                continue;
            }
            getters.put(name, new MethodAccessor(name, readable, method.getGenericReturnType()));
        }

        Map<String, MemberAccessor> fields = new LinkedHashMap<>();
        for (Field field : type.getFields()) {
            String name = field.getName();
            if (Modifier.isStatic(field.getModifiers()) || getters.containsKey(name) || fields.containsKey(name)) {
                continue;
            }
            if (!isPubliclyAccessible(field.getDeclaringClass()) && !field.trySetAccessible()) {
                logger.debug("Skipping field {} of {}: not accessible", name, type.getName());
                continue;
            }
            fields.put(name, new FieldAccessor(field));
        }

        List<MemberAccessor> ordered = new ArrayList<>(getters.size() + fields.size());
        for (Class<?> declaring : hierarchy(type)) {
            for (Field field : declaring.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers())) {
                    continue;
                }
                MemberAccessor member = getters.remove(field.getName());
                if (member == null) {
                    member = fields.remove(field.getName());
                }
                if (member != null) {
                    ordered.add(member);
                }
            }
        }
        ordered.addAll(getters.values());
        ordered.addAll(fields.values());
        return ordered;
    }

    private List<MemberAccessor> resolveRecord(Class<?> type) {
        List<MemberAccessor> members = new ArrayList<>();
        for (RecordComponent component : type.getRecordComponents()) {
            Method readable = accessibleMethod(component.getAccessor());
            if (readable == null) {
                logger.debug("Skipping record component {} of {}: not accessible", component.getName(), type.getName());
                continue;
            }
            members.add(new MethodAccessor(component.getName(), readable, component.getGenericType()));
        }
        return members;
    }

    /**
     * Bean property name of a getter, or null when the method is not one.
     */
    static String propertyName(Method method) {
        if (Modifier.isStatic(method.getModifiers())
                || method.getParameterCount() != 0
                || method.isBridge()
                || method.isSynthetic()
                || method.getReturnType() == void.class
                || method.getDeclaringClass() == Object.class) {
            return null;
        }
        String name = method.getName();
        if (name.startsWith("get") && name.length() > 3) {
            return Introspector.decapitalize(name.substring(3));
        }
        if (name.startsWith("is") && name.length() > 2 && method.getReturnType() == boolean.class) {
            return Introspector.decapitalize(name.substring(2));
        }
        return null;
    }

    private static List<Class<?>> hierarchy(Class<?> type) {
        Deque<Class<?>> chain = new ArrayDeque<>();
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            chain.addFirst(current);
        }
        return new ArrayList<>(chain);
    }

    private static Method accessibleMethod(Method method) {
        if (isPubliclyAccessible(method.getDeclaringClass())) {
            return method;
        }
        Method declared = findPublicDeclaration(method.getDeclaringClass(), method.getName());
        if (declared != null) {
            return declared;
        }
        return method.trySetAccessible() ? method : null;
    }

    private static Method findPublicDeclaration(Class<?> type, String name) {
        Deque<Class<?>> pending = new ArrayDeque<>();
        Set<Class<?>> seen = new HashSet<>();
        pending.add(type);
        while (!pending.isEmpty()) {
            Class<?> current = pending.poll();
            if (!seen.add(current)) {
                continue;
            }
            if (current != type && isPubliclyAccessible(current)) {
                for (Method candidate : current.getDeclaredMethods()) {
                    if (candidate.getName().equals(name)
                            && candidate.getParameterCount() == 0
                            && Modifier.isPublic(candidate.getModifiers())
                            && !Modifier.isStatic(candidate.getModifiers())) {
                        return candidate;
                    }
                }
            }
            if (current.getSuperclass() != null) {
                pending.add(current.getSuperclass());
            }
            pending.addAll(Arrays.asList(current.getInterfaces()));
        }
        return null;
    }

    private static boolean isPubliclyAccessible(Class<?> type) {
        for (Class<?> current = type; current != null; current = current.getEnclosingClass()) {
            if (!Modifier.isPublic(current.getModifiers())) {
                return false;
            }
        }
        return type.getModule().isExported(type.getPackageName());
    }

    private static final class MethodAccessor implements MemberAccessor {
        private final String name;
        private final Method method;
        private final Type type;

        MethodAccessor(String name, Method method, Type type) {
            this.name = name;
            this.method = method;
            this.type = type;
        }

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
                return method.invoke(target);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (!Failures.isRecoverable(cause)) {
                    throw (Error) cause;
                }
                throw new MemberReadException(name, cause);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Member " + name + " of " + method.getDeclaringClass().getName() + " is not readable", e);
            }
        }

        @Override
        public String toString() {
            return "MemberAccessor[" + name + "]";
        }
    }

    private static final class FieldAccessor implements MemberAccessor {
        private final Field field;

        FieldAccessor(Field field) {
            this.field = field;
        }

        @Override
        public String name() {
            return field.getName();
        }

        @Override
        public Type type() {
            return field.getGenericType();
        }

        @Override
        public Object read(Object target) {
            try {
                return field.get(target);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Field " + field.getName() + " of " + field.getDeclaringClass().getName() + " is not readable", e);
            }
        }

        @Override
        public String toString() {
            return "MemberAccessor[" + field.getName() + "]";
        }
    }
}

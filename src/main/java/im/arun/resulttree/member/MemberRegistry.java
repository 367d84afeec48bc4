package im.arun.resulttree.member;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicit per-type accessor tables, keyed by exact runtime class.
 * Types without a table are resolved by the fallback resolver.
 */
public class MemberRegistry implements MemberResolver {

    private final Map<Class<?>, List<MemberAccessor>> tables = new ConcurrentHashMap<>();
    private final MemberResolver fallback;

    public MemberRegistry() {
        this(new ReflectiveMemberResolver());
    }

    public MemberRegistry(MemberResolver fallback) {
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    public <T> MemberRegistry register(Class<T> type, List<MemberAccessor> members) {
        tables.put(Objects.requireNonNull(type, "type"), List.copyOf(members));
        return this;
    }

    public boolean isRegistered(Class<?> type) {
        return tables.containsKey(type);
    }

    @Override
    public List<MemberAccessor> membersOf(Class<?> type) {
        List<MemberAccessor> members = tables.get(type);
        return members != null ? members : fallback.membersOf(type);
    }
}

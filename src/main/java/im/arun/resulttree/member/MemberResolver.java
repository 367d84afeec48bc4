package im.arun.resulttree.member;

import java.util.List;

/**
 * Lists the publicly readable members of a runtime type in a stable order.
 */
public interface MemberResolver {

    List<MemberAccessor> membersOf(Class<?> type);
}

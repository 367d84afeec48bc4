package im.arun.resulttree.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * A sequence whose elements share one key, e.g. a single group of a
 * group-by result. Summarized with its key instead of as a plain sequence.
 */
public interface Grouping<K, E> extends Iterable<E> {

    K getKey();

    static <K, E> Grouping<K, E> of(K key, List<? extends E> elements) {
        List<E> copy = Collections.unmodifiableList(new ArrayList<>(elements));
        return new Grouping<>() {
            @Override
            public K getKey() {
                return key;
            }

            @Override
            public Iterator<E> iterator() {
                return copy.iterator();
            }

            @Override
            public String toString() {
                return key + "=" + copy;
            }
        };
    }
}

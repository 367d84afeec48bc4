package im.arun.resulttree.format;

import im.arun.resulttree.config.ResultTreeConfig;
import im.arun.resulttree.model.Grouping;
import im.arun.resulttree.model.ResultNode;
import im.arun.resulttree.util.Failures;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Expands iterables, maps (as their entries) and arrays element by element.
 */
public class SequenceFormatter {

    private final ValueFormatter valueFormatter;
    private final ResultTreeConfig config;

    SequenceFormatter(ValueFormatter valueFormatter, ResultTreeConfig config) {
        this.valueFormatter = valueFormatter;
        this.config = config;
    }

    /**
     * Build a summary node with one child per element, at most
     * {@code maxEnumerableLength} of them. A trailing {@code +} on the count
     * means the sequence had more elements than were shown.
     *
     * @param elementDepth depth of the element nodes
     */
    public ResultNode buildSequence(Object sequence, String label, int elementDepth) {
        try {
            Iterator<?> iterator = iteratorOf(sequence);
            int limit = config.getMaxEnumerableLength();
            List<ResultNode> items = new ArrayList<>();
            while (items.size() < limit && iterator.hasNext()) {
                items.add(valueFormatter.build(iterator.next(), null, elementDepth));
            }
            String hasMore = iterator.hasNext() ? "+" : "";

            String summary;
            if (sequence instanceof Grouping) {
                Object key = ((Grouping<?, ?>) sequence).getKey();
                summary = String.format("<grouping Count: %d%s Key: %s>", items.size(), hasMore, valueFormatter.format(key));
            } else {
                summary = String.format("<enumerable Count: %d%s>", items.size(), hasMore);
            }
            return new ResultNode(label, summary, items);
        } catch (RuntimeException | Error e) {
            if (!Failures.isRecoverable(e)) {
                throw e;
            }
            // Partial elements are dropped; the failure itself is shown instead
            return valueFormatter.errorNode(label, e, elementDepth);
        }
    }

    static Iterator<?> iteratorOf(Object sequence) {
        if (sequence instanceof Iterable) {
            return ((Iterable<?>) sequence).iterator();
        }
        if (sequence instanceof Map) {
            return ((Map<?, ?>) sequence).entrySet().iterator();
        }
        if (sequence instanceof Object[]) {
            return Arrays.asList((Object[]) sequence).iterator();
        }
        if (sequence.getClass().isArray()) {
            return new PrimitiveArrayIterator(sequence);
        }
        throw new IllegalArgumentException("Not a sequence: " + sequence.getClass().getName());
    }

    private static final class PrimitiveArrayIterator implements Iterator<Object> {
        private final Object array;
        private final int length;
        private int index;

        PrimitiveArrayIterator(Object array) {
            this.array = array;
            this.length = Array.getLength(array);
        }

        @Override
        public boolean hasNext() {
            return index < length;
        }

        @Override
        public Object next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return Array.get(array, index++);
        }
    }
}

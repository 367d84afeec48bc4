package im.arun.resulttree.format;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import im.arun.resulttree.config.ResultTreeConfig;
import im.arun.resulttree.model.Grouping;
import im.arun.resulttree.model.ResultNode;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

/** Tests for {@link SequenceFormatter}, driven through {@link ValueFormatter}. */
class SequenceFormatterTest {

    private final ValueFormatter formatter = ValueFormatterTest.formatter(new ResultTreeConfig());

    private static ValueFormatter cappedAt(int maxEnumerableLength) {
        ResultTreeConfig config = new ResultTreeConfig();
        config.setMaxEnumerableLength(maxEnumerableLength);
        return ValueFormatterTest.formatter(config);
    }

    private static Iterable<Integer> counting(int failAfter) {
        return () -> new Iterator<>() {
            private int next;

            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public Integer next() {
                if (failAfter >= 0 && next == failAfter) {
                    throw new IllegalStateException("source closed");
                }
                return next++;
            }
        };
    }

    public static class Source {
        public Iterable<Integer> getValues() {
            return counting(2);
        }
    }

    @Test
    void groupingSummaryCarriesKey() {
        ResultNode node = formatter.build(Grouping.of("K", List.of("a", "b")), "g", 0);

        assertThat(node.getValue()).isEqualTo("<grouping Count: 2 Key: K>");
        assertThat(node.getChildren()).containsExactly(ResultNode.leaf(null, "a"), ResultNode.leaf(null, "b"));
    }

    @Test
    void groupingWithNullKeyShowsEmptyKey() {
        ResultNode node = formatter.build(Grouping.of(null, List.of(1)), null, 0);

        assertThat(node.getValue()).isEqualTo("<grouping Count: 1 Key: >");
    }

    @Test
    void sequenceAtCapHasNoPlusMarker() {
        ResultNode node = cappedAt(3).build(List.of(1, 2, 3), null, 0);

        assertThat(node.getValue()).isEqualTo("<enumerable Count: 3>");
        assertThat(node.getChildren()).hasSize(3);
    }

    @Test
    void sequenceBeyondCapIsCutAndMarked() {
        ResultNode node = cappedAt(3).build(List.of(1, 2, 3, 4, 5), null, 0);

        assertThat(node.getValue()).isEqualTo("<enumerable Count: 3+>");
        assertThat(node.getChildren()).hasSize(3);
    }

    @Test
    void defaultCapIsTenThousandElements() {
        List<Integer> large = IntStream.range(0, 10_001).boxed().collect(Collectors.toList());

        ResultNode over = formatter.build(large, null, 0);
        ResultNode exact = formatter.build(large.subList(0, 10_000), null, 0);

        assertThat(over.getValue()).isEqualTo("<enumerable Count: 10000+>");
        assertThat(over.getChildren()).hasSize(10_000);
        assertThat(exact.getValue()).isEqualTo("<enumerable Count: 10000>");
    }

    @Test
    void infiniteSequenceTerminates() {
        ResultNode node = cappedAt(5).build(counting(-1), "endless", 0);

        assertThat(node.getValue()).isEqualTo("<enumerable Count: 5+>");
        assertThat(node.getChildren()).extracting(ResultNode::getValue).containsExactly("0", "1", "2", "3", "4");
    }

    @Test
    void failingIterationDiscardsElementsAndShowsError() {
        ResultNode node = formatter.build(counting(2), "nums", 0);

        assertThat(node.getLabel()).isEqualTo("nums");
        assertThat(node.getValue()).isEqualTo("Threw IllegalStateException");
        assertThat(node.getChildren()).hasSize(1);
        assertThat(node.getChildren().get(0).getLabel()).isEqualTo("java.lang.IllegalStateException");
        assertThat(node.getChildren().get(0).getValue()).isEqualTo("source closed");
    }

    @Test
    void iterationErrorIsShownAsErrorNode() {
        Iterable<Object> asserting = () -> new Iterator<>() {
            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public Object next() {
                throw new AssertionError("boom");
            }
        };

        ResultNode node = formatter.build(asserting, "s", 0);

        assertThat(node.getLabel()).isEqualTo("s");
        assertThat(node.getValue()).isEqualTo("Threw AssertionError");
        assertThat(node.getChildren().get(0).getLabel()).isEqualTo("java.lang.AssertionError");
        assertThat(node.getChildren().get(0).getValue()).isEqualTo("boom");
    }

    @Test
    void virtualMachineErrorDuringIterationPropagates() {
        Iterable<Object> exhausted = () -> new Iterator<>() {
            @Override
            public boolean hasNext() {
                throw new OutOfMemoryError("simulated");
            }

            @Override
            public Object next() {
                return null;
            }
        };

        assertThatThrownBy(() -> formatter.build(exhausted, "s", 0)).isInstanceOf(OutOfMemoryError.class);
    }

    @Test
    void failingMemberSequenceKeepsMemberName() {
        ResultNode node = formatter.build(new Source(), null, 0);

        ResultNode values = node.getChildren().get(0);
        assertThat(values.getLabel()).isEqualTo("values");
        assertThat(values.getValue()).isEqualTo("Threw IllegalStateException");
    }

    @Test
    void mapIsSequenceOfEntries() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("a", 1);
        map.put("b", 2);

        ResultNode node = formatter.build(map, "m", 0);

        assertThat(node.getValue()).isEqualTo("<enumerable Count: 2>");
        ResultNode first = node.getChildren().get(0);
        assertThat(first.getValue()).isEqualTo("a=1");
        assertThat(first.getChildren()).containsExactly(ResultNode.leaf("key", "a"), ResultNode.leaf("value", "1"));
    }

    @Test
    void primitiveAndObjectArraysAreSequences() {
        ResultNode ints = formatter.build(new int[] {7, 8}, "ints", 0);
        ResultNode words = formatter.build(new String[] {"x"}, "words", 0);

        assertThat(ints.getValue()).isEqualTo("<enumerable Count: 2>");
        assertThat(ints.getChildren()).containsExactly(ResultNode.leaf(null, "7"), ResultNode.leaf(null, "8"));
        assertThat(words.getChildren()).containsExactly(ResultNode.leaf(null, "x"));
    }

    @Test
    void nullElementsAreNullLeaves() {
        ResultNode node = formatter.build(java.util.Arrays.asList("a", null), null, 0);

        assertThat(node.getChildren()).containsExactly(ResultNode.leaf(null, "a"), ResultNode.leaf(null, "<null>"));
    }
}

package im.arun.resulttree.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.resulttree.config.ResultTreeConfig;
import im.arun.resulttree.model.ExceptionResultNode;
import im.arun.resulttree.model.ResultNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link ResultTreeService}: entry points and JSON transport. */
class ResultTreeServiceTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final ResultTreeService service = new ResultTreeService(new ResultTreeConfig());

    public record Order(String id, List<Integer> quantities) {}

    @Test
    void defaultConstructorLoadsBundledConfig() {
        assertThat(new ResultTreeService().getConfig().getMaxDepth()).isEqualTo(5);
    }

    @Test
    void createWithoutLabel() {
        assertThat(service.create(42)).isEqualTo(ResultNode.leaf(null, "42"));
        assertThat(service.create(null, "x")).isEqualTo(ResultNode.leaf("x", "<null>"));
    }

    @Test
    void renderMatchesToString() {
        ResultNode node = service.create(new Order("A-1", List.of(2, 5)), "order");

        assertThat(service.render(node))
                .isEqualTo(node.toString())
                .isEqualTo("order = Order[id=A-1, quantities=[2, 5]]\n"
                        + "  id = A-1\n"
                        + "  quantities = <enumerable Count: 2>\n"
                        + "    2\n"
                        + "    5\n");
    }

    @Test
    void jsonCarriesTypeAndIdentity() throws Exception {
        String json = service.toJson(service.create(List.of(1, 2), "nums"));

        JsonNode root = JSON.readTree(json);
        assertThat(root.get("@type").asText()).isEqualTo("result");
        assertThat(root.get("@id").isInt()).isTrue();
        assertThat(root.get("label").asText()).isEqualTo("nums");
        assertThat(root.get("value").asText()).isEqualTo("<enumerable Count: 2>");
        assertThat(root.get("children")).hasSize(2);
        assertThat(root.get("children").get(0).has("label")).isFalse();
        assertThat(root.get("children").get(0).has("children")).isFalse();
    }

    @Test
    void jsonRoundTripPreservesTree() throws Exception {
        ResultNode node = service.create(Map.of("k", List.of("v")), "map");

        assertThat(service.fromJson(service.toJson(node))).isEqualTo(node);
    }

    @Test
    void exceptionNodeSurvivesRoundTrip() throws Exception {
        ExceptionResultNode node = service.createException(new IllegalStateException("broken"));

        String json = service.toJson(node);
        ResultNode restored = service.fromJson(json);

        assertThat(JSON.readTree(json).get("@type").asText()).isEqualTo("exception");
        assertThat(JSON.readTree(json).get("message").asText()).isEqualTo("broken");
        assertThat(restored).isInstanceOf(ExceptionResultNode.class).isEqualTo(node);
        assertThat(((ExceptionResultNode) restored).getMessage()).isEqualTo("broken");
    }

    @Test
    void sharedNodeIsWrittenOnceAndReferenced() throws Exception {
        ResultNode shared = ResultNode.leaf("shared", "1");
        ResultNode root = new ResultNode("root", "v", List.of(shared, shared));

        String json = service.toJson(root);
        JsonNode children = JSON.readTree(json).get("children");
        ResultNode restored = service.fromJson(json);

        assertThat(children.get(0).isObject()).isTrue();
        assertThat(children.get(1).isInt()).isTrue();
        assertThat(children.get(1).asInt()).isEqualTo(children.get(0).get("@id").asInt());
        assertThat(restored.getChildren().get(1)).isSameAs(restored.getChildren().get(0));
        assertThat(restored).isEqualTo(root);
    }
}

package im.arun.resulttree.model;

import com.fasterxml.jackson.annotation.JsonIdentityInfo;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.annotation.ObjectIdGenerators;
import im.arun.resulttree.util.TreePrinter;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.beans.PropertyChangeListener;
import java.util.Collections;
import java.util.List;

/**
 * Represents one node of a displayable result tree.
 * A node without children is a leaf. Nodes are built once and never change.
 */
@Getter
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonTypeName("result")
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "@type", defaultImpl = ResultNode.class)
@JsonSubTypes({@JsonSubTypes.Type(value = ExceptionResultNode.class, name = "exception")})
@JsonIdentityInfo(generator = ObjectIdGenerators.IntSequenceGenerator.class, property = "@id")
public class ResultNode {

    @JsonProperty("label")
    private String label;

    @JsonProperty("value")
    private String value;

    @JsonProperty("children")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<ResultNode> children;

    protected ResultNode() {
    }

    public ResultNode(String label, String value, List<ResultNode> children) {
        this.label = label;
        this.value = value;
        this.children = children == null || children.isEmpty() ? null : List.copyOf(children);
    }

    public static ResultNode leaf(String label, String value) {
        return new ResultNode(label, value, null);
    }

    public List<ResultNode> getChildren() {
        return children == null ? List.of() : Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return children != null && !children.isEmpty();
    }

    /**
     * Bindable surface for UI layers. Nodes never change, so the listener is
     * neither stored nor notified.
     */
    public void addPropertyChangeListener(PropertyChangeListener listener) {
    }

    public void removePropertyChangeListener(PropertyChangeListener listener) {
    }

    @Override
    public String toString() {
        return TreePrinter.render(this);
    }
}

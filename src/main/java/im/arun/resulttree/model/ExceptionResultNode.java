package im.arun.resulttree.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Root node for a thrown error, carrying the error message and the
 * script line it was thrown from (0 when unknown).
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@JsonTypeName("exception")
public class ExceptionResultNode extends ResultNode {

    @JsonProperty("message")
    private String message;

    @JsonProperty("line_number")
    private int lineNumber;

    protected ExceptionResultNode() {
    }

    public ExceptionResultNode(ResultNode node, String message, int lineNumber) {
        super(node.getLabel(), node.getValue(), node.getChildren());
        this.message = message;
        this.lineNumber = lineNumber;
    }
}

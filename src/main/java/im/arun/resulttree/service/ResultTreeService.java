package im.arun.resulttree.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.resulttree.config.ConfigLoader;
import im.arun.resulttree.config.ResultTreeConfig;
import im.arun.resulttree.format.ExceptionAdapter;
import im.arun.resulttree.format.ValueFormatter;
import im.arun.resulttree.member.MemberRegistry;
import im.arun.resulttree.member.MemberResolver;
import im.arun.resulttree.model.ExceptionResultNode;
import im.arun.resulttree.model.ResultNode;
import im.arun.resulttree.stack.ScriptFrameDetector;
import im.arun.resulttree.stack.StackTraceRenderer;
import im.arun.resulttree.util.TreePrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for hosts that show evaluation results: turns each produced value
 * or thrown error into a result tree, and moves trees to and from JSON.
 */
public class ResultTreeService {
    private static final Logger logger = LoggerFactory.getLogger(ResultTreeService.class);

    private final ResultTreeConfig config;
    private final ValueFormatter valueFormatter;
    private final ExceptionAdapter exceptionAdapter;
    private final ObjectMapper objectMapper;

    public ResultTreeService() {
        this(new ConfigLoader().load());
    }

    public ResultTreeService(ResultTreeConfig config) {
        this(config, new MemberRegistry(), ScriptFrameDetector.byClassPrefix(config.getScriptClassPrefix()));
    }

    public ResultTreeService(ResultTreeConfig config, MemberResolver memberResolver, ScriptFrameDetector scriptFrameDetector) {
        this.config = config;
        StackTraceRenderer stackTraceRenderer = new StackTraceRenderer(scriptFrameDetector);
        this.valueFormatter = new ValueFormatter(config, memberResolver, stackTraceRenderer);
        this.exceptionAdapter = new ExceptionAdapter(valueFormatter, stackTraceRenderer);
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        logger.debug("Result tree limits: depth={}, text={}, elements={}",
            config.getMaxDepth(), config.getMaxStringLength(), config.getMaxEnumerableLength());
    }

    public ResultNode create(Object value) {
        return create(value, null);
    }

    public ResultNode create(Object value, String label) {
        return valueFormatter.build(value, label, 0);
    }

    public ExceptionResultNode createException(Throwable error) {
        return exceptionAdapter.create(error);
    }

    public String render(ResultNode node) {
        return TreePrinter.render(node);
    }

    public String toJson(ResultNode node) throws JsonProcessingException {
        return objectMapper.writeValueAsString(node);
    }

    public ResultNode fromJson(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, ResultNode.class);
    }

    public ResultTreeConfig getConfig() {
        return config;
    }
}

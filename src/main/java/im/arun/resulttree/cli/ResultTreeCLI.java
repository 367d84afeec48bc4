package im.arun.resulttree.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.resulttree.config.ConfigLoader;
import im.arun.resulttree.config.ResultTreeConfig;
import im.arun.resulttree.model.ResultNode;
import im.arun.resulttree.service.ResultTreeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for Result Tree using Picocli.
 * Reads a JSON or YAML document and prints the result tree of its contents.
 */
@Command(
    name = "result-tree",
    description = "Render a JSON or YAML document as a bounded result tree",
    mixinStandardHelpOptions = true,
    version = "Result Tree 1.0"
)
public class ResultTreeCLI implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(ResultTreeCLI.class);

    enum OutputFormat { text, json }

    @Option(names = {"--input"}, description = "Path to a .json, .yaml or .yml document", required = true)
    private String inputPath;

    @Option(names = {"--label"}, description = "Label of the root node")
    private String label;

    @Option(names = {"--format"}, description = "Output format: ${COMPLETION-CANDIDATES}", defaultValue = "text")
    private OutputFormat format;

    @Option(names = {"--output"}, description = "Output file path")
    private String outputPath;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--max-depth"}, description = "Maximum tree depth")
    private Integer maxDepth;

    @Option(names = {"--max-string-length"}, description = "Maximum length of value text")
    private Integer maxStringLength;

    @Option(names = {"--max-enumerable-length"}, description = "Maximum elements shown per sequence")
    private Integer maxEnumerableLength;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Path input = Paths.get(inputPath);
        if (!Files.exists(input)) {
            err.println("Error: input file not found: " + inputPath);
            return 1;
        }

        Map<String, Object> options = new LinkedHashMap<>();
        options.put("maxDepth", maxDepth);
        options.put("maxStringLength", maxStringLength);
        options.put("maxEnumerableLength", maxEnumerableLength);
        ResultTreeConfig config = new ConfigLoader(configPath).load(options);

        Object document;
        try {
            document = readerFor(input).readValue(input.toFile(), Object.class);
        } catch (IOException e) {
            logger.error("Failed to read {}", input, e);
            err.println("Error reading document: " + e.getMessage());
            return 1;
        }

        ResultTreeService service = new ResultTreeService(config);
        ResultNode tree = service.create(document, label);
        String rendered = format == OutputFormat.json ? service.toJson(tree) : service.render(tree);

        if (outputPath != null) {
            Files.writeString(Paths.get(outputPath), rendered);
            out.println("Output written to: " + outputPath);
        } else {
            out.print(rendered);
            if (!rendered.endsWith("\n")) {
                out.println();
            }
        }
        out.flush();
        return 0;
    }

    private static ObjectMapper readerFor(Path input) {
        String name = input.getFileName().toString().toLowerCase();
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return new ObjectMapper(new YAMLFactory());
        }
        return new ObjectMapper();
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ResultTreeCLI()).execute(args);
        System.exit(exitCode);
    }
}

package im.arun.resulttree.config;

import lombok.Data;

@Data
public class ResultTreeConfig {
    private int maxDepth = 5;
    private int maxStringLength = 10000;
    private int maxEnumerableLength = 10000;
    private String scriptClassPrefix = "REPL.";
}

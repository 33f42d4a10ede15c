package com.vidnyan.rpax;

import com.vidnyan.rpax.domain.invocation.InvocationResolver;
import com.vidnyan.rpax.domain.pseudocode.PseudocodeExpander;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the workflow analyzer.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "rpax")
public class RpaxProperties {

    /**
     * Project directory to analyze. Empty: the CLI does nothing.
     */
    private String projectPath = "";

    /**
     * Directory receiving the JSON artifacts.
     */
    private String outputPath = ".rpax-out";

    private Parser parser = new Parser();

    private Scan scan = new Scan();

    private Invocation invocation = new Invocation();

    private Validation validation = new Validation();

    private Pseudocode pseudocode = new Pseudocode();

    /**
     * Workflows (id, path, file name or display name fragment) to explain after the analysis.
     */
    private List<String> explain = new ArrayList<>();

    @Data
    public static class Parser {
        private int maxDepth = 100;
        private boolean strictMode = false;
        private String expressionLanguage = "VisualBasic";
    }

    @Data
    public static class Scan {
        /** Glob patterns matched against project-relative POSIX paths. */
        private List<String> excludePatterns = new ArrayList<>();
    }

    @Data
    public static class Invocation {
        /** Substrings marking a target as a runtime expression. */
        private List<String> dynamicIndicators = new ArrayList<>();
        private List<String> codedExtensions = new ArrayList<>();
    }

    @Data
    public static class Validation {
        private boolean failOnCycles = true;
        private boolean failOnMissing = false;
    }

    @Data
    public static class Pseudocode {
        private boolean generateExpanded = true;
        /** Invocation hops inlined below the expanded workflow, 0 to 10. */
        private int maxExpansionDepth = 3;
        private PseudocodeExpander.CycleHandling cycleHandling = PseudocodeExpander.CycleHandling.DETECT_AND_MARK;
    }

    @PostConstruct
    public void init() {
        // Set defaults if not configured
        if (scan.getExcludePatterns().isEmpty()) {
            scan.getExcludePatterns().addAll(List.of(".local/**", ".settings/**", ".screenshots/**", "TestResults/**"));
        }
        if (invocation.getDynamicIndicators().isEmpty()) {
            invocation.getDynamicIndicators().addAll(
                    InvocationResolver.DEFAULT_DYNAMIC_INDICATORS);
        }
        if (invocation.getCodedExtensions().isEmpty()) {
            invocation.getCodedExtensions().addAll(
                    InvocationResolver.DEFAULT_CODED_EXTENSIONS);
        }
        if (pseudocode.getMaxExpansionDepth() < 0 || pseudocode.getMaxExpansionDepth() > 10) {
            throw new IllegalArgumentException(
                    "rpax.pseudocode.max-expansion-depth must be between 0 and 10, got "
                            + pseudocode.getMaxExpansionDepth());
        }
    }
}

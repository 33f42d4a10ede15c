package com.vidnyan.rpax.domain.invocation;

import com.vidnyan.rpax.domain.model.Activity;
import com.vidnyan.rpax.domain.model.ActivityTree;
import com.vidnyan.rpax.domain.xaml.ActivityExtractor;
import com.vidnyan.rpax.domain.xaml.ActivityIdGenerator;
import com.vidnyan.rpax.domain.xaml.VisibilityClassifier;
import com.vidnyan.rpax.domain.xaml.XamlNames;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.StringJoiner;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies workflow invocation targets as static, dynamic, missing or coded.
 * <p>
 * The indicator set for dynamic targets is configuration, not a complete classifier.
 */
@Slf4j
public class InvocationResolver {

    public static final List<String> DEFAULT_DYNAMIC_INDICATORS = List.of("[", "]", "{", "}", "Path.Combine", "+");
    public static final List<String> DEFAULT_CODED_EXTENSIONS = List.of(".cs");
    public static final String PROJECT_FILE = "project.json";

    private static final Pattern PATH_COMBINE = Pattern.compile("(?i)Path\\.Combine\\([^)]+\\.xaml[^)]*\\)");
    private static final Pattern BRACKETED_XAML = Pattern.compile("(?i)\\[([^\\]]*\\.xaml[^\\]]*)\\]");
    private static final List<String> EXPRESSION_OPERATORS = List.of("+", "&", "\"", "'", "Path.", "IO.", "System.");

    private final List<String> dynamicIndicators;
    private final List<String> codedExtensions;
    private final Predicate<Path> fileExists;

    public InvocationResolver(List<String> dynamicIndicators, List<String> codedExtensions, Predicate<Path> fileExists) {
        this.dynamicIndicators = List.copyOf(dynamicIndicators);
        this.codedExtensions = codedExtensions.stream().map(e -> e.toLowerCase(Locale.ROOT)).toList();
        this.fileExists = fileExists;
    }

    public static InvocationResolver withDefaults() {
        return new InvocationResolver(DEFAULT_DYNAMIC_INDICATORS, DEFAULT_CODED_EXTENSIONS, Files::isRegularFile);
    }

    /**
     * Classified target: its kind and the POSIX path (or raw expression) stored as {@code to}.
     */
    public record Resolution(InvocationKind kind, String to) {}

    /**
     * Classify one written target.
     * @param workflowFile the invoking workflow file
     * @param projectRoot  project root, or null when unknown
     */
    public Resolution resolve(String target, Path workflowFile, Path projectRoot) {
        String written = target.trim();
        if (isDynamic(written)) {
            return new Resolution(InvocationKind.DYNAMIC, written);
        }
        String normalized = ActivityIdGenerator.normalizePath(written);
        if (isCoded(normalized)) {
            return new Resolution(InvocationKind.CODED, normalized);
        }
        for (Path candidate : candidates(normalized, workflowFile, projectRoot)) {
            if (fileExists.test(candidate)) {
                return new Resolution(InvocationKind.STATIC, relativeTo(projectRoot, candidate, normalized));
            }
        }
        return new Resolution(InvocationKind.MISSING, normalized);
    }

    public boolean isDynamic(String target) {
        return dynamicIndicators.stream().anyMatch(target::contains);
    }

    public boolean isCoded(String target) {
        String lower = target.toLowerCase(Locale.ROOT);
        return codedExtensions.stream().anyMatch(lower::endsWith);
    }

    /**
     * Resolve every invocation of a workflow: one record per InvokeWorkflowFile activity,
     * followed by fallback dynamic hits from visible text.
     */
    public List<InvocationRecord> resolveAll(String workflowId, Path workflowFile, Path projectRoot,
                                             ActivityTree tree, Element root) {
        List<InvocationRecord> records = new ArrayList<>();
        Set<String> classified = new HashSet<>();

        for (Activity activity : tree.invocations()) {
            String target = activity.invocationTarget();
            if (target == null || target.isBlank()) {
                log.debug("InvokeWorkflowFile without target at {} in {}", activity.nodeId(), workflowId);
                continue;
            }
            Resolution resolution = resolve(target, workflowFile, projectRoot);
            records.add(new InvocationRecord(
                    resolution.kind(),
                    workflowId,
                    resolution.to(),
                    activity.invocationArguments(),
                    activityName(activity),
                    ActivityIdGenerator.normalizePath(target),
                    activity.nodeId()));
            rememberTarget(target, classified);
        }

        records.addAll(scanFallback(workflowId, root, classified));
        return records;
    }

    /**
     * Dynamic invocations written outside InvokeWorkflowFile targets. Only visible activity text
     * is scanned; designer metadata and assembly references never are.
     */
    public List<InvocationRecord> scanFallback(String workflowId, Element root, Set<String> classifiedTargets) {
        String text = visibleText(root);
        List<InvocationRecord> records = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        Matcher combine = PATH_COMBINE.matcher(text);
        while (combine.find()) {
            String expression = combine.group().trim();
            if (isKnown(expression, classifiedTargets) || !seen.add(expression)) {
                continue;
            }
            records.add(fallbackRecord(workflowId, expression, InvocationRecord.DYNAMIC_PATH_COMBINE));
        }

        Matcher bracketed = BRACKETED_XAML.matcher(text);
        while (bracketed.find()) {
            String expression = bracketed.group(1).trim();
            if (EXPRESSION_OPERATORS.stream().noneMatch(expression::contains)) {
                continue;
            }
            if (isKnown(expression, classifiedTargets) || isCoveredBy(expression, seen) || !seen.add(expression)) {
                continue;
            }
            records.add(fallbackRecord(workflowId, expression, InvocationRecord.VARIABLE_EXPRESSION));
        }
        return records;
    }

    /**
     * Nearest ancestor directory of a workflow that holds a project.json.
     */
    public Path findProjectRoot(Path workflowFile) {
        Path dir = workflowFile.toAbsolutePath().getParent();
        while (dir != null) {
            if (fileExists.test(dir.resolve(PROJECT_FILE))) {
                return dir;
            }
            dir = dir.getParent();
        }
        return null;
    }

    private static List<Path> candidates(String normalized, Path workflowFile, Path projectRoot) {
        List<Path> candidates = new ArrayList<>();
        Path dir = workflowFile.toAbsolutePath().getParent();
        if (dir != null) {
            candidates.add(dir.resolve(normalized).normalize());
            if (dir.getParent() != null) {
                candidates.add(dir.getParent().resolve(normalized).normalize());
            }
        }
        if (projectRoot != null) {
            candidates.add(projectRoot.toAbsolutePath().resolve(normalized).normalize());
        }
        return candidates;
    }

    private static String relativeTo(Path projectRoot, Path candidate, String fallback) {
        if (projectRoot == null) {
            return fallback;
        }
        Path root = projectRoot.toAbsolutePath().normalize();
        if (!candidate.startsWith(root)) {
            return fallback;
        }
        return root.relativize(candidate).toString().replace('\\', '/');
    }

    private static String activityName(Activity activity) {
        String name = activity.displayName();
        if (name == null || name.isBlank()) {
            return activity.activityType();
        }
        return name.trim().replaceAll("\\s+", " ");
    }

    private static void rememberTarget(String target, Set<String> classified) {
        String lower = target.trim().toLowerCase(Locale.ROOT);
        classified.add(lower);
        classified.add(ActivityIdGenerator.normalizePath(lower));
        int slash = lower.replace('\\', '/').lastIndexOf('/');
        classified.add(slash >= 0 ? lower.substring(slash + 1) : lower);
    }

    private static boolean isKnown(String expression, Set<String> classifiedTargets) {
        String lower = expression.toLowerCase(Locale.ROOT);
        return classifiedTargets.stream().anyMatch(t -> t.equals(lower) || t.contains(lower));
    }

    private static boolean isCoveredBy(String expression, Set<String> seen) {
        return seen.stream().anyMatch(s -> s.contains(expression) || expression.contains(s));
    }

    private static InvocationRecord fallbackRecord(String workflowId, String expression, String activityName) {
        return new InvocationRecord(InvocationKind.DYNAMIC, workflowId, expression, null,
                activityName, expression, null);
    }

    private static String visibleText(Element root) {
        StringJoiner text = new StringJoiner(" ");
        for (Element element : XamlNames.preOrder(root)) {
            if (!VisibilityClassifier.isVisible(element)) {
                continue;
            }
            String content = XamlNames.directText(element);
            if (content != null) {
                text.add(content);
            }
            XamlNames.attributes(element).forEach((name, value) -> {
                if (!ActivityExtractor.isMetadataName(name) && !value.isBlank()) {
                    text.add(value.trim());
                }
            });
        }
        return text.toString();
    }
}

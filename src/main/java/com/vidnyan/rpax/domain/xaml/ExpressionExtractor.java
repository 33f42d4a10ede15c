package com.vidnyan.rpax.domain.xaml;

import com.vidnyan.rpax.domain.model.Expression;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical detection of embedded VB.NET/C# expressions and of the variable names they reference.
 * Works on raw attribute and text values; no expression grammar is parsed.
 */
public class ExpressionExtractor {

    /** Substrings that mark a value as an expression. */
    public static final List<String> INDICATORS = List.of(
            "[", "]", "New ", "new ", "Function(", "function(", "(x) => ", "(x)=>",
            ".ToString()", ".ToLower()", ".ToUpper()", "String.Format", "Path.Combine",
            "If(", ".Where(", ".Select(", ".OrderBy("
    );

    /** Identifiers that look like variables but are keywords or framework types. */
    public static final Set<String> DENYLIST = Set.of(
            "string", "String", "DateTime", "Convert", "Path", "File", "Directory",
            "System", "Microsoft", "UiPath", "New", "True", "False", "Nothing",
            "If", "Then", "Else", "End", "For", "Each", "While", "Do", "Loop"
    );

    /** Context recorded for expressions held in element text rather than an attribute. */
    public static final String TEXT_CONTEXT = "text";

    private static final Pattern ASSIGNMENT_STATEMENT = Pattern.compile("^[A-Za-z_]\\w*\\s*=(?!=)");
    private static final Pattern METHOD_CALL_SHAPE = Pattern.compile("\\w+\\.\\w+\\(");

    private static final Pattern METHOD_NAME = Pattern.compile("\\.(\\w+)\\(");

    private static final List<Pattern> VARIABLE_PATTERNS = List.of(
            Pattern.compile("\\[([a-zA-Z_]\\w*)\\]"),
            Pattern.compile("([a-zA-Z_]\\w*)(?:\\([^)]*\\))?\\."),
            Pattern.compile("([a-zA-Z_]\\w*)\\s*=(?!=)"),
            Pattern.compile("[,(]\\s*([a-zA-Z_]\\w*)(?![.(])")
    );

    private final String language;

    public ExpressionExtractor(String language) {
        this.language = language;
    }

    public String language() {
        return language;
    }

    /**
     * Check if a raw value looks like an expression rather than a literal.
     */
    public static boolean isExpression(String value) {
        if (value == null) {
            return false;
        }
        String trimmed = value.trim();
        if (trimmed.length() < 2) {
            return false;
        }
        for (String indicator : INDICATORS) {
            if (trimmed.contains(indicator)) {
                return true;
            }
        }
        return METHOD_CALL_SHAPE.matcher(trimmed).find() || ASSIGNMENT_STATEMENT.matcher(trimmed).find();
    }

    /**
     * Role of an expression derived from the attribute that holds it.
     */
    public static String classifyRole(String attributeName) {
        if (attributeName == null) {
            return Expression.ROLE_GENERAL;
        }
        String name = XamlNames.strip(attributeName).toLowerCase(Locale.ROOT);
        if (name.contains("condition")) {
            return Expression.ROLE_CONDITION;
        }
        if (name.contains("value") || name.contains("result") || name.contains("assign")) {
            return Expression.ROLE_ASSIGNMENT;
        }
        if (name.contains("message") || name.contains("text") || name.contains("caption")) {
            return Expression.ROLE_MESSAGE;
        }
        if (name.contains("timeout")) {
            return Expression.ROLE_TIMEOUT;
        }
        return Expression.ROLE_GENERAL;
    }

    /**
     * Variable names referenced by a value, sorted, keywords and single letters removed.
     */
    public static List<String> referencedVariables(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        Set<String> names = new TreeSet<>();
        for (Pattern pattern : VARIABLE_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String name = matcher.group(1);
                if (name.length() > 1 && !DENYLIST.contains(name)) {
                    names.add(name);
                }
            }
        }
        return new ArrayList<>(names);
    }

    /**
     * Member methods called in a value: {@code x.Trim().ToLower()} → [Trim, ToLower].
     */
    public static List<String> methodCalls(String text) {
        if (text == null) {
            return List.of();
        }
        Set<String> names = new LinkedHashSet<>();
        collect(METHOD_NAME, text, 1, names);
        return new ArrayList<>(names);
    }

    /**
     * Build an expression for a value if it qualifies, else null.
     */
    public Expression toExpression(String value, String role, String context) {
        if (!isExpression(value)) {
            return null;
        }
        String content = value.trim();
        return new Expression(content, role, language, context,
                referencedVariables(content), methodCalls(content));
    }

    /**
     * All expressions held by an element's attributes and direct text.
     */
    public List<Expression> extract(Map<String, String> attributes, String text) {
        List<Expression> expressions = new ArrayList<>();
        attributes.forEach((name, value) -> {
            Expression expression = toExpression(value, classifyRole(name), XamlNames.strip(name));
            if (expression != null) {
                expressions.add(expression);
            }
        });
        Expression textExpression = toExpression(text, Expression.ROLE_GENERAL, TEXT_CONTEXT);
        if (textExpression != null) {
            expressions.add(textExpression);
        }
        return expressions;
    }

    private static void collect(Pattern pattern, String text, int group, Set<String> into) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            into.add(matcher.group(group).trim());
        }
    }
}

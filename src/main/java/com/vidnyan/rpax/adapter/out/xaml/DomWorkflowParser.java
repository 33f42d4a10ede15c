package com.vidnyan.rpax.adapter.out.xaml;

import com.vidnyan.rpax.RpaxProperties;
import com.vidnyan.rpax.application.port.out.WorkflowParser;
import com.vidnyan.rpax.domain.invocation.InvocationRecord;
import com.vidnyan.rpax.domain.invocation.InvocationResolver;
import com.vidnyan.rpax.domain.model.ActivityTree;
import com.vidnyan.rpax.domain.model.ExtractionError;
import com.vidnyan.rpax.domain.model.ParseDiagnostics;
import com.vidnyan.rpax.domain.model.ParseResult;
import com.vidnyan.rpax.domain.model.WorkflowDocument;
import com.vidnyan.rpax.domain.xaml.ActivityExtractor;
import com.vidnyan.rpax.domain.xaml.ActivityIdGenerator;
import com.vidnyan.rpax.domain.xaml.ActivityTreeBuilder;
import com.vidnyan.rpax.domain.xaml.ExpressionExtractor;
import com.vidnyan.rpax.domain.xaml.TraversalContext;
import com.vidnyan.rpax.domain.xaml.WorkflowMetadataExtractor;
import com.vidnyan.rpax.domain.xaml.XamlNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Workflow parser on top of the JDK DOM.
 * Reads the file, builds metadata, the activity tree and the invocation records in one call.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DomWorkflowParser implements WorkflowParser {

    private static final String XAML_EXTENSION = ".xaml";

    private final InvocationResolver invocationResolver;
    private final RpaxProperties properties;

    @Override
    public ParseResult parse(Path file, ParsingOptions options) {
        long start = System.nanoTime();
        List<String> steps = new ArrayList<>();
        String filePath = file.toString();
        String workflowId = options.workflowId() != null
                ? options.workflowId()
                : ActivityIdGenerator.workflowId(file.getFileName().toString());

        byte[] content;
        try {
            content = Files.readAllBytes(file);
            steps.add("read " + content.length + " bytes");
        } catch (IOException e) {
            log.warn("Cannot read workflow {}: {}", filePath, e.getMessage());
            return ParseResult.failure(filePath, workflowId, "Cannot read file: " + e.getMessage(),
                    elapsedMs(start), ParseDiagnostics.empty(0, steps));
        }

        Element root;
        try {
            root = parseXml(content).getDocumentElement();
            steps.add("parsed XML root " + XamlNames.localName(root));
        } catch (XamlParseException e) {
            log.warn("Failed to parse {}: {}", filePath, e.getMessage());
            return ParseResult.failure(filePath, workflowId, e.getMessage(),
                    elapsedMs(start), ParseDiagnostics.empty(content.length, steps));
        }

        WorkflowMetadataExtractor metadataExtractor =
                new WorkflowMetadataExtractor(properties.getParser().getExpressionLanguage());
        WorkflowDocument document = metadataExtractor.extract(root, workflowId, filePath, fileStem(file));
        steps.add("extracted " + document.arguments().size() + " arguments, "
                + document.variables().size() + " variables");

        ActivityExtractor activityExtractor = new ActivityExtractor(
                new ExpressionExtractor(document.expressionLanguage()), options.maxDepth());
        ActivityTreeBuilder treeBuilder = new ActivityTreeBuilder(activityExtractor, options.maxDepth());
        TraversalContext context = new TraversalContext();
        ActivityTree tree = treeBuilder.build(root, options.projectId(), workflowId, context);
        steps.add("built activity tree with " + tree.size() + " activities");

        Path projectRoot = options.projectRoot() != null
                ? options.projectRoot()
                : invocationResolver.findProjectRoot(file);
        List<InvocationRecord> invocations =
                invocationResolver.resolveAll(workflowId, file, projectRoot, tree, root);
        steps.add("resolved " + invocations.size() + " invocations");

        List<String> errors = tree.errors().stream().map(ExtractionError::format).toList();
        List<String> warnings = tree.warnings();
        boolean success = !options.strictMode() || (errors.isEmpty() && warnings.isEmpty());
        if (!success) {
            log.warn("Strict mode rejected {}: {} errors, {} warnings", filePath, errors.size(), warnings.size());
        }

        ParseDiagnostics diagnostics = new ParseDiagnostics(
                context.elementsProcessed(),
                tree.size(),
                document.arguments().size(),
                document.variables().size(),
                tree.activities().stream().mapToInt(a -> a.expressions().size()).sum(),
                (int) tree.activities().stream().filter(a -> a.annotation() != null).count(),
                XamlNames.namespaceDeclarations(root).size(),
                context.skippedElements(),
                XamlNames.maxDepth(root),
                content.length,
                XamlNames.localName(root),
                steps);

        return new ParseResult(filePath, workflowId, document, tree, invocations, success,
                errors, warnings, elapsedMs(start), diagnostics);
    }

    /**
     * Namespace-aware parse with DOCTYPE declarations and external entities disabled.
     */
    static Document parseXml(byte[] content) throws XamlParseException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new ByteArrayInputStream(content));
        } catch (ParserConfigurationException e) {
            throw new XamlParseException("XML parser unavailable: " + e.getMessage(), e);
        } catch (SAXException e) {
            throw new XamlParseException("Malformed XML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new XamlParseException("Cannot read XML: " + e.getMessage(), e);
        }
    }

    private static String fileStem(Path file) {
        String name = file.getFileName().toString();
        return name.toLowerCase(Locale.ROOT).endsWith(XAML_EXTENSION)
                ? name.substring(0, name.length() - XAML_EXTENSION.length())
                : name;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}

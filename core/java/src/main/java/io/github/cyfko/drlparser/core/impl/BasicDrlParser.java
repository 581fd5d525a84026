package io.github.cyfko.drlparser.core.impl;

import io.github.cyfko.drlparser.core.api.DrlParser;
import io.github.cyfko.drlparser.core.api.IncrementalParseOptions;
import io.github.cyfko.drlparser.core.api.ParseError;
import io.github.cyfko.drlparser.core.api.ParseResult;
import io.github.cyfko.drlparser.core.config.ParserPolicy;
import io.github.cyfko.drlparser.core.exception.DrlParseException;
import io.github.cyfko.drlparser.core.model.ConditionNode;
import io.github.cyfko.drlparser.core.model.DroolsFile;
import io.github.cyfko.drlparser.core.model.Position;
import io.github.cyfko.drlparser.core.model.Range;
import io.github.cyfko.drlparser.core.parsing.ConditionParser;
import io.github.cyfko.drlparser.core.parsing.LineCursor;
import io.github.cyfko.drlparser.core.parsing.ParenthesesTracker;
import io.github.cyfko.drlparser.core.parsing.ParseContext;
import io.github.cyfko.drlparser.core.parsing.StatementScanner;
import io.github.cyfko.drlparser.core.parsing.StructuralDiagnostics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link DrlParser}: a line-oriented statement scanner over heuristic, regex-driven recognizers.
 * <p>
 * This parser translates DRL text into a {@link DroolsFile} in four steps:
 * </p>
 * <ol>
 *   <li><strong>Statement scan:</strong> {@link StatementScanner} walks the lines and delegates each
 *       top-level statement to its sub-parser</li>
 *   <li><strong>Conditions:</strong> {@code when} blocks and query bodies are cut into conditions,
 *       each of which may carry a multi-line pattern tree</li>
 *   <li><strong>Bracket tracking:</strong> every unmasked parenthesis and brace of the document is
 *       matched by {@link ParenthesesTracker}</li>
 *   <li><strong>Diagnostics:</strong> declaration, pattern and bracket errors are derived from the
 *       finished tree and the tracker</li>
 * </ol>
 *
 * <h2>Failure Model</h2>
 * <p>
 * The parse methods never throw. Any runtime failure, including a missing or oversized document,
 * becomes a single {@code Critical parsing error} diagnostic next to {@link DroolsFile#empty()}.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Instances are stateless between calls and may be shared between threads. Each call works on its own
 * {@link ParseContext}.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * DrlParser parser = new BasicDrlParser(ParserPolicy.defaults());
 * ParseResult result = parser.parse(text);
 * for (RuleNode rule : result.ast().rules()) {
 *     System.out.println(rule.name());
 * }
 * result.limitedErrors(ParserPolicy.defaults().maxErrors()).forEach(System.out::println);
 * }</pre>
 *
 * @since 1.0
 */
public class BasicDrlParser implements DrlParser {

    private static final Logger log = Logger.getLogger(BasicDrlParser.class.getName());

    static final Comparator<ParseError> BY_POSITION = Comparator.comparing((ParseError e) -> e.range().start());

    private final ParserPolicy policy;
    private final ConditionParser conditionParser;
    private final StatementScanner scanner;
    private final StructuralDiagnostics diagnostics;
    private final IncrementalParseController incrementalController;

    /**
     * Creates a parser with {@link ParserPolicy#defaults()}.
     */
    public BasicDrlParser() {
        this(ParserPolicy.defaults());
    }

    /**
     * @param policy hard bounds applied during parsing
     * @throws IllegalArgumentException if policy is null
     */
    public BasicDrlParser(ParserPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Parser policy is required");
        }
        this.policy = policy;
        this.conditionParser = new ConditionParser(policy);
        this.scanner = new StatementScanner();
        this.diagnostics = new StructuralDiagnostics(conditionParser.treeBuilder(), policy.maxNestingDepth());
        this.incrementalController = new IncrementalParseController(this);
    }

    public ParserPolicy policy() {
        return policy;
    }

    @Override
    public ParseResult parse(String text) {
        return parse(text, null);
    }

    @Override
    public ParseResult parse(String text, IncrementalParseOptions options) {
        long startTime = System.nanoTime();
        try {
            ParseResult result = options == null ? parseFull(text) : incrementalController.parse(text, options);
            log.fine(() -> String.format("Parsed %d rule(s) with %d diagnostic(s) in %d ms",
                    result.ast().rules().size(), result.errors().size(), (System.nanoTime() - startTime) / 1_000_000));
            return result;
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Critical parsing error", e);
            return new ParseResult(DroolsFile.empty(),
                    List.of(ParseError.error("Critical parsing error: " + e.getMessage(), Position.of(0, 0))));
        }
    }

    @Override
    public ConditionNode parseCondition(String conditionText, Position start) {
        Position origin = start == null ? Position.of(0, 0) : start;
        if (conditionText == null) {
            return ConditionNode.builder("", new Range(origin, origin)).build();
        }
        try {
            return conditionParser.parse(conditionText, origin);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Critical condition parsing error", e);
            return ConditionNode.builder(conditionText, new Range(origin, origin)).build();
        }
    }

    // ---- shared with IncrementalParseController ----

    /**
     * @throws DrlParseException if the text is missing or longer than the policy allows
     */
    List<String> lines(String text) {
        if (text == null) {
            throw new DrlParseException("Document text is required");
        }
        if (text.length() > policy.maxDocumentLength()) {
            throw new DrlParseException("Document length " + text.length()
                    + " exceeds maximum of " + policy.maxDocumentLength() + " characters");
        }
        return LineCursor.split(text);
    }

    ParseResult parseFull(String text) {
        List<String> lines = lines(text);
        DroolsFile ast = DroolsFile.of(parseRegion(lines, 0, lines.size()).nodes(), documentRange(lines));
        ParenthesesTracker tracker = new ParenthesesTracker();
        tracker.trackLines(lines);
        return result(ast, tracker);
    }

    /**
     * Parses the statements starting on lines {@code from..stopLine-1}.
     */
    StatementScanner.Result parseRegion(List<String> lines, int from, int stopLine) {
        ParseContext context = new ParseContext(lines, policy, conditionParser);
        context.cursor().moveTo(from);
        return scanner.scan(context, stopLine);
    }

    ParseResult result(DroolsFile ast, ParenthesesTracker tracker) {
        List<ParseError> errors = new ArrayList<>(diagnostics.collect(ast));
        errors.addAll(tracker.validateAtEndOfFile());
        errors.sort(BY_POSITION);
        return new ParseResult(ast, errors);
    }

    ConditionParser conditionParser() {
        return conditionParser;
    }

    static Range documentRange(List<String> lines) {
        int last = lines.size() - 1;
        return Range.of(0, 0, last, lines.get(last).length());
    }
}

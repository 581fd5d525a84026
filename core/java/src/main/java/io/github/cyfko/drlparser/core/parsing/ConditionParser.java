package io.github.cyfko.drlparser.core.parsing;

import io.github.cyfko.drlparser.core.config.ParserPolicy;
import io.github.cyfko.drlparser.core.model.ConditionNode;
import io.github.cyfko.drlparser.core.model.ConditionType;
import io.github.cyfko.drlparser.core.model.MultiLinePatternNode;
import io.github.cyfko.drlparser.core.model.PatternKeyword;
import io.github.cyfko.drlparser.core.model.Position;
import io.github.cyfko.drlparser.core.model.Range;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a {@link ConditionNode} from the text of one condition.
 * <p>
 * Classification, in order:
 * </p>
 * <ol>
 *   <li>Top-level {@code and}/{@code or} (after unwrapping an enclosing parenthesis group): the
 *       condition is {@code OR} when any top-level {@code or} is present, {@code AND} otherwise, and
 *       each operand becomes a nested condition. Operands below {@code maxNestingDepth} logical
 *       levels are not split further.</li>
 *   <li>A pattern keyword in code: the condition takes the keyword's type when it starts with the
 *       keyword or when the pattern is multi-line; a multi-line pattern is attached as a tree.</li>
 *   <li>Otherwise a plain fact pattern.</li>
 * </ol>
 * <p>
 * A leading {@code $var : Type(...)} or {@code Type(...)} is recognized in every case, and the fact
 * type's body is projected onto constraints.
 * </p>
 *
 * @since 1.0
 */
public final class ConditionParser {

    private static final Pattern BOUND_FACT = Pattern.compile("^(\\$?\\w+)\\s*:\\s*(\\w+(?:\\.\\w+)*)\\s*\\(");
    private static final Pattern FACT = Pattern.compile("^(\\w+(?:\\.\\w+)*)\\s*\\(");

    private final MultiLinePatternDetector detector;
    private final PatternTreeBuilder treeBuilder;
    private final int maxGroupDepth;

    public ConditionParser(ParserPolicy policy) {
        Objects.requireNonNull(policy, "policy is required");
        this.maxGroupDepth = policy.maxNestingDepth();
        this.detector = new MultiLinePatternDetector(policy);
        this.treeBuilder = new PatternTreeBuilder(policy, detector);
    }

    public MultiLinePatternDetector detector() {
        return detector;
    }

    public PatternTreeBuilder treeBuilder() {
        return treeBuilder;
    }

    /**
     * Parses one top-level condition.
     *
     * @param text  condition text; surrounding whitespace is ignored
     * @param start document position of the first character of {@code text}
     * @return the condition
     */
    public ConditionNode parse(String text, Position start) {
        return parse(text, start, 0, Map.of(), null);
    }

    /**
     * Parses one top-level condition whose multi-line pattern was already scanned.
     *
     * @param known pattern to use instead of scanning, or {@code null}; ignored unless it starts inside
     *              the condition
     */
    public ConditionNode parse(String text, Position start, PatternMetadata known) {
        return parse(text, start, 0, Map.of(), known);
    }

    ConditionNode parse(String raw, Position base, int depth, Map<Position, MultiLinePatternNode> built,
                        PatternMetadata known) {
        return parse(raw, base, depth, 0, built, known);
    }

    private ConditionNode parse(String raw, Position base, int depth, int groupDepth,
                                Map<Position, MultiLinePatternNode> built, PatternMetadata known) {
        int lead = 0;
        while (lead < raw.length() && Character.isWhitespace(raw.charAt(lead))) {
            lead++;
        }
        String text = raw.substring(lead).stripTrailing();
        Position textStart = TextPositions.of(raw, base).positionAt(lead);
        TextPositions positions = TextPositions.of(text, textStart);
        Range range = positions.rangeOf(0, text.length());

        ConditionNode.Builder builder = ConditionNode.builder(text, range)
                .spanLines(lines(range))
                .parenthesesRanges(parenthesesRanges(text, positions));

        int[] group = unwrap(text);
        LogicalSplitter.Split split = LogicalSplitter.splitLogical(text.substring(group[0], group[1]));
        if (split.isLogical() && groupDepth < maxGroupDepth) {
            List<ConditionNode> operands = new ArrayList<>();
            boolean multiLine = text.indexOf('\n') >= 0;
            for (LogicalSplitter.Part part : split.parts()) {
                ConditionNode operand = parse(part.text(), positions.positionAt(group[0] + part.offset()),
                        depth, groupDepth + 1, built, known);
                operands.add(operand);
                multiLine |= operand.isMultiLine();
            }
            return builder
                    .conditionType(split.hasOr() ? ConditionType.OR : ConditionType.AND)
                    .nestedConditions(operands)
                    .multiLine(multiLine)
                    .build();
        }

        readFact(text, positions, builder);
        Optional<PatternMetadata> pattern = knownWithin(known, range);
        if (pattern.isEmpty()) {
            pattern = detector.detect(text, textStart);
        }
        if (pattern.isPresent()) {
            PatternMetadata found = pattern.get();
            boolean leading = found.range().start().equals(textStart);
            boolean multiLine = detector.isMultiLine(found);
            if (leading || multiLine) {
                builder.conditionType(found.keyword().conditionType());
            }
            if (multiLine) {
                MultiLinePatternNode tree = built.get(found.range().start());
                builder.multiLinePattern(tree != null ? tree : treeBuilder.build(found, depth, this));
            }
            return builder.multiLine(multiLine || text.indexOf('\n') >= 0).build();
        }
        return builder.multiLine(text.indexOf('\n') >= 0).build();
    }

    private static Optional<PatternMetadata> knownWithin(PatternMetadata known, Range range) {
        if (known == null || range.start().compareTo(known.range().start()) > 0
                || known.range().start().compareTo(range.end()) >= 0) {
            return Optional.empty();
        }
        return Optional.of(known);
    }

    private static void readFact(String text, TextPositions positions, ConditionNode.Builder builder) {
        Matcher bound = BOUND_FACT.matcher(text);
        Matcher fact = FACT.matcher(text);
        String factType;
        int open;
        if (bound.find()) {
            builder.variable(bound.group(1));
            factType = bound.group(2);
            open = bound.end() - 1;
        } else if (fact.find()) {
            factType = fact.group(1);
            open = fact.end() - 1;
        } else {
            return;
        }
        if (PatternKeyword.fromText(factType).isPresent()) {
            return;
        }
        builder.factType(factType);
        int close = CharacterClassifier.matchingClose(text, open);
        String body = text.substring(open + 1, close < 0 ? text.length() : close);
        builder.constraints(ConstraintParser.parse(body, positions, open + 1));
    }

    /**
     * Strips parenthesis groups enclosing the whole text, such as {@code ((A() and B()))}.
     *
     * @return start and end offsets of the innermost enclosed text
     */
    static int[] unwrap(String text) {
        int start = 0;
        int end = text.length();
        while (end - start >= 2 && text.charAt(start) == '(' && text.charAt(end - 1) == ')'
                && CharacterClassifier.matchingClose(text.substring(0, end), start) == end - 1) {
            start++;
            end--;
            while (start < end && Character.isWhitespace(text.charAt(start))) {
                start++;
            }
            while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
                end--;
            }
        }
        return new int[] {start, end};
    }

    /**
     * @return a width-one range per unmasked parenthesis of {@code text}, in document order
     */
    static List<Range> parenthesesRanges(String text, TextPositions positions) {
        List<Range> ranges = new ArrayList<>();
        CharacterClassifier.scan(text, ScanState.START, (c, offset, line, column, code) -> {
            if (code && (c == '(' || c == ')')) {
                ranges.add(Range.at(positions.positionAt(offset)));
            }
            return true;
        });
        return ranges;
    }

    private static List<Integer> lines(Range range) {
        List<Integer> lines = new ArrayList<>();
        for (int line = range.start().line(); line <= range.end().line(); line++) {
            lines.add(line);
        }
        return lines;
    }
}

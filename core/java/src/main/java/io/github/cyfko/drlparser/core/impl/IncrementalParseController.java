package io.github.cyfko.drlparser.core.impl;

import io.github.cyfko.drlparser.core.api.ChangeRange;
import io.github.cyfko.drlparser.core.api.IncrementalParseOptions;
import io.github.cyfko.drlparser.core.api.ParseResult;
import io.github.cyfko.drlparser.core.model.AstNode;
import io.github.cyfko.drlparser.core.model.ConditionNode;
import io.github.cyfko.drlparser.core.model.DroolsFile;
import io.github.cyfko.drlparser.core.model.MultiLinePatternNode;
import io.github.cyfko.drlparser.core.model.Position;
import io.github.cyfko.drlparser.core.model.QueryNode;
import io.github.cyfko.drlparser.core.model.Range;
import io.github.cyfko.drlparser.core.model.RuleNode;
import io.github.cyfko.drlparser.core.model.WhenNode;
import io.github.cyfko.drlparser.core.parsing.ConditionSplitter;
import io.github.cyfko.drlparser.core.parsing.LineCursor;
import io.github.cyfko.drlparser.core.parsing.MultiLinePatternDetector;
import io.github.cyfko.drlparser.core.parsing.ParenthesesTracker;
import io.github.cyfko.drlparser.core.parsing.PatternMetadata;
import io.github.cyfko.drlparser.core.parsing.StatementScanner;
import io.github.cyfko.drlparser.core.parsing.TextPositions;
import io.github.cyfko.drlparser.core.spi.LineSpan;
import io.github.cyfko.drlparser.core.spi.PatternCache;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Re-parses only the region of a document touched by an edit and splices the result into the
 * previous tree.
 * <p>
 * Two paths are tried in order:
 * </p>
 * <ol>
 *   <li><strong>Pattern path:</strong> the edit keeps the line count, lies inside the {@code when}
 *       block of one rule (or the body of one query) and involves a multi-line pattern. The block is
 *       re-split; conditions away from the edit are reused, the others are rebuilt, with cached
 *       pattern scans reused when they still match the text exactly.</li>
 *   <li><strong>Statement path:</strong> statements from the one touching the edit are re-parsed up to
 *       the first untouched statement after it (same line count) or to the end of the document.</li>
 * </ol>
 * <p>
 * The previous tree is never modified: untouched nodes are shared and new parents are created along
 * the spliced path. Diagnostics are recomputed for the resulting tree, so they match those of a full
 * parse of the same text.
 * </p>
 *
 * @since 1.0
 */
final class IncrementalParseController {

    private static final Logger log = Logger.getLogger(IncrementalParseController.class.getName());

    private final BasicDrlParser parser;

    IncrementalParseController(BasicDrlParser parser) {
        this.parser = parser;
    }

    ParseResult parse(String text, IncrementalParseOptions options) {
        if (!options.isComplete()) {
            log.fine("Incremental options incomplete, falling back to a full parse");
            return parser.parseFull(text);
        }
        List<String> lines = parser.lines(text);
        DroolsFile previous = options.previousAst();
        if (options.ranges().isEmpty()) {
            return parser.result(previous, tracker(lines, null, 0, options));
        }

        LineSpan span = changedLines(text, options.ranges());
        int lineDelta = lines.size() - (previous.range().end().line() + 1);
        Optional<DroolsFile> patched = lineDelta == 0 ? reparsePatterns(lines, previous, span, options) : Optional.empty();
        DroolsFile ast = patched.orElseGet(() -> reparseStatements(lines, previous, span, lineDelta, options));
        return parser.result(ast, tracker(lines, span, lineDelta, options));
    }

    private static LineSpan changedLines(String text, List<ChangeRange> ranges) {
        TextPositions positions = TextPositions.document(text);
        int first = Integer.MAX_VALUE;
        int last = 0;
        for (ChangeRange range : ranges) {
            first = Math.min(first, positions.positionAt(range.start()).line());
            last = Math.max(last, positions.positionAt(range.end()).line());
        }
        return LineSpan.of(first, Math.max(first, last));
    }

    // ---- pattern path ----

    private Optional<DroolsFile> reparsePatterns(List<String> lines, DroolsFile previous, LineSpan span,
                                                 IncrementalParseOptions options) {
        List<RuleNode> rules = previous.rules();
        for (int i = 0; i < rules.size(); i++) {
            RuleNode rule = rules.get(i);
            WhenNode when = rule.when();
            if (when == null || !inside(span, when.range().start().line() + 1, when.range().end().line() + 1)) {
                continue;
            }
            int index = i;
            return rebuild(lines, when.range().start().line() + 1, when.range().end().line() + 1,
                    when.conditions(), span, options)
                    .map(conditions -> {
                        WhenNode newWhen = new WhenNode(conditions,
                                new Range(when.range().start(), lineEnd(lines, when.range().end().line())));
                        List<RuleNode> updated = new ArrayList<>(rules);
                        updated.set(index, new RuleNode(rule.name(), rule.attributes(), newWhen, rule.then(),
                                new Range(rule.range().start(), lineEnd(lines, rule.range().end().line()))));
                        return withRules(previous, updated, lines);
                    });
        }

        List<QueryNode> queries = previous.queries();
        for (int i = 0; i < queries.size(); i++) {
            QueryNode query = queries.get(i);
            int first = query.range().start().line() + 1;
            int end = bodyEnd(lines, query);
            if (query.name().isEmpty() || !inside(span, first, end)
                    || span.end() >= query.range().end().line()) {
                continue;
            }
            int index = i;
            return rebuild(lines, first, end, query.conditions(), span, options)
                    .map(conditions -> {
                        List<QueryNode> updated = new ArrayList<>(queries);
                        updated.set(index, new QueryNode(query.name(), query.parameters(), conditions,
                                new Range(query.range().start(), lineEnd(lines, query.range().end().line()))));
                        return withQueries(previous, updated, lines);
                    });
        }
        return Optional.empty();
    }

    private static boolean inside(LineSpan span, int first, int end) {
        return first <= span.start() && span.end() < end;
    }

    private static int bodyEnd(List<String> lines, QueryNode query) {
        int last = query.range().end().line();
        boolean closed = last < lines.size() && last > query.range().start().line()
                && LineCursor.codeText(lines.get(last)).equals("end");
        return closed ? last : last + 1;
    }

    private Optional<List<ConditionNode>> rebuild(List<String> lines, int first, int end,
                                                  List<ConditionNode> old, LineSpan span,
                                                  IncrementalParseOptions options) {
        for (int line = span.start(); line <= span.end(); line++) {
            String code = LineCursor.codeText(lines.get(line));
            if (code.equals("when") || code.equals("then") || code.equals("end") || StatementScanner.startsStatement(code)) {
                log.fine(() -> "Block boundary edited, re-parsing statements");
                return Optional.empty();
            }
        }
        LineCursor cursor = new LineCursor(lines, first);
        boolean indicated = MultiLinePatternDetector.containsPatternIndicator(cursor.join(span.start(), span.end()))
                || old.stream().anyMatch(c -> c.multiLinePattern() != null && touches(c.range(), span));
        if (!indicated) {
            return Optional.empty();
        }

        PatternCache cache = options.cache();
        List<LineSpan> spans = List.of(span);
        List<PatternMetadata> cached = new ArrayList<>();
        for (PatternMetadata pattern : cache.getCachedMultiLinePatterns(options.documentUri(), options.version(), spans)) {
            if (pattern.complete() && pattern.content().equals(slice(lines, pattern.range()))) {
                cached.add(pattern);
            }
        }
        log.fine(() -> String.format("Pattern cache: %d reusable pattern(s) for lines %d..%d",
                cached.size(), span.start(), span.end()));

        List<ConditionNode> conditions = new ArrayList<>();
        List<PatternMetadata> scanned = new ArrayList<>();
        for (ConditionSplitter.Chunk chunk : ConditionSplitter.split(cursor, first, end)) {
            Range chunkRange = TextPositions.of(chunk.text(), chunk.start()).rangeOf(0, chunk.text().length());
            if (!touches(chunkRange, span)) {
                Optional<ConditionNode> unchanged = old.stream()
                        .filter(c -> c.range().equals(chunkRange) && c.content().equals(chunk.text()))
                        .findFirst();
                if (unchanged.isPresent()) {
                    conditions.add(unchanged.get());
                    continue;
                }
            }
            ConditionNode condition = parser.conditionParser().parse(chunk.text(), chunk.start(),
                    firstPattern(chunk, cached));
            conditions.add(condition);
            if (condition.multiLinePattern() != null && touches(condition.range(), span)) {
                scanned.add(metadata(condition.multiLinePattern()));
            }
        }
        cache.cacheMultiLinePatterns(options.documentUri(), options.version(), scanned, spans);
        return Optional.of(conditions);
    }

    /**
     * @return the cached pattern starting at the first keyword of the chunk, or {@code null}
     */
    private static PatternMetadata firstPattern(ConditionSplitter.Chunk chunk, List<PatternMetadata> cached) {
        List<MultiLinePatternDetector.KeywordHit> hits = MultiLinePatternDetector.findKeywords(chunk.text());
        if (hits.isEmpty()) {
            return null;
        }
        Position first = TextPositions.of(chunk.text(), chunk.start()).positionAt(hits.get(0).offset());
        for (PatternMetadata pattern : cached) {
            if (pattern.range().start().equals(first)) {
                return pattern;
            }
        }
        return null;
    }

    // ---- statement path ----

    private DroolsFile reparseStatements(List<String> lines, DroolsFile previous, LineSpan span, int lineDelta,
                                         IncrementalParseOptions options) {
        int gapStart = span.start();
        while (gapStart > 0 && LineCursor.codeText(lines.get(gapStart - 1)).isEmpty()) {
            gapStart--;
        }

        List<AstNode> prefix = new ArrayList<>();
        List<AstNode> suffix = new ArrayList<>();
        for (AstNode node : previous.topLevelNodes()) {
            if (node.range().end().line() < gapStart - 1) {
                prefix.add(node);
            } else if (lineDelta == 0 && node.range().start().line() > span.end()) {
                suffix.add(node);
            }
        }
        int regionStart = prefix.isEmpty() ? 0 : prefix.get(prefix.size() - 1).range().end().line() + 1;
        int stopLine = suffix.isEmpty() ? lines.size() : suffix.get(0).range().start().line();

        StatementScanner.Result region = parser.parseRegion(lines, regionStart, stopLine);
        if (stopLine < lines.size() && overruns(region, stopLine)) {
            log.fine(() -> "Re-parsed region runs into following statements, re-parsing to end of document");
            suffix.clear();
            stopLine = lines.size();
            region = parser.parseRegion(lines, regionStart, stopLine);
        }
        int reparsedTo = stopLine - 1;
        log.fine(() -> String.format("Re-parsed lines %d..%d", regionStart, reparsedTo));

        List<AstNode> nodes = new ArrayList<>(prefix);
        nodes.addAll(region.nodes());
        nodes.addAll(suffix);
        DroolsFile ast = DroolsFile.of(nodes, BasicDrlParser.documentRange(lines));

        if (regionStart <= reparsedTo) {
            options.cache().cacheMultiLinePatterns(options.documentUri(), options.version(),
                    patterns(region.nodes()), List.of(LineSpan.of(regionStart, reparsedTo)));
        }
        return ast;
    }

    private static boolean overruns(StatementScanner.Result region, int stopLine) {
        if (region.inBlockComment()) {
            return true;
        }
        List<AstNode> nodes = region.nodes();
        return !nodes.isEmpty() && nodes.get(nodes.size() - 1).range().end().line() >= stopLine;
    }

    // ---- brackets ----

    private ParenthesesTracker tracker(List<String> lines, LineSpan span, int lineDelta, IncrementalParseOptions options) {
        PatternCache cache = options.cache();
        LineSpan whole = LineSpan.of(0, lines.size() - 1);
        Optional<ParenthesesTracker> cached = lineDelta == 0
                ? cache.getCachedParenthesesTracker(options.documentUri(), options.version(), whole)
                : Optional.empty();

        ParenthesesTracker tracker;
        if (cached.isPresent() && cached.get().lastTrackedLine() == lines.size() - 1) {
            tracker = cached.get();
            if (span != null) {
                tracker.retrack(lines, span.start(), span.end());
            }
            log.fine("Reused cached bracket tracker");
        } else {
            tracker = new ParenthesesTracker();
            tracker.trackLines(lines);
        }
        cache.cacheParenthesesTracker(options.documentUri(), options.version(), tracker, whole);
        return tracker;
    }

    // ---- helpers ----

    private static boolean touches(Range range, LineSpan span) {
        return span.intersects(range.start().line(), range.end().line());
    }

    private static PatternMetadata metadata(MultiLinePatternNode pattern) {
        return new PatternMetadata(pattern.keyword(), pattern.content(), pattern.range(), pattern.isComplete());
    }

    private static List<PatternMetadata> patterns(List<AstNode> nodes) {
        List<PatternMetadata> patterns = new ArrayList<>();
        for (AstNode node : nodes) {
            if (node instanceof RuleNode rule && rule.when() != null) {
                addPatterns(rule.when().conditions(), patterns);
            } else if (node instanceof QueryNode query) {
                addPatterns(query.conditions(), patterns);
            }
        }
        return patterns;
    }

    private static void addPatterns(List<ConditionNode> conditions, List<PatternMetadata> patterns) {
        for (ConditionNode condition : conditions) {
            if (condition.multiLinePattern() != null) {
                patterns.add(metadata(condition.multiLinePattern()));
            }
        }
    }

    private static Position lineEnd(List<String> lines, int line) {
        return Position.of(line, lines.get(line).stripTrailing().length());
    }

    private static String slice(List<String> lines, Range range) {
        Position start = range.start();
        Position end = range.end();
        if (end.line() >= lines.size()) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        for (int line = start.line(); line <= end.line(); line++) {
            String content = lines.get(line);
            int from = line == start.line() ? Math.min(start.character(), content.length()) : 0;
            int to = line == end.line() ? Math.min(end.character(), content.length()) : content.length();
            if (line > start.line()) {
                text.append('\n');
            }
            text.append(content, from, Math.max(from, to));
        }
        return text.toString();
    }

    private static DroolsFile withRules(DroolsFile file, List<RuleNode> rules, List<String> lines) {
        return new DroolsFile(file.packageDeclaration(), file.imports(), file.globals(), file.functions(),
                rules, file.queries(), file.declares(), BasicDrlParser.documentRange(lines));
    }

    private static DroolsFile withQueries(DroolsFile file, List<QueryNode> queries, List<String> lines) {
        return new DroolsFile(file.packageDeclaration(), file.imports(), file.globals(), file.functions(),
                file.rules(), queries, file.declares(), BasicDrlParser.documentRange(lines));
    }
}

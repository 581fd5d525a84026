package io.github.cyfko.drlparser.core.parsing;

import io.github.cyfko.drlparser.core.config.ParserPolicy;
import io.github.cyfko.drlparser.core.model.PatternKeyword;
import io.github.cyfko.drlparser.core.model.Position;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds pattern keywords ({@code exists}, {@code not}, {@code eval}, {@code forall}, {@code collect},
 * {@code accumulate}) followed by {@code (} and scans forward to the parenthesis that closes them.
 * <p>
 * Only keywords that start in code count: a keyword inside a string literal or a comment is ignored.
 * The scan counts unmasked parentheses from the first {@code (} after the keyword and ends when the
 * count returns to zero. It gives up, leaving the pattern incomplete, when the count exceeds
 * {@link ParserPolicy#maxParenScanDepth()}, when more than {@link ParserPolicy#maxPatternLines()} lines
 * were consumed, or at the end of the text.
 * </p>
 *
 * @since 1.0
 */
public final class MultiLinePatternDetector {

    static final Pattern KEYWORD = Pattern.compile("\\b(exists|not|eval|forall|collect|accumulate)\\s*\\(");

    private final ParserPolicy policy;

    public MultiLinePatternDetector(ParserPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy is required");
    }

    /**
     * A keyword occurrence in code.
     *
     * @param keyword the keyword
     * @param offset  offset of the keyword's first character
     * @param open    offset of the {@code (} following the keyword
     */
    public record KeywordHit(PatternKeyword keyword, int offset, int open) {
    }

    /**
     * @param text text to search
     * @return every keyword immediately followed by {@code (}, in code, in text order
     */
    public static List<KeywordHit> findKeywords(String text) {
        List<KeywordHit> hits = new ArrayList<>();
        Matcher matcher = KEYWORD.matcher(text);
        boolean[] code = null;
        while (matcher.find()) {
            if (code == null) {
                code = CharacterClassifier.codeMask(text);
            }
            int open = matcher.end() - 1;
            if (code[matcher.start()] && code[open]) {
                PatternKeyword keyword = PatternKeyword.fromText(matcher.group(1)).orElseThrow();
                hits.add(new KeywordHit(keyword, matcher.start(), open));
            }
        }
        return hits;
    }

    /**
     * Quick test used to decide whether a region may hold multi-line patterns.
     *
     * @return true if the text has a pattern keyword followed by {@code (} in code
     */
    public static boolean containsPatternIndicator(String text) {
        return KEYWORD.matcher(text).find() && !findKeywords(text).isEmpty();
    }

    /**
     * Detects the first pattern of a text.
     *
     * @param text condition text
     * @param base document position of the first character of {@code text}
     * @return metadata of the first pattern keyword found in code, or empty
     */
    public Optional<PatternMetadata> detect(String text, Position base) {
        List<KeywordHit> hits = findKeywords(text);
        if (hits.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(scan(text, hits.get(0), TextPositions.of(text, base)));
    }

    /**
     * Scans one pattern from its keyword.
     *
     * @param text      text holding the pattern
     * @param hit       the keyword occurrence to start from
     * @param positions offset mapping of {@code text}
     * @return the pattern metadata; {@code content} starts at the keyword
     */
    public PatternMetadata scan(String text, KeywordHit hit, TextPositions positions) {
        int maxDepth = policy.maxParenScanDepth();
        int maxLines = policy.maxPatternLines();

        ScanState state = ScanState.START;
        int depth = 0;
        int lines = 1;
        int end = text.length();
        boolean complete = false;

        for (int i = hit.offset(); i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                state = state.nextLine();
                if (++lines > maxLines) {
                    end = i;
                    break;
                }
                continue;
            }
            state = CharacterClassifier.classify(text, i, state);
            if (!state.code() || i < hit.open()) {
                continue;
            }
            if (c == '(') {
                if (++depth > maxDepth) {
                    end = i + 1;
                    break;
                }
            } else if (c == ')' && --depth == 0) {
                end = i + 1;
                complete = true;
                break;
            }
        }

        String content = text.substring(hit.offset(), end).stripTrailing();
        int contentEnd = hit.offset() + content.length();
        return new PatternMetadata(hit.keyword(), content,
                positions.rangeOf(hit.offset(), contentEnd), complete);
    }

    /**
     * A pattern is multi-line when its content spans lines, its parentheses do not balance, or it holds
     * another pattern.
     */
    public boolean isMultiLine(PatternMetadata pattern) {
        return pattern.content().indexOf('\n') >= 0 || !pattern.complete() || hasNestedPatterns(pattern.content());
    }

    /**
     * @param content pattern content starting with its keyword
     * @return true if a pattern keyword occurs after the outer keyword's own parenthesis
     */
    public static boolean hasNestedPatterns(String content) {
        List<KeywordHit> hits = findKeywords(content);
        if (hits.isEmpty()) {
            return false;
        }
        int outerOpen = hits.get(0).offset() == 0 ? hits.get(0).open() : -1;
        for (KeywordHit hit : hits) {
            if (hit.offset() > outerOpen) {
                return true;
            }
        }
        return false;
    }
}

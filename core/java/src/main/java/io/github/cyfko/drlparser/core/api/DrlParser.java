package io.github.cyfko.drlparser.core.api;

import io.github.cyfko.drlparser.core.model.ConditionNode;
import io.github.cyfko.drlparser.core.model.Position;

/**
 * Tolerant parser turning DRL rule-definition text into a {@link ParseResult}.
 * <p>
 * The parser is built for editor tooling: input is usually incomplete while the user types, so
 * implementations never throw from the parse methods. Problems are reported as {@link ParseError}s
 * next to a best-effort tree.
 * </p>
 *
 * <h2>Recognized constructs</h2>
 * <pre>
 * package com.acme;
 * import com.acme.Person;
 * global java.util.List results;
 * function int twice(int x) { return x * 2; }
 * declare Address
 *     city : String
 * end
 * query "adults"
 *     $p : Person(age >= 18)
 * end
 * rule "Adult with account"
 *     salience 10
 * when
 *     $p : Person(age > 18)
 *     exists(
 *         Account(owner == $p)
 *     )
 * then
 *     results.add($p);
 * end
 * </pre>
 *
 * <h2>Multi-line patterns</h2>
 * <p>
 * {@code exists}, {@code not}, {@code eval}, {@code forall}, {@code collect} and {@code accumulate}
 * may span any number of lines and nest. They are exposed as
 * {@link io.github.cyfko.drlparser.core.model.MultiLinePatternNode} trees whose depth is bounded by
 * the parser's policy.
 * </p>
 *
 * <h2>Error taxonomy</h2>
 * <ul>
 *   <li><strong>Structural:</strong> unmatched brackets, incomplete patterns. Always
 *       {@link Severity#ERROR}, always with a partial node.</li>
 *   <li><strong>Recoverable gaps:</strong> unknown top-level lines, missing {@code end} at end of
 *       file. Silently tolerated.</li>
 *   <li><strong>Catastrophic:</strong> anything unexpected. Reported as a single error next to an
 *       empty tree.</li>
 * </ul>
 *
 * @since 1.0
 */
public interface DrlParser {

    /**
     * Parses a whole document.
     *
     * @param text document text
     * @return the tree and diagnostics, never {@code null}
     */
    ParseResult parse(String text);

    /**
     * Parses a document, reusing a previous tree for the parts outside the changed ranges.
     * <p>
     * Without usable options this behaves like {@link #parse(String)}.
     * </p>
     *
     * @param text    new document text
     * @param options incremental inputs, may be {@code null}
     * @return the tree and diagnostics, never {@code null}
     */
    ParseResult parse(String text, IncrementalParseOptions options);

    /**
     * Parses a single condition, with multi-line pattern support.
     *
     * @param conditionText condition text, possibly spanning lines
     * @param start         document position of the first character of {@code conditionText}
     * @return the condition node
     */
    ConditionNode parseCondition(String conditionText, Position start);
}

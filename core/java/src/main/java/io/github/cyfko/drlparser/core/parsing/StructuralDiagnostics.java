package io.github.cyfko.drlparser.core.parsing;

import io.github.cyfko.drlparser.core.api.ParseError;
import io.github.cyfko.drlparser.core.api.Severity;
import io.github.cyfko.drlparser.core.model.AstNode;
import io.github.cyfko.drlparser.core.model.ConditionNode;
import io.github.cyfko.drlparser.core.model.DeclareNode;
import io.github.cyfko.drlparser.core.model.DroolsFile;
import io.github.cyfko.drlparser.core.model.FunctionNode;
import io.github.cyfko.drlparser.core.model.GlobalNode;
import io.github.cyfko.drlparser.core.model.ImportNode;
import io.github.cyfko.drlparser.core.model.MultiLinePatternNode;
import io.github.cyfko.drlparser.core.model.PackageNode;
import io.github.cyfko.drlparser.core.model.QueryNode;
import io.github.cyfko.drlparser.core.model.RuleNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives diagnostics from a finished tree.
 * <ul>
 *   <li>A statement whose header did not parse (empty name or path) yields one
 *       {@code Invalid ... declaration} error at its first character.</li>
 *   <li>An incomplete multi-line pattern attached to a condition yields one error spanning the
 *       pattern and counting its unmatched opening parentheses and braces.</li>
 *   <li>A pattern cut at the maximum nesting depth while still holding nested keywords yields one
 *       warning.</li>
 * </ul>
 * Diagnostics are computed from the tree alone, so an incrementally spliced tree gets the same
 * diagnostics as a full parse of the same text. Bracket errors come from {@link ParenthesesTracker}.
 *
 * @since 1.0
 */
public final class StructuralDiagnostics {

    private final PatternTreeBuilder treeBuilder;
    private final int maxNestingDepth;

    public StructuralDiagnostics(PatternTreeBuilder treeBuilder, int maxNestingDepth) {
        this.treeBuilder = treeBuilder;
        this.maxNestingDepth = maxNestingDepth;
    }

    public List<ParseError> collect(DroolsFile file) {
        List<ParseError> errors = new ArrayList<>();
        for (AstNode node : file.topLevelNodes()) {
            String invalid = invalidHeader(node);
            if (invalid != null) {
                errors.add(ParseError.error(invalid, node.range().start()));
            }
        }
        for (RuleNode rule : file.rules()) {
            if (rule.when() != null) {
                rule.when().conditions().forEach(c -> visit(c, errors));
            }
        }
        for (QueryNode query : file.queries()) {
            query.conditions().forEach(c -> visit(c, errors));
        }
        return errors;
    }

    private static String invalidHeader(AstNode node) {
        if (node instanceof PackageNode p && p.name().isEmpty()) {
            return "Invalid package declaration";
        }
        if (node instanceof ImportNode i && i.path().isEmpty()) {
            return "Invalid import declaration";
        }
        if (node instanceof GlobalNode g && g.name().isEmpty()) {
            return "Invalid global declaration";
        }
        if (node instanceof FunctionNode f && f.name().isEmpty()) {
            return "Invalid function declaration";
        }
        if (node instanceof RuleNode r && r.name().isEmpty()) {
            return "Invalid rule declaration";
        }
        if (node instanceof QueryNode q && q.name().isEmpty()) {
            return "Invalid query declaration";
        }
        if (node instanceof DeclareNode d && d.name().isEmpty()) {
            return "Invalid declare statement";
        }
        return null;
    }

    private void visit(ConditionNode condition, List<ParseError> errors) {
        MultiLinePatternNode pattern = condition.multiLinePattern();
        if (pattern != null) {
            if (!pattern.isComplete()) {
                errors.add(new ParseError(incompleteMessage(pattern.content()), pattern.range(), Severity.ERROR));
            }
            visitTree(pattern, errors);
        }
        condition.nestedConditions().forEach(c -> visit(c, errors));
    }

    private void visitTree(MultiLinePatternNode pattern, List<ParseError> errors) {
        if (treeBuilder.isTruncated(pattern)) {
            errors.add(ParseError.warning("Pattern nesting exceeds maximum depth " + maxNestingDepth,
                    pattern.range().start()));
            return;
        }
        pattern.nestedPatterns().forEach(p -> visitTree(p, errors));
    }

    static String incompleteMessage(String content) {
        int parentheses = Math.max(0, CharacterClassifier.balance(content, '(', ')'));
        int braces = Math.max(0, CharacterClassifier.balance(content, '{', '}'));
        StringBuilder message = new StringBuilder("Incomplete multi-line pattern: ")
                .append(parentheses)
                .append(parentheses == 1 ? " unmatched opening parenthesis" : " unmatched opening parentheses");
        if (braces > 0) {
            message.append(", ").append(braces)
                    .append(braces == 1 ? " unmatched opening brace" : " unmatched opening braces");
        }
        return message.toString();
    }
}

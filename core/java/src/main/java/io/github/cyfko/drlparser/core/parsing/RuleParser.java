package io.github.cyfko.drlparser.core.parsing;

import io.github.cyfko.drlparser.core.model.AstNode;
import io.github.cyfko.drlparser.core.model.ConditionNode;
import io.github.cyfko.drlparser.core.model.Position;
import io.github.cyfko.drlparser.core.model.Range;
import io.github.cyfko.drlparser.core.model.RuleAttributeNode;
import io.github.cyfko.drlparser.core.model.RuleNode;
import io.github.cyfko.drlparser.core.model.ThenNode;
import io.github.cyfko.drlparser.core.model.WhenNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code rule "name"}, its attributes, and its {@code when}, {@code then} and {@code end} lines.
 * <p>
 * Sections are read in order without backtracking: attributes until {@code when}, {@code then} or
 * {@code end}; conditions until {@code then} or {@code end}; actions until {@code end}. A section also
 * stops at the start of another top-level statement, which closes the rule without an error. A rule
 * missing its terminators at the end of the document is returned as parsed so far. A malformed header
 * yields a rule with an empty name.
 * </p>
 *
 * @since 1.0
 */
public final class RuleParser implements StatementParser {

    private static final Pattern QUOTED_HEADER = Pattern.compile("^rule\\s+\"([^\"]+)\"(?:\\s.*)?$");
    private static final Pattern BARE_HEADER = Pattern.compile("^rule\\s+([A-Za-z_][\\w-]*)(?:\\s.*)?$");
    private static final Pattern ATTRIBUTE = Pattern.compile("^([A-Za-z-]+)(?:\\s+(.+?))?\\s*;?$");

    @Override
    public boolean accepts(String code) {
        return code.startsWith("rule ");
    }

    @Override
    public AstNode parse(ParseContext context) {
        LineCursor cursor = context.cursor();
        int header = cursor.index();
        Position start = cursor.lineStart(header);
        String name = parseName(cursor.code());
        cursor.advance();
        int last = header;

        List<RuleAttributeNode> attributes = new ArrayList<>();
        while (cursor.hasNext() && !isSectionEnd(cursor.code())) {
            Matcher matcher = ATTRIBUTE.matcher(cursor.code());
            if (matcher.matches()) {
                int line = cursor.index();
                attributes.add(new RuleAttributeNode(matcher.group(1), matcher.group(2),
                        new Range(cursor.lineStart(line), cursor.lineEnd(line))));
            }
            last = cursor.index();
            cursor.advance();
        }

        WhenNode when = null;
        if (cursor.hasNext() && cursor.code().equals("when")) {
            int whenLine = cursor.index();
            cursor.advance();
            while (cursor.hasNext() && !isWhenEnd(cursor.code())) {
                cursor.advance();
            }
            last = Math.max(whenLine, cursor.index() - 1);
            when = new WhenNode(parseConditions(context, whenLine + 1, cursor.index()),
                    new Range(cursor.lineStart(whenLine), cursor.lineEnd(last)));
        }

        ThenNode then = null;
        if (cursor.hasNext() && cursor.code().equals("then")) {
            int thenLine = cursor.index();
            cursor.advance();
            while (cursor.hasNext() && !isThenEnd(cursor.code())) {
                cursor.advance();
            }
            last = Math.max(thenLine, cursor.index() - 1);
            String actions = thenLine == last ? "" : cursor.join(thenLine + 1, last).trim();
            then = new ThenNode(actions, new Range(cursor.lineStart(thenLine), cursor.lineEnd(last)));
        }

        if (cursor.hasNext() && cursor.code().equals("end")) {
            last = cursor.index();
            cursor.advance();
        }
        return new RuleNode(name, attributes, when, then, new Range(start, cursor.lineEnd(last)));
    }

    private static String parseName(String code) {
        Matcher quoted = QUOTED_HEADER.matcher(code);
        if (quoted.matches()) {
            return quoted.group(1);
        }
        Matcher bare = BARE_HEADER.matcher(code);
        if (bare.matches()) {
            return bare.group(1);
        }
        return "";
    }

    /**
     * Splits the lines {@code from..to-1} into conditions.
     */
    static List<ConditionNode> parseConditions(ParseContext context, int from, int to) {
        List<ConditionNode> conditions = new ArrayList<>();
        for (ConditionSplitter.Chunk chunk : ConditionSplitter.split(context.cursor(), from, to)) {
            conditions.add(context.conditionParser().parse(chunk.text(), chunk.start()));
        }
        return conditions;
    }

    private static boolean isSectionEnd(String code) {
        return code.equals("when") || isWhenEnd(code);
    }

    private static boolean isWhenEnd(String code) {
        return code.equals("then") || isThenEnd(code);
    }

    private static boolean isThenEnd(String code) {
        return code.equals("end") || StatementScanner.startsStatement(code);
    }
}

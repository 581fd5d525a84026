package io.github.cyfko.drlparser.core.parsing;

import io.github.cyfko.drlparser.core.model.AstNode;
import io.github.cyfko.drlparser.core.model.ParameterNode;
import io.github.cyfko.drlparser.core.model.Position;
import io.github.cyfko.drlparser.core.model.QueryNode;
import io.github.cyfko.drlparser.core.model.Range;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code query "name"(Type param, ...)} followed by conditions up to {@code end}.
 * The body is split into conditions exactly as a rule's {@code when} block.
 *
 * @since 1.0
 */
public final class QueryParser implements StatementParser {

    private static final Pattern HEADER =
            Pattern.compile("^query\\s+(?:\"([^\"]*)\"|([A-Za-z_]\\w*))\\s*(?:\\(([^)]*)\\))?\\s*$");

    @Override
    public boolean accepts(String code) {
        return code.startsWith("query ");
    }

    @Override
    public AstNode parse(ParseContext context) {
        LineCursor cursor = context.cursor();
        int header = cursor.index();
        Position start = cursor.lineStart(header);
        String line = cursor.line(header);
        Matcher matcher = HEADER.matcher(line.substring(start.character()).stripTrailing());
        cursor.advance();

        if (!matcher.matches()) {
            RecoveryScanner.resync(context);
            return new QueryNode("", List.of(), List.of(),
                    new Range(start, cursor.lineEnd(Math.max(header, cursor.index() - 1))));
        }

        String name = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
        List<ParameterNode> parameters = matcher.group(3) == null
                ? List.of()
                : FunctionParser.parseParameters(matcher.group(3), header, start.character() + matcher.start(3));

        int bodyStart = cursor.index();
        while (cursor.hasNext() && !cursor.code().equals("end") && !StatementScanner.startsStatement(cursor.code())) {
            cursor.advance();
        }
        int bodyEnd = cursor.index();
        int last = Math.max(header, bodyEnd - 1);
        if (cursor.hasNext() && cursor.code().equals("end")) {
            last = cursor.index();
            cursor.advance();
        }
        return new QueryNode(name, parameters, RuleParser.parseConditions(context, bodyStart, bodyEnd),
                new Range(start, cursor.lineEnd(last)));
    }
}

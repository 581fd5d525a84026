package io.github.cyfko.drlparser.core.parsing;

import io.github.cyfko.drlparser.core.model.AstNode;
import io.github.cyfko.drlparser.core.model.FunctionNode;
import io.github.cyfko.drlparser.core.model.ParameterNode;
import io.github.cyfko.drlparser.core.model.Position;
import io.github.cyfko.drlparser.core.model.Range;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code function ReturnType name(Type param, ...) { ... }}.
 * <p>
 * The body is delimited by brace counting that ignores braces in strings and comments, starting on
 * the header line. Its text runs from the opening to the closing brace, both included. A body that is
 * never closed runs to the end of the document.
 * </p>
 *
 * @since 1.0
 */
public final class FunctionParser implements StatementParser {

    private static final Pattern HEADER = Pattern.compile(
            "^function\\s+([A-Za-z_][\\w.<>\\[\\]]*)\\s+([A-Za-z_]\\w*)\\s*\\(([^)]*)\\)\\s*(\\{.*)?$");
    private static final Pattern PARAMETER = Pattern.compile("^([A-Za-z_][\\w.<>\\[\\]]*)\\s+([A-Za-z_]\\w*)$");

    @Override
    public boolean accepts(String code) {
        return code.startsWith("function ");
    }

    @Override
    public AstNode parse(ParseContext context) {
        LineCursor cursor = context.cursor();
        int header = cursor.index();
        Position start = cursor.lineStart(header);
        String line = cursor.line(header);
        Matcher matcher = HEADER.matcher(line.substring(start.character()).stripTrailing());

        if (!matcher.matches()) {
            cursor.advance();
            RecoveryScanner.resync(context);
            return new FunctionNode("", "", List.of(), "",
                    new Range(start, cursor.lineEnd(Math.max(header, cursor.index() - 1))));
        }

        List<ParameterNode> parameters = parseParameters(matcher.group(3), header,
                start.character() + matcher.start(3));
        int bodySearchFrom = start.character() + matcher.end(3) + 1;
        Body body = readBody(cursor, header, bodySearchFrom);
        cursor.moveTo(body.lastLine + 1);
        return new FunctionNode(matcher.group(1), matcher.group(2), parameters, body.text,
                new Range(start, body.end));
    }

    /**
     * Splits a parameter list on commas; pieces that do not read as {@code Type name} are dropped.
     *
     * @param text   text between the parentheses
     * @param line   document line of the list
     * @param column column of the first character of {@code text}
     */
    static List<ParameterNode> parseParameters(String text, int line, int column) {
        List<ParameterNode> parameters = new ArrayList<>();
        if (text.isBlank()) {
            return parameters;
        }
        int offset = 0;
        for (String piece : text.split(",", -1)) {
            String trimmed = piece.trim();
            Matcher matcher = PARAMETER.matcher(trimmed);
            if (matcher.matches()) {
                int from = column + offset + piece.indexOf(trimmed);
                parameters.add(new ParameterNode(matcher.group(1), matcher.group(2),
                        Range.of(line, from, line, from + trimmed.length())));
            }
            offset += piece.length() + 1;
        }
        return parameters;
    }

    private record Body(String text, Position end, int lastLine) {
    }

    private static Body readBody(LineCursor cursor, int header, int searchFrom) {
        ScanState state = ScanState.START;
        int depth = 0;
        Position open = null;
        for (int lineNo = header; lineNo < cursor.size(); lineNo++) {
            String line = cursor.line(lineNo);
            for (int i = lineNo == header ? searchFrom : 0; i < line.length(); i++) {
                state = CharacterClassifier.classify(line, i, state);
                if (!state.code()) {
                    continue;
                }
                char c = line.charAt(i);
                if (open == null && c != '{' && !Character.isWhitespace(c)) {
                    return new Body("", cursor.lineEnd(header), header);
                }
                if (c == '{') {
                    if (open == null) {
                        open = Position.of(lineNo, i);
                    }
                    depth++;
                } else if (c == '}' && --depth == 0) {
                    Position end = Position.of(lineNo, i + 1);
                    return new Body(slice(cursor, open, end), end, lineNo);
                }
            }
            state = state.nextLine();
        }
        if (open == null) {
            return new Body("", cursor.lineEnd(header), header);
        }
        int last = cursor.size() - 1;
        Position end = cursor.lineEnd(last);
        return new Body(slice(cursor, open, end).stripTrailing(), end, last);
    }

    private static String slice(LineCursor cursor, Position from, Position to) {
        if (from.line() == to.line()) {
            return cursor.line(from.line()).substring(from.character(), to.character());
        }
        StringBuilder text = new StringBuilder(cursor.line(from.line()).substring(from.character()));
        for (int line = from.line() + 1; line < to.line(); line++) {
            text.append('\n').append(cursor.line(line));
        }
        String lastLine = cursor.line(to.line());
        return text.append('\n').append(lastLine, 0, Math.min(to.character(), lastLine.length())).toString();
    }
}

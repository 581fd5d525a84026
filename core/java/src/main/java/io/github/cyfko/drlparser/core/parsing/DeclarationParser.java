package io.github.cyfko.drlparser.core.parsing;

import io.github.cyfko.drlparser.core.model.AstNode;
import io.github.cyfko.drlparser.core.model.DeclareNode;
import io.github.cyfko.drlparser.core.model.FieldNode;
import io.github.cyfko.drlparser.core.model.GlobalNode;
import io.github.cyfko.drlparser.core.model.ImportNode;
import io.github.cyfko.drlparser.core.model.PackageNode;
import io.github.cyfko.drlparser.core.model.Position;
import io.github.cyfko.drlparser.core.model.Range;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code package}, {@code import}, {@code global} and {@code declare} statements.
 * <p>
 * The first three are single-line. A {@code declare} block reads {@code name : Type} field lines until
 * {@code end}; annotation lines and lines of any other shape are skipped.
 * </p>
 *
 * @since 1.0
 */
public final class DeclarationParser implements StatementParser {

    private static final Pattern PACKAGE = Pattern.compile("^package\\s+([A-Za-z_][\\w.]*)\\s*;?$");
    private static final Pattern STATIC_IMPORT = Pattern.compile("^import\\s+static\\s+([A-Za-z_][\\w.*]*)\\s*;?$");
    private static final Pattern IMPORT = Pattern.compile("^import\\s+([A-Za-z_][\\w.*]*)\\s*;?$");
    private static final Pattern GLOBAL =
            Pattern.compile("^global\\s+([A-Za-z_][\\w.<>\\[\\]]*)\\s+([A-Za-z_]\\w*)\\s*;?$");
    private static final Pattern DECLARE =
            Pattern.compile("^declare\\s+(?:trait\\s+)?([A-Za-z_][\\w.]*)(?:\\s+extends\\s+[\\w.]+)?\\s*$");
    private static final Pattern FIELD =
            Pattern.compile("^([A-Za-z_]\\w*)\\s*:\\s*([A-Za-z_][\\w.<>\\[\\]]*)(?:\\s+@.*)?\\s*;?$");

    @Override
    public boolean accepts(String code) {
        return code.startsWith("package ") || code.startsWith("import ")
                || code.startsWith("global ") || code.startsWith("declare ");
    }

    @Override
    public AstNode parse(ParseContext context) {
        String code = context.cursor().code();
        if (code.startsWith("package ")) {
            return parsePackage(context, code);
        }
        if (code.startsWith("import ")) {
            return parseImport(context, code);
        }
        if (code.startsWith("global ")) {
            return parseGlobal(context, code);
        }
        return parseDeclare(context, code);
    }

    private PackageNode parsePackage(ParseContext context, String code) {
        Range range = singleLine(context);
        Matcher matcher = PACKAGE.matcher(code);
        if (!matcher.matches()) {
            return new PackageNode("", range);
        }
        return new PackageNode(matcher.group(1), range);
    }

    private ImportNode parseImport(ParseContext context, String code) {
        Range range = singleLine(context);
        Matcher staticImport = STATIC_IMPORT.matcher(code);
        if (staticImport.matches()) {
            return new ImportNode(staticImport.group(1), true, range);
        }
        Matcher regular = IMPORT.matcher(code);
        if (regular.matches()) {
            return new ImportNode(regular.group(1), false, range);
        }
        return new ImportNode("", false, range);
    }

    private GlobalNode parseGlobal(ParseContext context, String code) {
        Range range = singleLine(context);
        Matcher matcher = GLOBAL.matcher(code);
        if (!matcher.matches()) {
            return new GlobalNode("", "", range);
        }
        return new GlobalNode(matcher.group(1), matcher.group(2), range);
    }

    private DeclareNode parseDeclare(ParseContext context, String code) {
        LineCursor cursor = context.cursor();
        int header = cursor.index();
        Position start = cursor.lineStart(header);
        Matcher matcher = DECLARE.matcher(code);
        cursor.advance();
        if (!matcher.matches()) {
            RecoveryScanner.resync(context);
            return new DeclareNode("", List.of(), new Range(start, cursor.lineEnd(Math.max(header, cursor.index() - 1))));
        }

        List<FieldNode> fields = new ArrayList<>();
        int last = header;
        while (cursor.hasNext()) {
            String line = cursor.code();
            if (line.equals("end")) {
                last = cursor.index();
                cursor.advance();
                break;
            }
            if (StatementScanner.startsStatement(line)) {
                break;
            }
            Matcher field = FIELD.matcher(line);
            if (field.matches()) {
                int index = cursor.index();
                fields.add(new FieldNode(field.group(1), field.group(2),
                        new Range(cursor.lineStart(index), cursor.lineEnd(index))));
            }
            last = cursor.index();
            cursor.advance();
        }
        return new DeclareNode(matcher.group(1), fields, new Range(start, cursor.lineEnd(last)));
    }

    private static Range singleLine(ParseContext context) {
        LineCursor cursor = context.cursor();
        int line = cursor.index();
        cursor.advance();
        return new Range(cursor.lineStart(line), cursor.lineEnd(line));
    }
}

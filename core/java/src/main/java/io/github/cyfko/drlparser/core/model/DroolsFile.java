package io.github.cyfko.drlparser.core.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Root of the syntax tree: one per parsed document.
 *
 * @param packageDeclaration package declaration, or {@code null}
 * @param imports            import declarations in document order
 * @param globals            global declarations in document order
 * @param functions          function definitions in document order
 * @param rules              rules in document order
 * @param queries            queries in document order
 * @param declares           type declarations in document order
 * @param range              whole-document range
 * @since 1.0
 */
public record DroolsFile(
        PackageNode packageDeclaration,
        List<ImportNode> imports,
        List<GlobalNode> globals,
        List<FunctionNode> functions,
        List<RuleNode> rules,
        List<QueryNode> queries,
        List<DeclareNode> declares,
        Range range
) implements AstNode {

    private static final Range EMPTY_RANGE = Range.of(0, 0, 0, 0);

    public DroolsFile {
        Objects.requireNonNull(range, "range is required");
        imports = List.copyOf(imports);
        globals = List.copyOf(globals);
        functions = List.copyOf(functions);
        rules = List.copyOf(rules);
        queries = List.copyOf(queries);
        declares = List.copyOf(declares);
    }

    /**
     * The minimal valid tree substituted when parsing cannot proceed.
     *
     * @return a file with no declarations and an empty range at the document start
     */
    public static DroolsFile empty() {
        return new DroolsFile(null, List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), EMPTY_RANGE);
    }

    /**
     * Distributes top-level nodes into their typed lists, keeping document order. When several package
     * declarations are present the last one wins.
     *
     * @param nodes top-level nodes (package, import, global, function, rule, query, declare)
     * @param range whole-document range
     * @return the assembled file
     */
    public static DroolsFile of(List<? extends AstNode> nodes, Range range) {
        PackageNode pkg = null;
        List<ImportNode> imports = new ArrayList<>();
        List<GlobalNode> globals = new ArrayList<>();
        List<FunctionNode> functions = new ArrayList<>();
        List<RuleNode> rules = new ArrayList<>();
        List<QueryNode> queries = new ArrayList<>();
        List<DeclareNode> declares = new ArrayList<>();

        for (AstNode node : nodes) {
            if (node instanceof PackageNode p) {
                pkg = p;
            } else if (node instanceof ImportNode i) {
                imports.add(i);
            } else if (node instanceof GlobalNode g) {
                globals.add(g);
            } else if (node instanceof FunctionNode f) {
                functions.add(f);
            } else if (node instanceof RuleNode r) {
                rules.add(r);
            } else if (node instanceof QueryNode q) {
                queries.add(q);
            } else if (node instanceof DeclareNode d) {
                declares.add(d);
            } else {
                throw new IllegalArgumentException("Not a top-level node: " + node.getClass().getSimpleName());
            }
        }
        return new DroolsFile(pkg, imports, globals, functions, rules, queries, declares, range);
    }

    /**
     * @return every top-level node ordered by start position
     */
    public List<AstNode> topLevelNodes() {
        List<AstNode> all = new ArrayList<>();
        if (packageDeclaration != null) {
            all.add(packageDeclaration);
        }
        all.addAll(imports);
        all.addAll(globals);
        all.addAll(functions);
        all.addAll(rules);
        all.addAll(queries);
        all.addAll(declares);
        all.sort(Comparator.comparing((AstNode n) -> n.range().start()));
        return all;
    }
}

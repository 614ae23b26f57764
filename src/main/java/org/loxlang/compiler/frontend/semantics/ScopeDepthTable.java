package org.loxlang.compiler.frontend.semantics;

import org.loxlang.compiler.frontend.parser.ast.Expr;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Side table mapping each variable-denoting expression node ({@link Expr.Variable},
 * {@link Expr.Assign}, {@link Expr.This}, {@link Expr.Super}) to its lexical scope depth.
 * <p>
 * Entries are keyed by node identity, not by record equality: the same name at two source
 * positions resolves independently. A node without an entry refers to a global.
 * Depths are written once by the {@link Resolver} and never recomputed at run time.
 * A table covers one resolved program, e.g. one interactive line; functions declared by that
 * program keep it reachable for as long as they live.
 */
public class ScopeDepthTable {

    private final Map<Expr, Integer> depths = new IdentityHashMap<>();

    /**
     * Records the depth for a node.
     * @param expr The expression occurrence.
     * @param depth The number of scopes between the occurrence and the declaring scope.
     */
    public void record(Expr expr, int depth) {
        depths.put(expr, depth);
    }

    /**
     * Looks up the depth recorded for a node.
     * @param expr The expression occurrence.
     * @return The depth, or empty if the node refers to a global.
     */
    public OptionalInt depthOf(Expr expr) {
        Integer depth = depths.get(expr);
        return depth == null ? OptionalInt.empty() : OptionalInt.of(depth);
    }

    public int size() {
        return depths.size();
    }
}

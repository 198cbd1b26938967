package com.boolparser.variable;

import java.util.Map;
import java.util.Optional;

/**
 * Caller-owned mapping from identifier names to values.
 * <p>
 * The engine only reads from a table, and only while evaluating: parsing never
 * consults it. Names on the right of a short-circuited {@code &} or {@code |} are
 * not looked up at all. Values are expected to be {@link Boolean} or {@link Number}.
 * Evaluations sharing one table are safe as long as the caller does not mutate it
 * concurrently.
 */
public interface SymbolTable {

    /**
     * Look up a name.
     *
     * @param name Identifier name as written in the expression (e.g., "order.amount")
     * @return The bound value, or empty if the name is not bound
     */
    Optional<Object> lookup(String name);

    /**
     * Wrap a map as a symbol table. The map is not copied.
     *
     * @param values Name to value bindings
     * @return Table backed by the map
     */
    static SymbolTable of(Map<String, ?> values) {
        return new MapSymbolTable(values);
    }

    /**
     * A table with no bindings.
     */
    static SymbolTable empty() {
        return of(Map.of());
    }
}

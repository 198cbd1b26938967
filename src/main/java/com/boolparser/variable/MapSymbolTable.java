package com.boolparser.variable;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Symbol table backed by a caller-supplied map.
 */
public class MapSymbolTable implements SymbolTable {

    private final Map<String, ?> values;

    public MapSymbolTable(Map<String, ?> values) {
        this.values = Objects.requireNonNull(values, "values");
    }

    @Override
    public Optional<Object> lookup(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(name));
    }

    @Override
    public String toString() {
        return "MapSymbolTable" + values.keySet();
    }
}

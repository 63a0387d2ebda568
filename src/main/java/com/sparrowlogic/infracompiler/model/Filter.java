package com.sparrowlogic.infracompiler.model;

import java.util.List;
import java.util.Objects;

/**
 * Name/values pair narrowing a data source lookup, e.g. {@code tag:Environment = [Production]}.
 */
public record Filter(String name, List<String> values) {

    public Filter {
        Objects.requireNonNull(name, "name");
        values = List.copyOf(values);
    }

    public static Filter of(String name, String... values) {
        return new Filter(name, List.of(values));
    }
}

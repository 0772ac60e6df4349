package com.descant.meta;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Tries each registry in order; the first that resolves a name wins. */
public final class CompositeMetafunctionRegistry implements MetafunctionRegistry {

    private final List<MetafunctionRegistry> registries;

    public CompositeMetafunctionRegistry(List<MetafunctionRegistry> registries) {
        this.registries = List.copyOf(registries);
    }

    /** The builtins, then {@code more} in order. */
    public static CompositeMetafunctionRegistry withBuiltins(MetafunctionRegistry... more) {
        List<MetafunctionRegistry> all = new ArrayList<>();
        all.add(BuiltinMetafunctions.INSTANCE);
        all.addAll(List.of(more));
        return new CompositeMetafunctionRegistry(all);
    }

    @Override
    public Optional<Metafunction> lookup(String name) {
        for (MetafunctionRegistry registry : registries) {
            Optional<Metafunction> found = registry.lookup(name);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    @Override
    public Set<String> names() {
        Set<String> names = new LinkedHashSet<>();
        for (MetafunctionRegistry registry : registries) {
            names.addAll(registry.names());
        }
        return Collections.unmodifiableSet(names);
    }
}

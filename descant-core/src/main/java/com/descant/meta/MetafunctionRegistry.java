package com.descant.meta;

import java.util.Optional;
import java.util.Set;

/** Resolves metafunction names written after {@code @}. */
public interface MetafunctionRegistry {

    Optional<Metafunction> lookup(String name);

    /** Names this registry can resolve. */
    Set<String> names();
}

package com.descant.meta;

import java.util.Map;

/**
 * A provider of user metafunctions, discovered with
 * {@link java.util.ServiceLoader}. Symbols are exported under
 * {@code "cpp2_metafunction_" + name}.
 */
public interface MetafunctionLibrary {

    Map<String, Metafunction> symbols();

    default String getName() {
        return getClass().getName();
    }
}

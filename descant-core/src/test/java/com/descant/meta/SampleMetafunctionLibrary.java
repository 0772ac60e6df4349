package com.descant.meta;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metafunctions registered for the tests through
 * {@code META-INF/services/com.descant.meta.MetafunctionLibrary}.
 */
public class SampleMetafunctionLibrary implements MetafunctionLibrary {

    @Override
    public Map<String, Metafunction> symbols() {
        Map<String, Metafunction> symbols = new LinkedHashMap<>();
        symbols.put("cpp2_metafunction_mark_final", TypeView::makeFinal);
        symbols.put("cpp2_metafunction_add_id", t -> t.addMember("id: i64 = 0;"));
        // not exported: missing the symbol prefix
        symbols.put("helper", t -> t.error("should never run"));
        symbols.put("metafunction_short_prefix", t -> t.error("should never run"));
        return symbols;
    }

    @Override
    public String getName() {
        return "sample";
    }
}

package com.descant.meta;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;

/**
 * Metafunctions contributed by {@link MetafunctionLibrary} providers on a
 * class loader. The first library exporting a symbol wins.
 */
public final class ServiceLoaderMetafunctionRegistry implements MetafunctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServiceLoaderMetafunctionRegistry.class);

    public static final String SYMBOL_PREFIX = "cpp2_metafunction_";

    private final Map<String, Metafunction> symbols;

    public ServiceLoaderMetafunctionRegistry() {
        this(Thread.currentThread().getContextClassLoader());
    }

    public ServiceLoaderMetafunctionRegistry(ClassLoader loader) {
        Map<String, Metafunction> found = new LinkedHashMap<>();
        for (MetafunctionLibrary library : ServiceLoader.load(MetafunctionLibrary.class, loader)) {
            log.info("Loaded metafunction library: {}", library.getName());
            for (Map.Entry<String, Metafunction> e : library.symbols().entrySet()) {
                if (!e.getKey().startsWith(SYMBOL_PREFIX)) {
                    log.warn("Ignoring symbol '{}' from {}: not a metafunction symbol", e.getKey(), library.getName());
                } else if (found.putIfAbsent(e.getKey(), e.getValue()) != null) {
                    log.warn("Symbol '{}' from {} is already provided by another library", e.getKey(), library.getName());
                }
            }
        }
        this.symbols = Collections.unmodifiableMap(found);
    }

    @Override
    public Optional<Metafunction> lookup(String name) {
        return Optional.ofNullable(symbols.get(SYMBOL_PREFIX + name));
    }

    @Override
    public Set<String> names() {
        Set<String> names = new TreeSet<>();
        for (String symbol : symbols.keySet()) {
            names.add(symbol.substring(SYMBOL_PREFIX.length()));
        }
        return Collections.unmodifiableSet(names);
    }
}

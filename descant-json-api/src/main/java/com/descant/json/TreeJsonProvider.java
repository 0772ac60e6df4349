package com.descant.json;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Source of a {@link TreeJsonSerializer} and {@link TreeJsonDeserializer}
 * pair. Implementations register under
 * {@code META-INF/services/com.descant.json.TreeJsonProvider}.
 *
 * <pre>{@code
 * FrontendResult result = new Frontend().process(lines);
 * String json = TreeJsonProvider.getProvider().getSerializer().serializeResult(result);
 * }</pre>
 */
public interface TreeJsonProvider {

    TreeJsonSerializer getSerializer();

    TreeJsonDeserializer getDeserializer();

    /** Short name used to select this provider, such as "Jackson". */
    String getName();

    /** Every provider visible to {@code loader}, in service-file order. */
    static List<TreeJsonProvider> providers(ClassLoader loader) {
        List<TreeJsonProvider> found = new ArrayList<>();
        ClassLoader effective = loader != null ? loader : TreeJsonProvider.class.getClassLoader();
        ServiceLoader.load(TreeJsonProvider.class, effective).forEach(found::add);
        return found;
    }

    /** The provider whose name matches {@code name} ignoring case, if one is registered. */
    static Optional<TreeJsonProvider> find(String name) {
        return providers(Thread.currentThread().getContextClassLoader()).stream()
                .filter(p -> p.getName().equalsIgnoreCase(name))
                .findFirst();
    }

    /**
     * The first registered provider.
     *
     * @throws IllegalStateException if none is on the classpath
     */
    static TreeJsonProvider getProvider() {
        List<TreeJsonProvider> all = providers(Thread.currentThread().getContextClassLoader());
        if (all.isEmpty()) {
            throw new IllegalStateException("no TreeJsonProvider on the classpath; add descant-jackson");
        }
        return all.get(0);
    }

    /**
     * The provider named {@code name}.
     *
     * @throws IllegalStateException naming the registered providers if none matches
     */
    static TreeJsonProvider getProvider(String name) {
        return find(name).orElseThrow(() -> new IllegalStateException(
                "no TreeJsonProvider named '" + name + "'; registered: "
                        + providers(Thread.currentThread().getContextClassLoader()).stream()
                                .map(TreeJsonProvider::getName)
                                .collect(Collectors.joining(", ", "[", "]"))));
    }
}

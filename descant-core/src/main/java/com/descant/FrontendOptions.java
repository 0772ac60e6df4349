package com.descant;

import com.descant.meta.BuiltinMetafunctions;
import com.descant.meta.MetafunctionRegistry;

import java.util.function.Consumer;

/**
 * Settings for one {@link Frontend}.
 *
 * @param registry         resolves {@code @name} requests
 * @param runMetafunctions false to stop after parsing
 * @param printSink        receives the text written by {@code @print}
 */
public record FrontendOptions(MetafunctionRegistry registry, boolean runMetafunctions, Consumer<String> printSink) {

    public FrontendOptions {
        if (registry == null) {
            throw new IllegalArgumentException("a metafunction registry is required");
        }
        if (printSink == null) {
            throw new IllegalArgumentException("a print sink is required");
        }
    }

    public static FrontendOptions defaults() {
        return new FrontendOptions(BuiltinMetafunctions.INSTANCE, true, System.out::println);
    }

    public FrontendOptions withRegistry(MetafunctionRegistry registry) {
        return new FrontendOptions(registry, runMetafunctions, printSink);
    }

    public FrontendOptions withRunMetafunctions(boolean runMetafunctions) {
        return new FrontendOptions(registry, runMetafunctions, printSink);
    }

    public FrontendOptions withPrintSink(Consumer<String> printSink) {
        return new FrontendOptions(registry, runMetafunctions, printSink);
    }
}

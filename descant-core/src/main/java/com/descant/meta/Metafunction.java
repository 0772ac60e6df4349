package com.descant.meta;

/**
 * A compile-time function that inspects and rewrites a type definition
 * through its {@link TypeView}. Problems are reported through the view,
 * never thrown.
 */
@FunctionalInterface
public interface Metafunction {

    void apply(TypeView t);
}

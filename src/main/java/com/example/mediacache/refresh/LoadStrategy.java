package com.example.mediacache.refresh;

import java.util.function.Supplier;

/**
 * How a cache miss reaches the upstream loader. Called without any store lock held.
 */
public interface LoadStrategy<V> {
    V load(String key, Supplier<V> loader);
}

package com.example.mediacache.refresh;

import java.util.function.Supplier;

/**
 * Every miss calls the loader, even when another request is already loading the same key.
 */
public class NaiveLoadStrategy<V> implements LoadStrategy<V> {

    @Override
    public V load(String key, Supplier<V> loader) {
        return loader.get();
    }
}

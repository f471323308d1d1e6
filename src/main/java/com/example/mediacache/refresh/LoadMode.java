package com.example.mediacache.refresh;

public enum LoadMode {
    NAIVE,
    COALESCING;

    public <V> LoadStrategy<V> newStrategy() {
        switch (this) {
            case NAIVE:
                return new NaiveLoadStrategy<>();
            case COALESCING:
                return new CoalescingLoadStrategy<>();
            default:
                throw new IllegalArgumentException("Unknown load mode: " + this);
        }
    }
}

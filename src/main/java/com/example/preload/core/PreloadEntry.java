package com.example.preload.core;

public class PreloadEntry<V> {
    public final V value;
    public final long loadedAtMillis; // wall clock when the value was stored
    public final long loadNanos;      // how long the assembler took, start to settle

    public PreloadEntry(V value, long loadedAtMillis, long loadNanos) {
        this.value = value;
        this.loadedAtMillis = loadedAtMillis;
        this.loadNanos = loadNanos;
    }
}

package com.github.wikiexport.utils;

import java.util.Objects;

public record Namespace(int id, String name) {
    public Namespace {
        Objects.requireNonNull(name);
    }

    @Override
    public String toString() {
        return String.format("%d (%s)", id, name);
    }
}

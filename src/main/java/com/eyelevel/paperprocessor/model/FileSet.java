package com.eyelevel.paperprocessor.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The extracted contents of a source archive: relative path to raw bytes, in archive order.
 * <p>
 * A FileSet belongs to the single pipeline run that created it. The byte arrays are handed out
 * without copying, so callers must treat them as read-only.
 */
public final class FileSet {

    private final Map<String, byte[]> entries;

    private FileSet(Map<String, byte[]> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static FileSet of(Map<String, byte[]> entries) {
        return new FileSet(new LinkedHashMap<>(entries));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> paths() {
        return entries.keySet();
    }

    public Optional<byte[]> content(String path) {
        return Optional.ofNullable(entries.get(path));
    }

    /**
     * Decodes an entry as UTF-8, replacing malformed sequences. Never throws for bad input.
     */
    public Optional<String> text(String path) {
        return content(path).map(bytes -> new String(bytes, StandardCharsets.UTF_8));
    }

    public Map<String, byte[]> asMap() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FileSet other) || !entries.keySet().equals(other.entries.keySet())) {
            return false;
        }
        return entries.entrySet().stream()
                .allMatch(e -> Arrays.equals(e.getValue(), other.entries.get(e.getKey())));
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for (Map.Entry<String, byte[]> e : entries.entrySet()) {
            hash += e.getKey().hashCode() ^ Arrays.hashCode(e.getValue());
        }
        return hash;
    }

    @Override
    public String toString() {
        return "FileSet" + entries.keySet();
    }

    public static final class Builder {
        private final Map<String, byte[]> entries = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String path, byte[] content) {
            entries.put(path, content);
            return this;
        }

        public Builder put(String path, String content) {
            return put(path, content.getBytes(StandardCharsets.UTF_8));
        }

        public boolean contains(String path) {
            return entries.containsKey(path);
        }

        public int size() {
            return entries.size();
        }

        public FileSet build() {
            return new FileSet(new LinkedHashMap<>(entries));
        }
    }
}

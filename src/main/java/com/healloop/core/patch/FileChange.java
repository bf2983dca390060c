package com.healloop.core.patch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One file-level operation of a {@link PatchPlan}. On the wire the variant is carried by
 * the {@code operation} property: {@code replace} with {@code search}/{@code replace},
 * {@code create} or {@code append} with {@code content}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "operation")
@JsonSubTypes({
    @JsonSubTypes.Type(value = FileChange.Replace.class, name = "replace"),
    @JsonSubTypes.Type(value = FileChange.Create.class, name = "create"),
    @JsonSubTypes.Type(value = FileChange.Append.class, name = "append")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface FileChange permits FileChange.Replace, FileChange.Create, FileChange.Append {

    String path();

    String description();

    PatchOperation operation();

    /** Replaces the single occurrence of {@code search} with {@code replace}. */
    record Replace(String path, String description, String search, String replace) implements FileChange {
        public Replace {
            requirePath(path);
            if (search == null || search.isEmpty()) {
                throw new IllegalArgumentException("replace of " + path + " requires a non-empty search");
            }
            if (replace == null) {
                throw new IllegalArgumentException("replace of " + path + " requires a replacement");
            }
        }

        @Override
        public PatchOperation operation() {
            return PatchOperation.REPLACE;
        }
    }

    /** Creates a new file. */
    record Create(String path, String description, String content) implements FileChange {
        public Create {
            requirePath(path);
            if (content == null) {
                throw new IllegalArgumentException("create of " + path + " requires content");
            }
        }

        @Override
        public PatchOperation operation() {
            return PatchOperation.CREATE;
        }
    }

    /** Appends to an existing file, creating it when absent. */
    record Append(String path, String description, String content) implements FileChange {
        public Append {
            requirePath(path);
            if (content == null) {
                throw new IllegalArgumentException("append to " + path + " requires content");
            }
        }

        @Override
        public PatchOperation operation() {
            return PatchOperation.APPEND;
        }
    }

    private static void requirePath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("file change requires a path");
        }
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;


/**
 * Acts as a unique id for every object of one {@link RootEntity}. Ids are handed out by the root in creation order
 * and carry the lower-cased kind of the object they identify, e.g. {@code note-12}
 */
public class ObjectId implements Comparable<ObjectId> {
    private final String kind;
    private final long id;

    ObjectId(String kind, long id) {
        this.kind = kind.toLowerCase(Locale.ROOT);
        this.id = id;
    }

    public String getKind() {
        return kind;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ObjectId)) {
            return false;
        }
        ObjectId other = (ObjectId) o;
        return this.id == other.id && this.kind.equals(other.kind);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public int compareTo(@NotNull ObjectId right) {
        return Long.compare(id, right.id);
    }

    @Override
    public String toString() {
        return kind + "-" + id;
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;


/**
 * Base class for the root element of a score tree. The root hands out the {@link ObjectId}s of all objects in its
 * tree, so identities are unique per tree and independent of any other tree built at the same time.
 */
public abstract class RootEntity implements ScoreObject {

    /** id counter of this tree. As transient member, it is not part of the data model itself */
    private transient long currentObjectId;

    private transient ObjectId id;

    ObjectId nextObjectId(Class<?> clazz) {
        return new ObjectId(clazz.getSimpleName(), currentObjectId++);
    }

    @Override
    public RootEntity getRootEntity() {
        return this;
    }

    @Override
    public ObjectId getId() {
        if (id == null)
            id = nextObjectId(getClass());
        return id;
    }

    /**
     * Find an object of this tree by its identity
     * @param reference the identity as string, with or without leading {@code #}
     * @return the object or null if no object of the tree (that was ever asked for its id) matches
     */
    public @Nullable ScoreObject findById(String reference) {
        String wanted = reference.startsWith("#") ? reference.substring(1) : reference;
        return findById(this, wanted);
    }
    private static ScoreObject findById(ScoreObject so, String wanted) {
        if (so.getId().toString().equals(wanted))
            return so;
        for (Child<?> child : ClassMetadata.getChildren(so)) {
            ScoreObject found = findById(child, wanted);
            if (found != null)
                return found;
        }
        return null;
    }

    /**
     * Collect all objects of the given type in this tree, in depth-first document order
     */
    public <T extends ScoreObject> List<T> findAll(Class<T> clazz) {
        List<T> found = new ArrayList<>();
        collect(this, clazz, found);
        return found;
    }
    private static <T extends ScoreObject> void collect(ScoreObject so, Class<T> clazz, List<T> found) {
        for (Child<?> child : ClassMetadata.getChildren(so)) {
            if (clazz.isInstance(child))
                found.add(clazz.cast(child));
            collect(child, clazz, found);
        }
    }
}

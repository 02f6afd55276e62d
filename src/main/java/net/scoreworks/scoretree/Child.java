/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree;

import net.scoreworks.scoretree.exceptions.IllegalDataModelException;
import org.jetbrains.annotations.Nullable;

/**
 * Base class for each class in the score tree except the {@link RootEntity}. Each such class has at most one owner
 * at a time. A child is either created directly inside its owner or created detached and attached later with
 * {@link Child#attachTo(ScoreObject)}. Attaching an already owned child transfers it, so ownership is never shared.
 * @param <O> class-type of the owner class
 */
public abstract class Child<O extends ScoreObject> implements ScoreObject {

    /**
     * Cache reference to the root entity of the score tree for direct access
     */
    private final RootEntity root;

    /**
     * Reference to the owner of the class, null while detached
     */
    private O owner;

    private ObjectId id;

    /**
     * Prevent removal to be triggered several times on the same object
     */
    private transient boolean removalInProcess;

    protected Child(O owner) {
        this(owner.getRootEntity());
        this.owner = owner;
        //call addToOwner only if the current instance is a direct Child. If not, derivations will call it once fields are set
        if (isDirectChild())
            addToOwner();
    }

    /**
     * Create a detached child of the given tree
     */
    protected Child(RootEntity root) {
        this.root = root;
        ClassMetadata.checkDataModel(getClass());
    }

    public @Nullable O getOwner() {
        return owner;
    }

    public boolean isAttached() {
        return owner != null;
    }

    /**
     * Attach this object to a new owner. If the object is owned already, it is moved together with all its children
     * @param newOwner owner of the same tree
     */
    public void attachTo(O newOwner) {
        if (newOwner.getRootEntity() != root)
            throw new IllegalDataModelException(getClass(), "can't be attached to an owner of another score tree!");
        if (owner != null)
            removeFromOwner();
        owner = newOwner;
        addToOwner();
    }

    /**
     * Remove this object and all subsequent children from the score tree.
     * This method will go through all children recursively and call {@link Child#removeFromOwner()} and {@link Child#onRemove()}
     * on them
     */
    public final void remove() {
        if (removalInProcess)
            return;
        removalInProcess = true;
        recursivelyRemove(this);
    }
    private static void recursivelyRemove(Child<?> ch) {
        for (Child<?> t : ClassMetadata.getChildren(ch)) {
            recursivelyRemove(t);
        }
        if (ch.owner != null)
            ch.removeFromOwner();
        ch.onRemove();
        ch.owner = null;
    }

    /**
     * Internal method to differentiate Child from its derivations which must call addToOwner() only after setting all
     * construction parameters
     */
    protected boolean isDirectChild() {
        return true;
    }

    /**
     * Remove itself from the owner's collection or field. Since name of the owning field is unknown, this must be
     * implemented by each implementing data class
     */
    protected abstract void removeFromOwner();

    /**
     * Add itself to the owner's collection or field. Since name of the owning field is unknown, this must be
     * implemented by each implementing data class
     */
    protected abstract void addToOwner();

    /**
     * This method gets called when this object is being removed from the score tree. Implementation is optional
     */
    protected void onRemove() {}

    @Override
    public RootEntity getRootEntity() {
        return root;
    }

    @Override
    public ObjectId getId() {
        if (id == null)
            id = root.nextObjectId(getClass());
        return id;
    }
}

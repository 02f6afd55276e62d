/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.exceptions;

/**
 * An exception that gets thrown if a class of the score tree violates the rules of the data model, or if the tree
 * is used in a way that would break ownership
 */
public class IllegalDataModelException extends RuntimeException {
    public IllegalDataModelException(Class<?> clazz, String message) {
        super(clazz.getSimpleName() + " "+message);
    }
}

package com.signallint.plugins.react.tree;

/**
 * One declared child position of a node kind: a field plus its arity.
 */
public final class Slot {
    private final Field field;
    private final boolean many;

    private Slot(Field field, boolean many) {
        this.field = field;
        this.many = many;
    }

    public static Slot one(Field field) {
        return new Slot(field, false);
    }

    public static Slot many(Field field) {
        return new Slot(field, true);
    }

    public Field getField() {
        return field;
    }

    public boolean isMany() {
        return many;
    }

    @Override
    public String toString() {
        return field.getJsonKey() + (many ? "[]" : "");
    }
}

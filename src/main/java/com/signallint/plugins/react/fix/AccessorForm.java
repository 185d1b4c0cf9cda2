package com.signallint.plugins.react.fix;

/**
 * How a rewritten reference reads its handle.
 */
public enum AccessorForm {
    BARE,   // countSignal
    VALUE,  // countSignal.value
    PEEK;   // countSignal.peek()

    public String render(String name) {
        switch (this) {
            case VALUE:
                return name + ".value";
            case PEEK:
                return name + ".peek()";
            default:
                return name;
        }
    }
}

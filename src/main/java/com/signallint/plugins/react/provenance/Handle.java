package com.signallint.plugins.react.provenance;

import com.signallint.plugins.react.tree.JsNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A binding known, or guessed, to hold a reactive handle. A container handle is a binding to an
 * object or array literal that holds handles under some of its property names.
 */
public final class Handle {
    private final String name;
    private final HandleOrigin origin;
    private final Confidence confidence;
    private final String creatorName;
    private final JsNode declaration;
    private final boolean container;
    private final Map<String, Handle> containedHandles;

    public Handle(String name, HandleOrigin origin, Confidence confidence, String creatorName, JsNode declaration) {
        this(name, origin, confidence, creatorName, declaration, false, Collections.emptyMap());
    }

    private Handle(String name, HandleOrigin origin, Confidence confidence, String creatorName, JsNode declaration,
                   boolean container, Map<String, Handle> containedHandles) {
        this.name = name;
        this.origin = origin;
        this.confidence = confidence;
        this.creatorName = creatorName;
        this.declaration = declaration;
        this.container = container;
        this.containedHandles = containedHandles;
    }

    /**
     * A container binding; {@code contained} maps property names (or array indexes) to the handles they hold.
     */
    public static Handle container(String name, Confidence confidence, JsNode declaration,
                                   Map<String, Handle> contained) {
        return new Handle(name, HandleOrigin.PROPAGATED, confidence, null, declaration, true,
                Collections.unmodifiableMap(new LinkedHashMap<>(contained)));
    }

    /**
     * A new binding that aliases this handle.
     */
    public Handle propagateTo(String aliasName, JsNode aliasDeclaration) {
        return new Handle(aliasName, HandleOrigin.PROPAGATED, confidence, creatorName, aliasDeclaration,
                container, containedHandles);
    }

    public String getName() {
        return name;
    }

    public HandleOrigin getOrigin() {
        return origin;
    }

    public Confidence getConfidence() {
        return confidence;
    }

    public boolean isDefinite() {
        return confidence == Confidence.DEFINITE;
    }

    /**
     * Creator base name ({@code signal}, {@code computed}, ...), when known.
     */
    public String getCreatorName() {
        return creatorName;
    }

    /**
     * Identifier that declared the binding, or null for heuristic handles.
     */
    public JsNode getDeclaration() {
        return declaration;
    }

    public boolean isContainer() {
        return container;
    }

    public Map<String, Handle> getContainedHandles() {
        return containedHandles;
    }

    @Override
    public String toString() {
        return name + "(" + origin + ", " + confidence + (isContainer() ? ", container" : "") + ")";
    }
}

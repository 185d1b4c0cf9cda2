package com.signallint.plugins.react.fix;

import com.signallint.api.Edit;
import com.signallint.plugins.react.scope.Binding;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.Flag;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.LineIndex;
import com.signallint.plugins.react.tree.NodeKind;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Renames a binding at its declaration and at every reference the scope model resolved to it.
 * Only the name itself is replaced, so type annotations and defaults stay in place.
 */
public class ReferenceRewriter {
    private final LineIndex lineIndex;

    public ReferenceRewriter(LineIndex lineIndex) {
        this.lineIndex = lineIndex;
    }

    /**
     * Edits renaming a binding; {@code accessors} picks how each reference reads the new name.
     */
    public List<Edit> rename(Binding binding, String newName, Function<JsNode, AccessorForm> accessors,
                             String groupId) {
        List<Edit> edits = new ArrayList<>();
        edits.add(_replaceName(binding.getIdentifier(), newName, groupId));
        for (JsNode reference : binding.getReferences()) {
            edits.add(_replaceName(reference, accessors.apply(reference).render(newName), groupId));
        }
        return edits;
    }

    /**
     * Edit replacing one identifier's name, keeping shorthand properties and export names intact.
     */
    public Edit replaceReference(JsNode identifier, String replacement, String groupId) {
        return _replaceName(identifier, replacement, groupId);
    }

    private Edit _replaceName(JsNode identifier, String replacement, String groupId) {
        String oldName = identifier.name();
        int start = identifier.start();
        String text = replacement;

        JsNode parent = identifier.parent();
        if (parent != null && parent.kind() == NodeKind.ASSIGNMENT_PATTERN && identifier.parentField() == Field.LEFT) {
            parent = parent.parent();
        }
        if (parent != null && parent.kind() == NodeKind.PROPERTY && parent.has(Flag.SHORTHAND)) {
            text = oldName + ": " + replacement;
        } else if (parent != null && parent.kind() == NodeKind.EXPORT_SPECIFIER
                && identifier.parentField() == Field.LOCAL && _exportsUnderOwnName(parent)) {
            text = replacement + " as " + oldName;
        }
        return new Edit(lineIndex.range(start, start + oldName.length()), text, groupId);
    }

    private static boolean _exportsUnderOwnName(JsNode specifier) {
        JsNode local = specifier.child(Field.LOCAL);
        JsNode exported = specifier.child(Field.EXPORTED);
        return exported == null || exported.start() == local.start();
    }
}

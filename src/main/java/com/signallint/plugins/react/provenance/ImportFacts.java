package com.signallint.plugins.react.provenance;

import com.signallint.config.AnalysisOptions;
import com.signallint.plugins.react.traversal.Operation;
import com.signallint.plugins.react.traversal.OperationCounters;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Facts about a file's top-level imports, gathered before the main traversal so that
 * they do not depend on where in the file an import appears.
 */
public class ImportFacts {
    private final Map<String, String> importedModules = new HashMap<>();
    private final Map<String, String> creatorImports = new HashMap<>();
    private final Set<String> namespaceImports = new HashSet<>();

    /**
     * Scans the Program body's import declarations.
     */
    public static ImportFacts collect(JsNode program, AnalysisOptions options, OperationCounters counters) {
        ImportFacts facts = new ImportFacts();
        for (JsNode statement : program.children(Field.BODY)) {
            if (statement == null || statement.kind() != NodeKind.IMPORT_DECLARATION) {
                continue;
            }
            counters.increment(Operation.IMPORT_CHECK);
            String module = statement.child(Field.SOURCE).stringValue();
            for (JsNode specifier : statement.children(Field.SPECIFIERS)) {
                String local = specifier.child(Field.LOCAL).name();
                switch (specifier.kind()) {
                    case IMPORT_SPECIFIER:
                        String imported = importedName(specifier);
                        facts.importedModules.put(local, module);
                        if (options.getCreatorNames().contains(imported)
                                || options.getHookCreatorNames().contains(imported)) {
                            facts.addCreatorImport(local, imported);
                        }
                        break;
                    case IMPORT_NAMESPACE_SPECIFIER:
                        facts.importedModules.put(local, module);
                        if (options.getModules().contains(module)) {
                            facts.addNamespaceImport(local);
                        }
                        break;
                    default:
                        facts.importedModules.put(local, module);
                        break;
                }
            }
        }
        return facts;
    }

    /**
     * Exported name of an import specifier; string-named imports ({@code import { "a-b" as x }}) included.
     */
    public static String importedName(JsNode specifier) {
        JsNode imported = specifier.child(Field.IMPORTED);
        if (imported == null) {
            return specifier.child(Field.LOCAL).name();
        }
        return imported.kind() == NodeKind.LITERAL ? imported.stringValue() : imported.name();
    }

    void addCreatorImport(String localName, String importedName) {
        creatorImports.put(localName, importedName);
    }

    void addNamespaceImport(String localName) {
        namespaceImports.add(localName);
    }

    /**
     * Creator name a local binding was imported as, or null.
     */
    public String creatorImportedAs(String localName) {
        return creatorImports.get(localName);
    }

    public boolean isSignalNamespace(String localName) {
        return namespaceImports.contains(localName);
    }

    public boolean hasCreatorImport() {
        return !creatorImports.isEmpty() || !namespaceImports.isEmpty();
    }

    public String moduleOf(String localName) {
        return importedModules.get(localName);
    }
}

package com.signallint.plugins.react.rules;

import com.signallint.plugins.react.policy.Policy;

import java.util.List;

/**
 * Every check the linter knows.
 */
public final class RuleCatalog {

    private RuleCatalog() {
    }

    public static List<Policy> createAll() {
        return List.of(
                new NoMutationInRenderRule(),
                new NoSignalCreationInComponentRule(),
                new PreferSignalMethodsRule(),
                new PreferSignalInJsxRule(),
                new WarnOnUnnecessaryUntrackedRule(),
                new SignalVariableNameRule(),
                new ForbidSignalReAssignmentRule(),
                new ForbidSignalDestructuringRule(),
                new NoSignalAssignmentInEffectRule(),
                new NoNonSignalWithSignalSuffixRule(),
                new PreferUseSignalOverUseStateRule(),
                new ForbidSignalUpdateInComputedRule(),
                new RequireUseSignalsRule(),
                new RestrictSignalLocationsRule());
    }
}

package com.signallint.plugins.react;

import com.signallint.api.AppliedFix;
import com.signallint.api.Diagnostic;
import com.signallint.api.DiagnosticSink;
import com.signallint.api.Fix;
import com.signallint.api.LintResult;
import com.signallint.api.error.BudgetExceededException;
import com.signallint.api.error.Finding;
import com.signallint.config.AnalysisOptions;
import com.signallint.plugins.react.context.ContextStack;
import com.signallint.plugins.react.context.FrameClassifier;
import com.signallint.plugins.react.fix.EditSet;
import com.signallint.plugins.react.fix.FixComposer;
import com.signallint.plugins.react.fix.FixContext;
import com.signallint.plugins.react.fix.FixSafety;
import com.signallint.plugins.react.policy.Candidate;
import com.signallint.plugins.react.policy.MessageTemplates;
import com.signallint.plugins.react.policy.Policy;
import com.signallint.plugins.react.policy.PolicyContext;
import com.signallint.plugins.react.policy.PolicyEvaluator;
import com.signallint.plugins.react.provenance.Handle;
import com.signallint.plugins.react.provenance.ImportFacts;
import com.signallint.plugins.react.provenance.ProvenanceTracker;
import com.signallint.plugins.react.scope.ScopeResolver;
import com.signallint.plugins.react.traversal.NodeBudget;
import com.signallint.plugins.react.traversal.NodeVisitor;
import com.signallint.plugins.react.traversal.Operation;
import com.signallint.plugins.react.traversal.OperationCounters;
import com.signallint.plugins.react.traversal.TraversalDriver;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.Flag;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;
import com.signallint.util.LoggerUtil;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * One analysis of one parsed file. Every piece of mutable state (provenance, context stack, candidates,
 * counters and budget) belongs to the run, so concurrent runs never share anything but the options.
 * <p>
 * A single traversal feeds the context stack, the policies and the provenance tracker, in that order,
 * so a policy sees the context of the node it inspects and the provenance recorded before it.
 */
public class AnalysisRun implements NodeVisitor {
    private static final Logger logger = LoggerUtil.getLogger(AnalysisRun.class);

    private final JsAst ast;
    private final String filePath;
    private final OperationCounters counters = new OperationCounters();
    private final NodeBudget budget;
    private final ContextStack contextStack;
    private final ProvenanceTracker provenance;
    private final PolicyEvaluator evaluator;
    private final FixContext fixContext;
    private boolean aborted;

    public AnalysisRun(JsAst ast, String filePath, AnalysisOptions options, List<Policy> policies) {
        this.ast = ast;
        this.filePath = filePath;
        this.budget = options.newBudget();
        this.contextStack = new ContextStack(new FrameClassifier(options), counters);
        this.provenance = new ProvenanceTracker(options, ImportFacts.collect(ast.getRoot(), options, counters),
                counters);
        PolicyContext policyContext = new PolicyContext(provenance, contextStack, options, ast, filePath);
        this.evaluator = new PolicyEvaluator(policies, policyContext, counters);
        this.fixContext = new FixContext(ast, provenance, contextStack, options,
                new ScopeResolver(ast.getRoot(), counters), new FixSafety(counters));
    }

    /**
     * Traverses the file, then reports accepted findings to the sink in source order.
     *
     * @throws com.signallint.api.error.InternalFaultException when the analysis state becomes inconsistent
     */
    public LintResult execute(DiagnosticSink sink) {
        budget.start();
        try {
            TraversalDriver.traverse(ast.getRoot(), this);
        } catch (BudgetExceededException e) {
            aborted = true;
            counters.increment(Operation.NODE_BUDGET_EXCEEDED);
            logger.fine("Budget exceeded in " + filePath + " (" + e.getLimit() + "): " + e.getMessage()
                    + "; counters " + counters);
        }
        return _finish(sink);
    }

    private LintResult _finish(DiagnosticSink sink) {
        List<Candidate> accepted = evaluator.accept();
        accepted.sort(Comparator.comparingInt((Candidate c) -> c.getFinding().getLocation().getStart())
                .thenComparingInt(c -> c.getFinding().getLocation().getEnd()));

        FixComposer composer = new FixComposer(fixContext, counters);
        List<Diagnostic> diagnostics = new ArrayList<>();
        List<AppliedFix> appliedFixes = new ArrayList<>();
        for (Candidate candidate : accepted) {
            Finding finding = candidate.getFinding();
            Fix fix = aborted ? Fix.none() : composer.compose(candidate);
            String message = MessageTemplates.render(candidate.getKind().getTemplate(), finding.getParams());
            diagnostics.add(new Diagnostic(finding, message, fix));
            if (fix.isPrimary()) {
                appliedFixes.add(new AppliedFix(finding.getRuleId(), finding.getKind(), finding.getLine(),
                        fix.getDescription()));
            }
        }
        diagnostics.forEach(sink::report);

        String fixedCode = aborted || composer.getEditSet().isEmpty()
                ? ast.getSourceCode()
                : EditSet.apply(ast.getSourceCode(), composer.getEditSet().getEdits());

        return LintResult.builder()
                .diagnostics(diagnostics)
                .appliedFixes(appliedFixes)
                .fixedCode(fixedCode)
                .budgetExceeded(aborted)
                .counters(counters.snapshot())
                .successFromDiagnostics()
                .build();
    }

    @Override
    public void enter(JsNode node) {
        budget.tick();
        counters.increment(Operation.NODE_PROCESSED);
        contextStack.enter(node);
        evaluator.enter(node);
        _recordProvenance(node);
    }

    @Override
    public void exit(JsNode node) {
        evaluator.exit(node);
        contextStack.exit(node);
    }

    private void _recordProvenance(JsNode node) {
        switch (node.kind()) {
            case VARIABLE_DECLARATOR: {
                JsNode id = node.child(Field.ID);
                JsNode init = node.child(Field.INIT);
                if (id == null || init == null) {
                    return;
                }
                if (id.kind() == NodeKind.IDENTIFIER) {
                    provenance.recordDeclaration(id.name(), init, node);
                } else {
                    _recordPattern(id, init, node);
                }
                break;
            }
            case ASSIGNMENT_EXPRESSION: {
                JsNode left = node.child(Field.LEFT).unwrap();
                if ("=".equals(node.operator()) && left.kind() == NodeKind.IDENTIFIER) {
                    provenance.recordAlias(left.name(), node.child(Field.RIGHT), node);
                }
                break;
            }
            case ASSIGNMENT_PATTERN: {
                JsNode left = node.child(Field.LEFT);
                if (left != null && left.kind() == NodeKind.IDENTIFIER) {
                    provenance.recordAlias(left.name(), node.child(Field.RIGHT), node);
                }
                break;
            }
            default:
                break;
        }
    }

    /**
     * Hands each name destructured from a container handle the handle stored under its key.
     */
    private void _recordPattern(JsNode pattern, JsNode init, JsNode declaration) {
        JsNode source = init.unwrap();
        if (source.kind() != NodeKind.IDENTIFIER) {
            return;
        }
        Optional<Handle> container = provenance.recordedHandle(source.name());
        if (container.isEmpty() || !container.get().isContainer()) {
            return;
        }

        if (pattern.kind() == NodeKind.OBJECT_PATTERN) {
            for (JsNode property : pattern.children(Field.PROPERTIES)) {
                if (property == null || property.kind() != NodeKind.PROPERTY || property.has(Flag.COMPUTED)) {
                    continue;
                }
                JsNode key = property.child(Field.KEY);
                String name = _boundName(property.child(Field.VALUE));
                if (key != null && key.kind() == NodeKind.IDENTIFIER && name != null) {
                    provenance.recordDestructured(name, container.get(), key.name(), declaration);
                }
            }
        } else if (pattern.kind() == NodeKind.ARRAY_PATTERN) {
            List<JsNode> elements = pattern.children(Field.ELEMENTS);
            for (int i = 0; i < elements.size(); i++) {
                String name = _boundName(elements.get(i));
                if (name != null) {
                    provenance.recordDestructured(name, container.get(), String.valueOf(i), declaration);
                }
            }
        }
    }

    private static String _boundName(JsNode target) {
        if (target == null) {
            return null;
        }
        if (target.kind() == NodeKind.ASSIGNMENT_PATTERN) {
            target = target.child(Field.LEFT);
        }
        return target != null && target.kind() == NodeKind.IDENTIFIER ? target.name() : null;
    }

    public OperationCounters getCounters() {
        return counters;
    }
}

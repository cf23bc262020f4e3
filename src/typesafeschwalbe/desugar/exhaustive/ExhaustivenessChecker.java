package typesafeschwalbe.desugar.exhaustive;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import typesafeschwalbe.desugar.Constants;
import typesafeschwalbe.desugar.Error;
import typesafeschwalbe.desugar.Source;
import typesafeschwalbe.desugar.ast.AstNode;
import typesafeschwalbe.desugar.ast.Binder;
import typesafeschwalbe.desugar.ast.CaseAlternative;
import typesafeschwalbe.desugar.ast.Module;
import typesafeschwalbe.desugar.ast.ModuleName;
import typesafeschwalbe.desugar.ast.QualifiedName;
import typesafeschwalbe.desugar.ast.TypeNode;

public class ExhaustivenessChecker {

    public static record Options(
        int uncoveredLimit,
        int exampleLimit
    ) {

        public static final Options DEFAULT = new Options(10000, 5);

        public Options {
            if(uncoveredLimit < 1 || exampleLimit < 0) {
                throw new IllegalArgumentException(
                    "Invalid exhaustiveness check limits!"
                );
            }
        }

    }

    public static Error makeNotExhaustiveError(
        Source location, List<List<Binder>> examples, boolean more
    ) {
        return new Error(
            Error.Kind.NOT_EXHAUSTIVE_PATTERN,
            "A case expression could not be determined to cover all inputs."
                + " The following inputs are not handled:",
            location
        ).withExamples(examples, more);
    }

    public static Error makeOverlappingPatternError(
        Source location, List<List<Binder>> examples, boolean more
    ) {
        return new Error(
            Error.Kind.OVERLAPPING_PATTERN,
            "A case expression contains unreachable cases:",
            location
        ).withExamples(examples, more);
    }

    public static Error makeIncompleteCheckError(Source location) {
        return new Error(
            Error.Kind.INCOMPLETE_EXHAUSTIVITY_CHECK,
            "An exhaustivity check was abandoned due to too many possible"
                + " cases. You may want to decompose your data types into"
                + " smaller types.",
            location
        );
    }

    private static final Logger LOGGER
        = LoggerFactory.getLogger(ExhaustivenessChecker.class);

    private final Environment env;
    private final Options options;

    public ExhaustivenessChecker(Environment env, Options options) {
        this.env = env;
        this.options = options;
    }

    public ExhaustivenessChecker(Environment env) {
        this(env, Options.DEFAULT);
    }

    public List<Error> checkModule(Module module) {
        List<Error> warnings = new ArrayList<>();
        MissingCases cases = new MissingCases(this.env, module.name());
        this.checkDeclarations(
            module.declarations(), module.name(), cases,
            List.of(Error.Hint.inModule(module.name())), warnings
        );
        LOGGER.debug(
            "Checked pattern matches of module {} ({} advisories)",
            module.name(), warnings.size()
        );
        return warnings;
    }

    private void checkDeclarations(
        List<AstNode> declarations, ModuleName moduleName,
        MissingCases cases, List<Error.Hint> hints, List<Error> warnings
    ) {
        Map<String, TypeNode> signatures = new HashMap<>();
        for(AstNode declaration: declarations) {
            if(declaration.type == AstNode.Type.TYPE_DECLARATION) {
                AstNode.TypeDeclaration data = declaration.getValue();
                signatures.put(data.name(), data.type());
            }
        }
        for(AstNode declaration: declarations) {
            this.checkDeclaration(
                declaration, signatures, moduleName, cases, hints, warnings
            );
        }
    }

    private void checkDeclaration(
        AstNode declaration, Map<String, TypeNode> signatures,
        ModuleName moduleName, MissingCases cases, List<Error.Hint> hints,
        List<Error> warnings
    ) {
        switch(declaration.type) {
            case VALUE_DECLARATION: {
                AstNode.ValueDeclaration data = declaration.getValue();
                List<Error.Hint> valueHints = new ArrayList<>(hints);
                valueHints.add(Error.Hint.inValueDeclaration(data.name()));
                if(declaration.source != null) {
                    valueHints.add(Error.Hint.atPosition(declaration.source));
                }
                TypeNode signature = signatures.get(data.name());
                boolean partial = signature != null
                    && this.hasPartialConstraint(signature, moduleName);
                this.checkNode(
                    data.value(), partial, moduleName, cases, valueHints,
                    warnings
                );
                return;
            }
            case BINDING_GROUP: {
                List<AstNode> members = declaration.getValue();
                for(AstNode member: members) {
                    this.checkDeclaration(
                        member, signatures, moduleName, cases, hints, warnings
                    );
                }
                return;
            }
            default:
                return;
        }
    }

    private void checkNode(
        AstNode node, boolean partial, ModuleName moduleName,
        MissingCases cases, List<Error.Hint> hints, List<Error> warnings
    ) {
        switch(node.type) {
            case LET: {
                AstNode.Let data = node.getValue();
                this.checkDeclarations(
                    data.declarations(), moduleName, cases, hints, warnings
                );
                this.checkNode(
                    data.body(), partial, moduleName, cases, hints, warnings
                );
                return;
            }
            case TYPED: {
                AstNode.Typed data = node.getValue();
                boolean typedPartial = partial
                    || this.hasPartialConstraint(data.type(), moduleName);
                this.checkNode(
                    data.value(), typedPartial, moduleName, cases, hints,
                    warnings
                );
                return;
            }
            case CASE: {
                this.checkCase(node, partial, cases, hints, warnings);
                break;
            }
            default:
                break;
        }
        node.mapChildren(
            child -> {
                this.checkNode(
                    child, partial, moduleName, cases, hints, warnings
                );
                return child;
            },
            binder -> binder
        );
    }

    private void checkCase(
        AstNode node, boolean partial, MissingCases cases,
        List<Error.Hint> hints, List<Error> warnings
    ) {
        AstNode.Case data = node.getValue();
        List<List<Binder>> uncovered = List.of(
            Binder.wildcards(data.scrutinees().size())
        );
        boolean incomplete = false;
        List<List<Binder>> redundant = new ArrayList<>();
        for(CaseAlternative alternative: data.alternatives()) {
            boolean retires = ExhaustivenessChecker.isExhaustive(alternative);
            Set<List<Binder>> next = new LinkedHashSet<>();
            List<Coverage> verdicts = new ArrayList<>(uncovered.size());
            for(List<Binder> row: uncovered) {
                MissingCases.Multiple result = cases.multiple(
                    row, alternative.binders()
                );
                verdicts.add(result.coverage());
                if(retires) {
                    next.addAll(result.missing());
                } else {
                    next.add(row);
                }
            }
            if(!incomplete
                && Coverage.any(verdicts) == Coverage.NOT_COVERED) {
                redundant.add(alternative.binders());
            }
            uncovered = new ArrayList<>(next);
            if(uncovered.size() > this.options.uncoveredLimit()) {
                LOGGER.debug(
                    "Uncovered set of case at {} truncated from {} to {}",
                    node.source, uncovered.size(),
                    this.options.uncoveredLimit()
                );
                uncovered = uncovered.subList(
                    0, this.options.uncoveredLimit()
                );
                incomplete = true;
            }
        }
        if(!uncovered.isEmpty() && !partial) {
            warnings.add(ExhaustivenessChecker.makeNotExhaustiveError(
                node.source, this.examples(uncovered),
                uncovered.size() > this.options.exampleLimit()
            ).withHints(hints));
        }
        if(!redundant.isEmpty()) {
            warnings.add(ExhaustivenessChecker.makeOverlappingPatternError(
                node.source, this.examples(redundant),
                redundant.size() > this.options.exampleLimit()
            ).withHints(hints));
        }
        if(incomplete && !partial) {
            warnings.add(ExhaustivenessChecker
                .makeIncompleteCheckError(node.source)
                .withHints(hints));
        }
    }

    private List<List<Binder>> examples(List<List<Binder>> rows) {
        int count = Math.min(rows.size(), this.options.exampleLimit());
        return List.copyOf(rows.subList(0, count));
    }

    private static boolean isExhaustive(CaseAlternative alternative) {
        if(!alternative.isGuarded()) { return true; }
        for(CaseAlternative.Guarded branch: alternative.guarded()) {
            if(ExhaustivenessChecker.isUnconditional(branch.guard())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isUnconditional(AstNode guard) {
        switch(guard.type) {
            case BOOLEAN_LITERAL:
                return guard.<Boolean>getValue();
            case VARIABLE: {
                QualifiedName name = guard.getValue();
                return name.equals(Constants.PRELUDE_OTHERWISE)
                    || name.equals(Constants.DATA_BOOLEAN_OTHERWISE);
            }
            case TYPED:
                return ExhaustivenessChecker.isUnconditional(
                    guard.<AstNode.Typed>getValue().value()
                );
            case PARENS:
                return ExhaustivenessChecker.isUnconditional(
                    guard.<AstNode.MonoOp>getValue().value()
                );
            default:
                return false;
        }
    }

    private boolean hasPartialConstraint(TypeNode type, ModuleName moduleName) {
        switch(type.type) {
            case FOR_ALL:
                return this.hasPartialConstraint(
                    type.<TypeNode.ForAll>getValue().type(), moduleName
                );
            case CONSTRAINED: {
                TypeNode.Constrained data = type.getValue();
                for(TypeNode.Constraint constraint: data.constraints()) {
                    QualifiedName className = constraint.className()
                        .qualify(moduleName);
                    if(this.isPartialClass(className, new HashSet<>())) {
                        return true;
                    }
                }
                return this.hasPartialConstraint(data.type(), moduleName);
            }
            default:
                return false;
        }
    }

    // only classes without type arguments pass on their superclasses
    private boolean isPartialClass(
        QualifiedName className, Set<QualifiedName> visited
    ) {
        if(className.equals(Constants.PARTIAL)) { return true; }
        if(!visited.add(className)) { return false; }
        Environment.TypeClass typeClass = this.env.typeClass(className)
            .orElse(null);
        if(typeClass == null || !typeClass.arguments().isEmpty()) {
            return false;
        }
        for(TypeNode.Constraint superclass: typeClass.superclasses()) {
            QualifiedName superName = superclass.className().qualify(
                className.module().orElseThrow()
            );
            if(this.isPartialClass(superName, visited)) { return true; }
        }
        return false;
    }

}

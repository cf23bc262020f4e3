package typesafeschwalbe.desugar;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import typesafeschwalbe.desugar.ast.Module;
import typesafeschwalbe.desugar.exhaustive.Environment;
import typesafeschwalbe.desugar.exhaustive.ExhaustivenessChecker;
import typesafeschwalbe.desugar.externs.ExternsFile;
import typesafeschwalbe.desugar.operators.AliasResolver;
import typesafeschwalbe.desugar.operators.FixityTableBuilder;
import typesafeschwalbe.desugar.operators.OperatorSections;
import typesafeschwalbe.desugar.operators.OperatorTable;
import typesafeschwalbe.desugar.operators.Rebracketer;
import typesafeschwalbe.desugar.operators.SignedLiterals;

public class Compiler {

    private static final Logger LOGGER = LoggerFactory.getLogger(Compiler.class);

    public static Result<OperatorTable> buildOperatorTable(
        List<ExternsFile> externs, List<Module> modules
    ) {
        FixityTableBuilder builder = new FixityTableBuilder();
        for(ExternsFile file: externs) {
            builder.addExterns(file);
        }
        for(Module module: modules) {
            builder.addModule(module);
        }
        try {
            return Result.ofValue(builder.build());
        } catch(ErrorException e) {
            return Result.ofError(e.error);
        }
    }

    public static Result<List<Module>> rebracket(
        List<ExternsFile> externs, List<Module> modules
    ) {
        Result<OperatorTable> table = Compiler.buildOperatorTable(
            externs, modules
        );
        if(table.isError()) {
            return Result.ofError(table.getError());
        }
        Rebracketer rebracketer = new Rebracketer(table.getValue());
        AliasResolver resolver = new AliasResolver(table.getValue());
        List<Module> rewritten = new ArrayList<>(modules.size());
        List<Error> errors = new ArrayList<>();
        for(Module module: modules) {
            Result<Module> result = Compiler.rebracketModule(
                rebracketer, resolver, module
            );
            if(result.isError()) {
                errors.addAll(result.getError());
            } else {
                rewritten.add(result.getValue());
            }
        }
        if(!errors.isEmpty()) {
            return Result.ofError(errors);
        }
        return Result.ofValue(rewritten);
    }

    private static Result<Module> rebracketModule(
        Rebracketer rebracketer, AliasResolver resolver, Module module
    ) {
        try {
            return Result.ofValue(
                resolver.resolve(rebracketer.rebracket(module))
            );
        } catch(ErrorException e) {
            LOGGER.warn(
                "Operators of module {} could not be desugared: {}",
                module.name(), e.getMessage()
            );
            return Result.ofError(
                e.withHint(Error.Hint.inModule(module.name())).error
            );
        }
    }

    public static Module removeSignedLiterals(Module module) {
        return SignedLiterals.remove(module);
    }

    public static Module desugarOperatorSections(
        Module module, NameSupply names
    ) {
        return new OperatorSections(names).desugar(module);
    }

    public static List<Error> checkExhaustive(Environment env, Module module) {
        return new ExhaustivenessChecker(env).checkModule(module);
    }

    // one result per module, in order; a failing module does not stop the others
    public static List<Result<Module>> desugarModules(
        OperatorTable table, List<Module> modules,
        Environment env, NameSupply names
    ) {
        Rebracketer rebracketer = new Rebracketer(table);
        AliasResolver resolver = new AliasResolver(table);
        OperatorSections sections = new OperatorSections(names);
        ExhaustivenessChecker checker = new ExhaustivenessChecker(env);
        List<Result<Module>> results = new ArrayList<>(modules.size());
        for(Module module: modules) {
            Result<Module> rebracketed = Compiler.rebracketModule(
                rebracketer, resolver, Compiler.removeSignedLiterals(module)
            );
            if(rebracketed.isError()) {
                results.add(rebracketed);
                continue;
            }
            Module sectionless = sections.desugar(rebracketed.getValue());
            results.add(Result.ofValue(
                sectionless, checker.checkModule(sectionless)
            ));
        }
        return results;
    }

    public static Result<List<Module>> desugar(
        List<ExternsFile> externs, List<Module> modules,
        Environment env, NameSupply names
    ) {
        Result<OperatorTable> table = Compiler.buildOperatorTable(
            externs, modules
        );
        if(table.isError()) {
            return Result.ofError(table.getError());
        }
        List<Module> desugared = new ArrayList<>(modules.size());
        List<Error> errors = new ArrayList<>();
        List<Error> warnings = new ArrayList<>();
        for(Result<Module> result: Compiler.desugarModules(
            table.getValue(), modules, env, names
        )) {
            warnings.addAll(result.getWarnings());
            if(result.isError()) {
                errors.addAll(result.getError());
            } else {
                desugared.add(result.getValue());
            }
        }
        LOGGER.debug(
            "Desugared {} of {} modules with {} advisories",
            desugared.size(), modules.size(), warnings.size()
        );
        if(!errors.isEmpty()) {
            return Result.ofError(errors, warnings);
        }
        return Result.ofValue(desugared, warnings);
    }

}

package typesafeschwalbe.desugar.operators;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import typesafeschwalbe.desugar.Error;
import typesafeschwalbe.desugar.ErrorException;
import typesafeschwalbe.desugar.Source;
import typesafeschwalbe.desugar.ast.AstNode;
import typesafeschwalbe.desugar.ast.Fixity;
import typesafeschwalbe.desugar.ast.FixityAlias;
import typesafeschwalbe.desugar.ast.Module;
import typesafeschwalbe.desugar.ast.ModuleName;
import typesafeschwalbe.desugar.ast.QualifiedName;
import typesafeschwalbe.desugar.externs.ExternsAlias;
import typesafeschwalbe.desugar.externs.ExternsFile;
import typesafeschwalbe.desugar.externs.ExternsFixity;

public class FixityTableBuilder {

    private static final Logger LOGGER
        = LoggerFactory.getLogger(FixityTableBuilder.class);

    static Error makeMultipleFixitiesError(
        QualifiedName operator, Source duplicateSource
    ) {
        return new Error(
            Error.Kind.MULTIPLE_FIXITIES,
            "Multiple fixity declarations for operator "
                + operator.name(),
            duplicateSource
        );
    }

    private final List<FixityRecord> records;
    private int importedCount;

    public FixityTableBuilder() {
        this.records = new ArrayList<>();
        this.importedCount = 0;
    }

    public FixityTableBuilder addExterns(ExternsFile externs) {
        List<FixityRecord> imported = FixityTableBuilder
            .externsFixities(externs);
        this.records.addAll(imported);
        this.importedCount += imported.size();
        return this;
    }

    public FixityTableBuilder addModule(Module module) {
        this.records.addAll(FixityTableBuilder.collectFixities(module));
        return this;
    }

    public List<FixityRecord> records() {
        return List.copyOf(this.records);
    }

    public OperatorTable build() throws ErrorException {
        FixityTableBuilder.ensureNoDuplicates(this.records);
        OperatorTable table = new OperatorTable(this.records);
        LOGGER.debug(
            "Built operator table from {} fixities ({} imported)"
                + " in {} precedence groups",
            this.records.size(), this.importedCount, table.groups().size()
        );
        return table;
    }

    public static List<FixityRecord> externsFixities(ExternsFile externs) {
        ModuleName moduleName = ModuleName.of(externs.moduleName);
        Source source = Source.internal(externs.moduleName);
        List<FixityRecord> records = new ArrayList<>();
        for(ExternsFixity fixity: externs.fixities) {
            Optional<FixityAlias> alias = Optional.empty();
            if(fixity.alias != null) {
                alias = Optional.of(
                    FixityTableBuilder.externsAlias(fixity.alias)
                );
            }
            records.add(new FixityRecord(
                new QualifiedName(moduleName, fixity.operator),
                source,
                new Fixity(
                    Fixity.Associativity.fromKeyword(fixity.associativity),
                    fixity.precedence
                ),
                alias
            ));
        }
        return records;
    }

    private static FixityAlias externsAlias(ExternsAlias alias) {
        QualifiedName target = new QualifiedName(
            ModuleName.of(alias.module), alias.name
        );
        return new FixityAlias(
            FixityAlias.Kind.valueOf(alias.kind.toUpperCase()), target
        );
    }

    public static List<FixityRecord> collectFixities(Module module) {
        List<FixityRecord> records = new ArrayList<>();
        for(AstNode declaration: module.declarations()) {
            if(declaration.type != AstNode.Type.FIXITY_DECLARATION) {
                continue;
            }
            if(declaration.source == null) {
                throw new IllegalStateException(
                    "Fixity declaration in module " + module.name()
                        + " has no source position!"
                );
            }
            AstNode.FixityDeclaration data = declaration.getValue();
            records.add(new FixityRecord(
                new QualifiedName(module.name(), data.operator()),
                declaration.source,
                data.fixity(),
                data.alias().map(a -> a.qualify(module.name()))
            ));
        }
        return records;
    }

    public static void ensureNoDuplicates(
        List<FixityRecord> records
    ) throws ErrorException {
        List<FixityRecord> sorted = new ArrayList<>(records);
        // stable, so equal names keep their original order
        sorted.sort(Comparator.comparing(FixityRecord::operator));
        for(int recordI = 1; recordI < sorted.size(); recordI += 1) {
            FixityRecord previous = sorted.get(recordI - 1);
            FixityRecord current = sorted.get(recordI);
            if(!previous.operator().equals(current.operator())) {
                continue;
            }
            Error error = FixityTableBuilder.makeMultipleFixitiesError(
                current.operator(), current.source()
            );
            if(current.operator().module().isPresent()) {
                error = error.withHint(Error.Hint.inModule(
                    current.operator().module().get()
                ));
            }
            throw new ErrorException(error);
        }
    }

}

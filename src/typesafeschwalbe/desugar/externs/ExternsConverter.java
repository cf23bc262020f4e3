package typesafeschwalbe.desugar.externs;

import java.util.ArrayList;

import typesafeschwalbe.desugar.ast.FixityAlias;
import typesafeschwalbe.desugar.ast.Module;
import typesafeschwalbe.desugar.operators.FixityRecord;
import typesafeschwalbe.desugar.operators.FixityTableBuilder;

public final class ExternsConverter {

    private ExternsConverter() {}

    public static ExternsFile fromModule(Module module) {
        ExternsFile externs = new ExternsFile();
        externs.moduleName = module.name().toString();
        externs.fixities = new ArrayList<>();
        for(FixityRecord record: FixityTableBuilder.collectFixities(module)) {
            ExternsFixity fixity = new ExternsFixity();
            fixity.associativity = record.fixity().associativity().keyword;
            fixity.precedence = record.fixity().precedence();
            fixity.operator = record.operator().name();
            if(record.alias().isPresent()) {
                fixity.alias = ExternsConverter.aliasToDTO(
                    record.alias().get()
                );
            }
            externs.fixities.add(fixity);
        }
        return externs;
    }

    private static ExternsAlias aliasToDTO(FixityAlias alias) {
        ExternsAlias dto = new ExternsAlias();
        dto.kind = alias.kind().name().toLowerCase();
        dto.module = alias.target().module().get().toString();
        dto.name = alias.target().name();
        return dto;
    }

}

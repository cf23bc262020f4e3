package typesafeschwalbe.desugar.operators;

import java.util.Optional;

import typesafeschwalbe.desugar.Source;
import typesafeschwalbe.desugar.ast.Fixity;
import typesafeschwalbe.desugar.ast.FixityAlias;
import typesafeschwalbe.desugar.ast.QualifiedName;

public record FixityRecord(
    QualifiedName operator,
    Source source,
    Fixity fixity,
    Optional<FixityAlias> alias
) {}

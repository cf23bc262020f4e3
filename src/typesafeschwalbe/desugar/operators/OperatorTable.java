package typesafeschwalbe.desugar.operators;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import typesafeschwalbe.desugar.ast.Fixity;
import typesafeschwalbe.desugar.ast.FixityAlias;
import typesafeschwalbe.desugar.ast.QualifiedName;

public class OperatorTable {

    public static record Entry(
        QualifiedName operator,
        Fixity.Associativity associativity
    ) {}

    private final List<List<Entry>> groups;
    private final Map<QualifiedName, Fixity> fixities;
    private final Map<QualifiedName, FixityAlias> aliases;

    // records must already be free of duplicates
    OperatorTable(List<FixityRecord> records) {
        this.fixities = new HashMap<>();
        this.aliases = new HashMap<>();
        for(FixityRecord record: records) {
            this.fixities.put(record.operator(), record.fixity());
            if(record.alias().isPresent()) {
                this.aliases.put(record.operator(), record.alias().get());
            }
        }
        List<FixityRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparingInt(
            (FixityRecord r) -> r.fixity().precedence()
        ).reversed());
        this.groups = new ArrayList<>();
        List<Entry> group = null;
        int groupPrecedence = 0;
        for(FixityRecord record: sorted) {
            int precedence = record.fixity().precedence();
            if(group == null || precedence != groupPrecedence) {
                group = new ArrayList<>();
                groupPrecedence = precedence;
                this.groups.add(group);
            }
            group.add(new Entry(
                record.operator(), record.fixity().associativity()
            ));
        }
    }

    public List<List<Entry>> groups() {
        return this.groups.stream().map(List::copyOf).toList();
    }

    public Optional<Fixity> fixityOf(QualifiedName operator) {
        return Optional.ofNullable(this.fixities.get(operator));
    }

    public Fixity fixityOrDefault(QualifiedName operator) {
        return this.fixityOf(operator).orElse(Fixity.DEFAULT);
    }

    public Optional<FixityAlias> aliasOf(QualifiedName operator) {
        return Optional.ofNullable(this.aliases.get(operator));
    }

}

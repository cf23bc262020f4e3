package typesafeschwalbe.desugar.ast;

import java.util.Comparator;
import java.util.Optional;

public record QualifiedName(Optional<ModuleName> module, String name)
        implements Comparable<QualifiedName> {

    private static final Comparator<QualifiedName> ORDER = Comparator
        .comparing((QualifiedName n) -> n.module
            .map(ModuleName::toString).orElse(""))
        .thenComparing(QualifiedName::name);

    public QualifiedName(ModuleName module, String name) {
        this(Optional.of(module), name);
    }

    public static QualifiedName unqualified(String name) {
        return new QualifiedName(Optional.empty(), name);
    }

    public QualifiedName qualify(ModuleName defaultModule) {
        if(this.module.isPresent()) { return this; }
        return new QualifiedName(defaultModule, this.name);
    }

    public boolean isOperator() {
        if(this.name.isEmpty()) { return false; }
        char first = this.name.charAt(0);
        return !Character.isLetter(first) && first != '_' && first != '$';
    }

    @Override
    public int compareTo(QualifiedName other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        String shown = this.isOperator()? "(" + this.name + ")" : this.name;
        if(this.module.isEmpty()) { return shown; }
        return this.module.get() + "." + shown;
    }

}

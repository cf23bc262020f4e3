package typesafeschwalbe.desugar.ast;

public record FixityAlias(Kind kind, QualifiedName target) {

    public enum Kind {
        VALUE,
        CONSTRUCTOR
    }

    public static FixityAlias value(QualifiedName target) {
        return new FixityAlias(Kind.VALUE, target);
    }

    public static FixityAlias constructor(QualifiedName target) {
        return new FixityAlias(Kind.CONSTRUCTOR, target);
    }

    public FixityAlias qualify(ModuleName defaultModule) {
        return new FixityAlias(this.kind, this.target.qualify(defaultModule));
    }

}

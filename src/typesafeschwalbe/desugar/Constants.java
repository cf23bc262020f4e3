package typesafeschwalbe.desugar;

import typesafeschwalbe.desugar.ast.ModuleName;
import typesafeschwalbe.desugar.ast.QualifiedName;

public final class Constants {

    public static final ModuleName PRELUDE = ModuleName.of("Prelude");
    public static final ModuleName DATA_BOOLEAN = ModuleName.of("Data.Boolean");
    public static final ModuleName PRIM = ModuleName.of("Prim");

    public static final QualifiedName NEGATE
        = new QualifiedName(PRELUDE, "negate");
    public static final QualifiedName PRELUDE_OTHERWISE
        = new QualifiedName(PRELUDE, "otherwise");
    public static final QualifiedName DATA_BOOLEAN_OTHERWISE
        = new QualifiedName(DATA_BOOLEAN, "otherwise");
    public static final QualifiedName PARTIAL
        = new QualifiedName(PRIM, "Partial");

    private Constants() {}

}

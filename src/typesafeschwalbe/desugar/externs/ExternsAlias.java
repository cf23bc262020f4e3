package typesafeschwalbe.desugar.externs;

public class ExternsAlias {

    public String kind;
    public String module;
    public String name;

}

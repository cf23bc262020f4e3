package typesafeschwalbe.desugar.externs;

public class ExternsFixity {

    public String associativity;
    public Integer precedence;
    public String operator;
    public ExternsAlias alias;

}

package typesafeschwalbe.desugar.externs;

import java.util.List;

public class ExternsFile {

    public String moduleName;
    public List<ExternsFixity> fixities;

}

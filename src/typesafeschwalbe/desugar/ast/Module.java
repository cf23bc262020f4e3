package typesafeschwalbe.desugar.ast;

import java.util.ArrayList;
import java.util.List;

import typesafeschwalbe.desugar.Source;

public record Module(
    ModuleName name,
    List<AstNode> declarations,
    Source source
) {

    public Module {
        declarations = List.copyOf(declarations);
    }

    public <E extends Exception> Module mapDeclarations(
        Rewrite<AstNode, E> f
    ) throws E {
        List<AstNode> mapped = new ArrayList<>(this.declarations.size());
        for(AstNode declaration: this.declarations) {
            mapped.add(f.apply(declaration));
        }
        return new Module(this.name, mapped, this.source);
    }

}

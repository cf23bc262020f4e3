package typesafeschwalbe.desugar.operators;

import typesafeschwalbe.desugar.Constants;
import typesafeschwalbe.desugar.ast.AstNode;
import typesafeschwalbe.desugar.ast.Module;

public final class SignedLiterals {

    private SignedLiterals() {}

    public static Module remove(Module module) {
        return module.mapDeclarations(SignedLiterals::removeNode);
    }

    public static AstNode removeNode(AstNode node) {
        AstNode mapped = node.mapChildren(
            SignedLiterals::removeNode, b -> b
        );
        if(mapped.type != AstNode.Type.UNARY_MINUS) {
            return mapped;
        }
        AstNode.MonoOp data = mapped.getValue();
        AstNode negate = new AstNode(
            AstNode.Type.VARIABLE, Constants.NEGATE, mapped.source
        );
        return new AstNode(
            AstNode.Type.APPLICATION,
            new AstNode.Application(negate, data.value()),
            mapped.source
        );
    }

}

package typesafeschwalbe.desugar.operators;

import typesafeschwalbe.desugar.NameSupply;
import typesafeschwalbe.desugar.ast.AstNode;
import typesafeschwalbe.desugar.ast.Module;
import typesafeschwalbe.desugar.ast.QualifiedName;

public class OperatorSections {

    private final NameSupply names;

    public OperatorSections(NameSupply names) {
        this.names = names;
    }

    public Module desugar(Module module) {
        return module.mapDeclarations(this::desugarNode);
    }

    public AstNode desugarNode(AstNode node) {
        AstNode mapped = node.mapChildren(this::desugarNode, b -> b);
        if(mapped.type != AstNode.Type.OPERATOR_SECTION) {
            return mapped;
        }
        AstNode.OperatorSection data = mapped.getValue();
        String argument = this.names.freshName();
        AstNode variable = new AstNode(
            AstNode.Type.VARIABLE, QualifiedName.unqualified(argument),
            mapped.source
        );
        AstNode left = data.operandOnLeft()? data.operand() : variable;
        AstNode right = data.operandOnLeft()? variable : data.operand();
        AstNode partial = new AstNode(
            AstNode.Type.APPLICATION,
            new AstNode.Application(data.operator(), left),
            mapped.source
        );
        AstNode applied = new AstNode(
            AstNode.Type.APPLICATION,
            new AstNode.Application(partial, right),
            mapped.source
        );
        return new AstNode(
            AstNode.Type.LAMBDA,
            new AstNode.Lambda(argument, applied),
            mapped.source
        );
    }

}

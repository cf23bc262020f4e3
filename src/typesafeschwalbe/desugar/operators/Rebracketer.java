package typesafeschwalbe.desugar.operators;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import typesafeschwalbe.desugar.ErrorException;
import typesafeschwalbe.desugar.Source;
import typesafeschwalbe.desugar.ast.AstNode;
import typesafeschwalbe.desugar.ast.Binder;
import typesafeschwalbe.desugar.ast.Fixity;
import typesafeschwalbe.desugar.ast.Module;
import typesafeschwalbe.desugar.ast.QualifiedName;

public class Rebracketer {

    private static final Logger LOGGER
        = LoggerFactory.getLogger(Rebracketer.class);

    private final OperatorTable table;

    public Rebracketer(OperatorTable table) {
        this.table = table;
    }

    public Module rebracket(Module module) throws ErrorException {
        LOGGER.debug("Rebracketing module {}", module.name());
        Module matched = module.mapDeclarations(this::matchNode);
        return matched.mapDeclarations(Rebracketer::removeParens);
    }

    public AstNode matchNode(AstNode node) throws ErrorException {
        AstNode matched = node.type == AstNode.Type.BINARY_NO_PARENS
            ? this.matchExprOperators(node)
            : node;
        return matched.mapChildren(this::matchNode, this::matchBinder);
    }

    public Binder matchBinder(Binder binder) throws ErrorException {
        Binder matched = binder.type == Binder.Type.BINARY_NO_PARENS
            ? this.matchBinderOperators(binder)
            : binder;
        return matched.mapChildren(this::matchBinder);
    }

    private AstNode matchExprOperators(AstNode node) throws ErrorException {
        OperatorChain<AstNode> chain = new OperatorChain<>();
        this.flattenExpr(node, chain);
        return chain.reduce((operator, left, right) -> {
            AstNode partial = new AstNode(
                AstNode.Type.APPLICATION,
                new AstNode.Application(operator.operator(), left),
                Source.spanning(left.source, operator.source())
            );
            return new AstNode(
                AstNode.Type.APPLICATION,
                new AstNode.Application(partial, right),
                Source.spanning(left.source, right.source)
            );
        });
    }

    private void flattenExpr(AstNode node, OperatorChain<AstNode> chain) {
        if(node.type != AstNode.Type.BINARY_NO_PARENS) {
            chain.operand(node);
            return;
        }
        AstNode.BinaryNoParens data = node.getValue();
        this.flattenExpr(data.left(), chain);
        AstNode operator = data.operator();
        // anything but a plain operator reference gets the default fixity
        if(operator.type == AstNode.Type.VARIABLE) {
            QualifiedName name = operator.getValue();
            chain.operator(new OperatorChain.Link<>(
                operator, name.toString(),
                this.table.fixityOrDefault(name), operator.source
            ));
        } else {
            chain.operator(new OperatorChain.Link<>(
                operator, operator.type.toString(),
                Fixity.DEFAULT, operator.source
            ));
        }
        this.flattenExpr(data.right(), chain);
    }

    private Binder matchBinderOperators(Binder binder) throws ErrorException {
        OperatorChain<Binder> chain = new OperatorChain<>();
        this.flattenBinder(binder, chain);
        return chain.reduce((operator, left, right) -> new Binder(
            Binder.Type.OPERATOR_APPLICATION,
            new Binder.OperatorApplication(
                operator.operator().getValue(), left, right
            ),
            Source.spanning(left.source, right.source)
        ));
    }

    private void flattenBinder(Binder binder, OperatorChain<Binder> chain) {
        if(binder.type != Binder.Type.BINARY_NO_PARENS) {
            chain.operand(binder);
            return;
        }
        Binder.BinaryNoParens data = binder.getValue();
        Binder operator = data.operator();
        if(operator.type != Binder.Type.OPERATOR) {
            throw new IllegalStateException(
                "Binary binder chain has no operator, found "
                    + operator.type + " instead!"
            );
        }
        QualifiedName name = operator.getValue();
        this.flattenBinder(data.left(), chain);
        chain.operator(new OperatorChain.Link<>(
            operator, name.toString(),
            this.table.fixityOrDefault(name), operator.source
        ));
        this.flattenBinder(data.right(), chain);
    }

    public static AstNode removeParens(AstNode node) {
        AstNode stripped = node.mapChildren(
            Rebracketer::removeParens, Rebracketer::removeBinderParens
        );
        if(stripped.type == AstNode.Type.PARENS) {
            return stripped.<AstNode.MonoOp>getValue().value();
        }
        return stripped;
    }

    public static Binder removeBinderParens(Binder binder) {
        Binder stripped = binder.mapChildren(Rebracketer::removeBinderParens);
        if(stripped.type == Binder.Type.PARENS) {
            return stripped.getValue();
        }
        return stripped;
    }

}

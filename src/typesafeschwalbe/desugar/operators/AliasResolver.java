package typesafeschwalbe.desugar.operators;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import typesafeschwalbe.desugar.Error;
import typesafeschwalbe.desugar.ErrorException;
import typesafeschwalbe.desugar.Source;
import typesafeschwalbe.desugar.ast.AstNode;
import typesafeschwalbe.desugar.ast.Binder;
import typesafeschwalbe.desugar.ast.FixityAlias;
import typesafeschwalbe.desugar.ast.Module;
import typesafeschwalbe.desugar.ast.QualifiedName;

public class AliasResolver {

    private static final Logger LOGGER
        = LoggerFactory.getLogger(AliasResolver.class);

    static Error makeInvalidOperatorInBinderError(
        QualifiedName operator, QualifiedName aliased,
        Optional<Source> position
    ) {
        return new Error(
            Error.Kind.INVALID_OPERATOR_IN_BINDER,
            "Operator " + operator.name() + " cannot be used in a pattern"
                + " as it is an alias for the value " + aliased
                + ", not a data constructor",
            position
        );
    }

    static Error makeUnknownOperatorError(
        QualifiedName operator, Optional<Source> position
    ) {
        return new Error(
            Error.Kind.UNKNOWN_OPERATOR,
            "Unknown operator " + operator + " in pattern",
            position
        );
    }

    private final OperatorTable table;

    public AliasResolver(OperatorTable table) {
        this.table = table;
    }

    public Module resolve(Module module) throws ErrorException {
        LOGGER.debug("Resolving operator aliases in module {}", module.name());
        Optional<Source> position = Optional.ofNullable(module.source());
        return module.mapDeclarations(d -> this.resolveNode(position, d));
    }

    private AstNode resolveNode(
        Optional<Source> enclosing, AstNode node
    ) throws ErrorException {
        Optional<Source> position = node.source != null
            ? Optional.of(node.source)
            : enclosing;
        AstNode resolved = node.type == AstNode.Type.VARIABLE
            ? this.resolveVariable(node)
            : node;
        return resolved.mapChildren(
            n -> this.resolveNode(position, n),
            b -> this.resolveBinder(position, b)
        );
    }

    private AstNode resolveVariable(AstNode node) {
        QualifiedName name = node.getValue();
        Optional<FixityAlias> alias = this.table.aliasOf(name);
        if(alias.isEmpty()) {
            return node;
        }
        switch(alias.get().kind()) {
            case VALUE:
                return new AstNode(
                    AstNode.Type.VARIABLE, alias.get().target(), node.source
                );
            case CONSTRUCTOR:
                return new AstNode(
                    AstNode.Type.CONSTRUCTOR, alias.get().target(),
                    node.source
                );
            default:
                throw new RuntimeException("unhandled alias kind!");
        }
    }

    private Binder resolveBinder(
        Optional<Source> enclosing, Binder binder
    ) throws ErrorException {
        Optional<Source> position = binder.source != null
            ? Optional.of(binder.source)
            : enclosing;
        Binder resolved = binder;
        switch(binder.type) {
            case OPERATOR_APPLICATION: {
                Binder.OperatorApplication data = binder.getValue();
                resolved = this.resolveOperatorBinder(data, binder, position);
            } break;
            case BINARY_NO_PARENS:
                throw new IllegalStateException(
                    "Binary binder chain was not rebracketed!"
                );
            default:
                break;
        }
        return resolved.mapChildren(b -> this.resolveBinder(position, b));
    }

    private Binder resolveOperatorBinder(
        Binder.OperatorApplication data, Binder binder,
        Optional<Source> position
    ) throws ErrorException {
        Optional<FixityAlias> alias = this.table.aliasOf(data.operator());
        if(alias.isEmpty()) {
            throw new ErrorException(AliasResolver.makeUnknownOperatorError(
                data.operator(), position
            ));
        }
        if(alias.get().kind() == FixityAlias.Kind.VALUE) {
            throw new ErrorException(
                AliasResolver.makeInvalidOperatorInBinderError(
                    data.operator(), alias.get().target(), position
                )
            );
        }
        return new Binder(
            Binder.Type.CONSTRUCTOR,
            new Binder.Constructor(
                alias.get().target(), List.of(data.left(), data.right())
            ),
            binder.source
        );
    }

}

package typesafeschwalbe.desugar.ast;

import java.util.List;
import java.util.stream.Collectors;

import typesafeschwalbe.desugar.Source;

public class TypeNode extends Node<TypeNode.Type> {

    public static record Application(
        TypeNode function,
        TypeNode argument
    ) {}

    public static record Function(
        TypeNode argument,
        TypeNode result
    ) {}

    public static record Constraint(
        QualifiedName className,
        List<TypeNode> arguments
    ) {}

    public static record Constrained(
        List<Constraint> constraints,
        TypeNode type
    ) {}

    public static record ForAll(
        List<String> variables,
        TypeNode type
    ) {}

    public enum Type {
        CONSTRUCTOR, // QualifiedName
        VARIABLE,    // String
        APPLICATION, // Application
        FUNCTION,    // Function
        CONSTRAINED, // Constrained
        FOR_ALL      // ForAll
    }

    public TypeNode(Type type, Object value, Source source) {
        super(type, value, source);
    }

    @Override
    public String toString() {
        switch(this.type) {
            case CONSTRUCTOR: 
                return this.<QualifiedName>getValue().toString();
            case VARIABLE:
                return this.getValue();
            case APPLICATION: {
                Application data = this.getValue();
                return "(" + data.function() + " " + data.argument() + ")";
            }
            case FUNCTION: {
                Function data = this.getValue();
                return "(" + data.argument() + " -> " + data.result() + ")";
            }
            case CONSTRAINED: {
                Constrained data = this.getValue();
                return data.constraints().stream()
                    .map(c -> c.className() + c.arguments().stream()
                        .map(a -> " " + a)
                        .collect(Collectors.joining()))
                    .collect(Collectors.joining(", ", "(", ") => "))
                    + data.type();
            }
            case FOR_ALL: {
                ForAll data = this.getValue();
                return "forall " + String.join(" ", data.variables())
                    + ". " + data.type();
            }
            default:
                throw new RuntimeException("unhandled type!");
        }
    }

}

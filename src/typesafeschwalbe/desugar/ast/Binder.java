package typesafeschwalbe.desugar.ast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import typesafeschwalbe.desugar.Source;

public class Binder extends Node<Binder.Type> {

    public static record Named(
        String name,
        Binder binder
    ) {}

    public static record Constructor(
        QualifiedName name,
        List<Binder> arguments
    ) {}

    public static record Typed(
        Binder binder,
        TypeNode type
    ) {}

    public static record BinaryNoParens(
        Binder operator,
        Binder left,
        Binder right
    ) {}

    public static record OperatorApplication(
        QualifiedName operator,
        Binder left,
        Binder right
    ) {}

    public enum Type {
        NULL,                 // = null
        VARIABLE,             // String
        NAMED,                // Named
        CONSTRUCTOR,          // Constructor
        BOOLEAN_LITERAL,      // Boolean
        NUMBER_LITERAL,       // String
        STRING_LITERAL,       // String
        CHAR_LITERAL,         // String
        ARRAY_LITERAL,        // List<Binder>
        OBJECT_LITERAL,       // Map<String, Binder>
        TYPED,                // Typed
        PARENS,               // Binder
        OPERATOR,             // QualifiedName
        BINARY_NO_PARENS,     // BinaryNoParens
        OPERATOR_APPLICATION  // OperatorApplication
    }

    public Binder(Type type, Object value, Source source) {
        super(type, value, source);
    }

    public static Binder wildcard() {
        return new Binder(Type.NULL, null, null);
    }

    public static List<Binder> wildcards(int count) {
        List<Binder> binders = new ArrayList<>(count);
        for(int binderI = 0; binderI < count; binderI += 1) {
            binders.add(Binder.wildcard());
        }
        return binders;
    }

    public static Binder constructor(
        QualifiedName name, List<Binder> arguments
    ) {
        return new Binder(
            Type.CONSTRUCTOR, new Constructor(name, List.copyOf(arguments)),
            null
        );
    }

    public static Binder bool(boolean value) {
        return new Binder(Type.BOOLEAN_LITERAL, value, null);
    }

    public static Binder object(Map<String, Binder> fields) {
        return new Binder(
            Type.OBJECT_LITERAL, new LinkedHashMap<>(fields), null
        );
    }

    public <E extends Exception> Binder mapChildren(
        Rewrite<Binder, E> f
    ) throws E {
        switch(this.type) {
            case NULL:
            case VARIABLE:
            case BOOLEAN_LITERAL:
            case NUMBER_LITERAL:
            case STRING_LITERAL:
            case CHAR_LITERAL:
            case OPERATOR:
                return this;
            case NAMED: {
                Named data = this.getValue();
                return this.with(new Named(data.name(), f.apply(data.binder())));
            }
            case CONSTRUCTOR: {
                Constructor data = this.getValue();
                return this.with(new Constructor(
                    data.name(), Binder.mapAll(data.arguments(), f)
                ));
            }
            case ARRAY_LITERAL: {
                List<Binder> data = this.getValue();
                return this.with(Binder.mapAll(data, f));
            }
            case OBJECT_LITERAL: {
                Map<String, Binder> data = this.getValue();
                Map<String, Binder> mapped = new LinkedHashMap<>();
                for(Map.Entry<String, Binder> field: data.entrySet()) {
                    mapped.put(field.getKey(), f.apply(field.getValue()));
                }
                return this.with(mapped);
            }
            case TYPED: {
                Typed data = this.getValue();
                return this.with(new Typed(f.apply(data.binder()), data.type()));
            }
            case PARENS: {
                Binder data = this.getValue();
                return this.with(f.apply(data));
            }
            case BINARY_NO_PARENS: {
                BinaryNoParens data = this.getValue();
                return this.with(new BinaryNoParens(
                    f.apply(data.operator()),
                    f.apply(data.left()), f.apply(data.right())
                ));
            }
            case OPERATOR_APPLICATION: {
                OperatorApplication data = this.getValue();
                return this.with(new OperatorApplication(
                    data.operator(), f.apply(data.left()), f.apply(data.right())
                ));
            }
            default:
                throw new RuntimeException("unhandled binder type!");
        }
    }

    private Binder with(Object value) {
        return new Binder(this.type, value, this.source);
    }

    private static <E extends Exception> List<Binder> mapAll(
        List<Binder> binders, Rewrite<Binder, E> f
    ) throws E {
        List<Binder> mapped = new ArrayList<>(binders.size());
        for(Binder binder: binders) {
            mapped.add(f.apply(binder));
        }
        return mapped;
    }

    private boolean isAtomic() {
        switch(this.type) {
            case CONSTRUCTOR:
                return this.<Constructor>getValue().arguments().isEmpty();
            case NAMED:
            case BINARY_NO_PARENS:
                return false;
            default:
                return true;
        }
    }

    private static String showArgument(Binder binder) {
        return binder.isAtomic()? binder.toString() : "(" + binder + ")";
    }

    @Override
    public String toString() {
        switch(this.type) {
            case NULL: return "_";
            case VARIABLE: return this.getValue();
            case NAMED: {
                Named data = this.getValue();
                return data.name() + "@" + Binder.showArgument(data.binder());
            }
            case CONSTRUCTOR: {
                Constructor data = this.getValue();
                StringBuilder output = new StringBuilder(data.name().name());
                for(Binder argument: data.arguments()) {
                    output.append(" ");
                    output.append(Binder.showArgument(argument));
                }
                return output.toString();
            }
            case BOOLEAN_LITERAL:
            case NUMBER_LITERAL:
                return String.valueOf(this.<Object>getValue());
            case STRING_LITERAL: return "\"" + this.getValue() + "\"";
            case CHAR_LITERAL: return "'" + this.getValue() + "'";
            case ARRAY_LITERAL:
                return this.<List<Binder>>getValue().stream()
                    .map(Binder::toString)
                    .collect(Collectors.joining(", ", "[", "]"));
            case OBJECT_LITERAL:
                return this.<Map<String, Binder>>getValue().entrySet().stream()
                    .map(field -> field.getKey() + ": " + field.getValue())
                    .collect(Collectors.joining(", ", "{ ", " }"));
            case TYPED: {
                Typed data = this.getValue();
                return "(" + data.binder() + " :: " + data.type() + ")";
            }
            case PARENS: return "(" + this.getValue() + ")";
            case OPERATOR: return this.<QualifiedName>getValue().name();
            case BINARY_NO_PARENS: {
                BinaryNoParens data = this.getValue();
                return data.left() + " " + data.operator() + " "
                    + data.right();
            }
            case OPERATOR_APPLICATION: {
                OperatorApplication data = this.getValue();
                return "(" + data.left() + " " + data.operator().name() + " "
                    + data.right() + ")";
            }
            default:
                throw new RuntimeException("unhandled binder type!");
        }
    }

}

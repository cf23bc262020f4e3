package typesafeschwalbe.desugar.ast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import typesafeschwalbe.desugar.Source;

public class AstNode extends Node<AstNode.Type> {

    public static record ValueDeclaration(
        String name,
        AstNode value
    ) {}

    public static record FixityDeclaration(
        Fixity fixity,
        String operator,
        Optional<FixityAlias> alias
    ) {}

    public static record DataConstructor(
        String name,
        List<TypeNode> arguments
    ) {}

    public static record DataDeclaration(
        String name,
        List<String> arguments,
        List<DataConstructor> constructors
    ) {}

    public static record TypeDeclaration(
        String name,
        TypeNode type
    ) {}

    public static record Application(
        AstNode function,
        AstNode argument
    ) {}

    public static record Lambda(
        String argument,
        AstNode body
    ) {}

    public static record IfThenElse(
        AstNode condition,
        AstNode ifTrue,
        AstNode ifFalse
    ) {}

    public static record Case(
        List<AstNode> scrutinees,
        List<CaseAlternative> alternatives
    ) {}

    public static record Let(
        List<AstNode> declarations,
        AstNode body
    ) {}

    public static record Typed(
        AstNode value,
        TypeNode type
    ) {}

    public static record Accessor(
        String field,
        AstNode value
    ) {}

    public static record ObjectUpdate(
        AstNode object,
        Map<String, AstNode> updates
    ) {}

    public static record MonoOp(
        AstNode value
    ) {}

    public static record BinaryNoParens(
        AstNode operator,
        AstNode left,
        AstNode right
    ) {}

    public static record OperatorSection(
        AstNode operator,
        AstNode operand,
        boolean operandOnLeft
    ) {}

    public static record TypeClassDictionary(
        QualifiedName className,
        List<TypeNode> arguments
    ) {}

    public enum Type {
        VALUE_DECLARATION,     // ValueDeclaration
        BINDING_GROUP,         // List<AstNode>
        FIXITY_DECLARATION,    // FixityDeclaration
        DATA_DECLARATION,      // DataDeclaration
        TYPE_DECLARATION,      // TypeDeclaration
        EXTERN_DECLARATION,    // TypeDeclaration
        VARIABLE,              // QualifiedName
        CONSTRUCTOR,           // QualifiedName
        BOOLEAN_LITERAL,       // Boolean
        NUMBER_LITERAL,        // String
        STRING_LITERAL,        // String
        CHAR_LITERAL,          // String
        ARRAY_LITERAL,         // List<AstNode>
        OBJECT_LITERAL,        // Map<String, AstNode>
        APPLICATION,           // Application
        LAMBDA,                // Lambda
        IF_THEN_ELSE,          // IfThenElse
        CASE,                  // Case
        LET,                   // Let
        TYPED,                 // Typed
        ACCESSOR,              // Accessor
        OBJECT_UPDATE,         // ObjectUpdate
        PARENS,                // MonoOp
        UNARY_MINUS,           // MonoOp
        BINARY_NO_PARENS,      // BinaryNoParens
        OPERATOR_SECTION,      // OperatorSection
        TYPE_CLASS_DICTIONARY  // TypeClassDictionary
    }

    public AstNode(Type type, Object value, Source source) {
        super(type, value, source);
    }

    public AstNode with(Object value) {
        return new AstNode(this.type, value, this.source);
    }

    public <E extends Exception> AstNode mapChildren(
        Rewrite<AstNode, E> onNode, Rewrite<Binder, E> onBinder
    ) throws E {
        switch(this.type) {
            case FIXITY_DECLARATION:
            case DATA_DECLARATION:
            case TYPE_DECLARATION:
            case EXTERN_DECLARATION:
            case VARIABLE:
            case CONSTRUCTOR:
            case BOOLEAN_LITERAL:
            case NUMBER_LITERAL:
            case STRING_LITERAL:
            case CHAR_LITERAL:
            case TYPE_CLASS_DICTIONARY:
                return this;
            case VALUE_DECLARATION: {
                ValueDeclaration data = this.getValue();
                return this.with(new ValueDeclaration(
                    data.name(), onNode.apply(data.value())
                ));
            }
            case BINDING_GROUP: {
                List<AstNode> data = this.getValue();
                return this.with(AstNode.mapAll(data, onNode));
            }
            case ARRAY_LITERAL: {
                List<AstNode> data = this.getValue();
                return this.with(AstNode.mapAll(data, onNode));
            }
            case OBJECT_LITERAL: {
                Map<String, AstNode> data = this.getValue();
                return this.with(AstNode.mapFields(data, onNode));
            }
            case APPLICATION: {
                Application data = this.getValue();
                return this.with(new Application(
                    onNode.apply(data.function()), onNode.apply(data.argument())
                ));
            }
            case LAMBDA: {
                Lambda data = this.getValue();
                return this.with(new Lambda(
                    data.argument(), onNode.apply(data.body())
                ));
            }
            case IF_THEN_ELSE: {
                IfThenElse data = this.getValue();
                return this.with(new IfThenElse(
                    onNode.apply(data.condition()),
                    onNode.apply(data.ifTrue()),
                    onNode.apply(data.ifFalse())
                ));
            }
            case CASE: {
                Case data = this.getValue();
                List<AstNode> scrutinees = AstNode.mapAll(
                    data.scrutinees(), onNode
                );
                List<CaseAlternative> alternatives = new ArrayList<>();
                for(CaseAlternative alternative: data.alternatives()) {
                    alternatives.add(AstNode.mapAlternative(
                        alternative, onNode, onBinder
                    ));
                }
                return this.with(new Case(scrutinees, alternatives));
            }
            case LET: {
                Let data = this.getValue();
                return this.with(new Let(
                    AstNode.mapAll(data.declarations(), onNode),
                    onNode.apply(data.body())
                ));
            }
            case TYPED: {
                Typed data = this.getValue();
                return this.with(new Typed(
                    onNode.apply(data.value()), data.type()
                ));
            }
            case ACCESSOR: {
                Accessor data = this.getValue();
                return this.with(new Accessor(
                    data.field(), onNode.apply(data.value())
                ));
            }
            case OBJECT_UPDATE: {
                ObjectUpdate data = this.getValue();
                return this.with(new ObjectUpdate(
                    onNode.apply(data.object()),
                    AstNode.mapFields(data.updates(), onNode)
                ));
            }
            case PARENS:
            case UNARY_MINUS: {
                MonoOp data = this.getValue();
                return this.with(new MonoOp(onNode.apply(data.value())));
            }
            case BINARY_NO_PARENS: {
                BinaryNoParens data = this.getValue();
                return this.with(new BinaryNoParens(
                    onNode.apply(data.operator()),
                    onNode.apply(data.left()),
                    onNode.apply(data.right())
                ));
            }
            case OPERATOR_SECTION: {
                OperatorSection data = this.getValue();
                return this.with(new OperatorSection(
                    onNode.apply(data.operator()),
                    onNode.apply(data.operand()),
                    data.operandOnLeft()
                ));
            }
            default:
                throw new RuntimeException("unhandled node type!");
        }
    }

    private static <E extends Exception> CaseAlternative mapAlternative(
        CaseAlternative alternative,
        Rewrite<AstNode, E> onNode, Rewrite<Binder, E> onBinder
    ) throws E {
        List<Binder> binders = new ArrayList<>();
        for(Binder binder: alternative.binders()) {
            binders.add(onBinder.apply(binder));
        }
        if(!alternative.isGuarded()) {
            return CaseAlternative.of(
                binders, onNode.apply(alternative.value().get())
            );
        }
        List<CaseAlternative.Guarded> guarded = new ArrayList<>();
        for(CaseAlternative.Guarded branch: alternative.guarded()) {
            guarded.add(new CaseAlternative.Guarded(
                onNode.apply(branch.guard()), onNode.apply(branch.value())
            ));
        }
        return CaseAlternative.guarded(binders, guarded);
    }

    private static <E extends Exception> List<AstNode> mapAll(
        List<AstNode> nodes, Rewrite<AstNode, E> f
    ) throws E {
        List<AstNode> mapped = new ArrayList<>(nodes.size());
        for(AstNode node: nodes) {
            mapped.add(f.apply(node));
        }
        return mapped;
    }

    private static <E extends Exception> Map<String, AstNode> mapFields(
        Map<String, AstNode> fields, Rewrite<AstNode, E> f
    ) throws E {
        Map<String, AstNode> mapped = new LinkedHashMap<>();
        for(Map.Entry<String, AstNode> field: fields.entrySet()) {
            mapped.put(field.getKey(), f.apply(field.getValue()));
        }
        return mapped;
    }

    @Override
    public String toString() {
        return this.type + "(" + this.<Object>getValue() + ")";
    }

}

package typesafeschwalbe.desugar.exhaustive;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import typesafeschwalbe.desugar.ast.AstNode;
import typesafeschwalbe.desugar.ast.Module;
import typesafeschwalbe.desugar.ast.QualifiedName;
import typesafeschwalbe.desugar.ast.TypeNode;

public class Environment {

    public static record DataType(
        QualifiedName name,
        List<AstNode.DataConstructor> constructors
    ) {}

    public static record TypeClass(
        List<String> arguments,
        List<TypeNode.Constraint> superclasses,
        List<String> members
    ) {}

    public static class Builder {

        private final Map<QualifiedName, DataType> dataTypes = new HashMap<>();
        private final Map<QualifiedName, QualifiedName> constructorTypes
            = new HashMap<>();
        private final Map<QualifiedName, TypeClass> typeClasses
            = new HashMap<>();

        public Builder addDataType(
            QualifiedName name, List<AstNode.DataConstructor> constructors
        ) {
            if(name.module().isEmpty()) {
                throw new IllegalArgumentException(
                    "Data type '" + name + "' is not qualified!"
                );
            }
            this.dataTypes.put(
                name, new DataType(name, List.copyOf(constructors))
            );
            for(AstNode.DataConstructor constructor: constructors) {
                this.constructorTypes.put(
                    new QualifiedName(name.module(), constructor.name()), name
                );
            }
            return this;
        }

        public Builder addTypeClass(QualifiedName name, TypeClass typeClass) {
            this.typeClasses.put(name, typeClass);
            return this;
        }

        public Builder addDataDeclarations(Module module) {
            for(AstNode declaration: module.declarations()) {
                if(declaration.type != AstNode.Type.DATA_DECLARATION) {
                    continue;
                }
                AstNode.DataDeclaration data = declaration.getValue();
                this.addDataType(
                    new QualifiedName(module.name(), data.name()),
                    data.constructors()
                );
            }
            return this;
        }

        public Environment build() {
            return new Environment(
                Map.copyOf(this.dataTypes),
                Map.copyOf(this.constructorTypes),
                Map.copyOf(this.typeClasses)
            );
        }

    }

    private final Map<QualifiedName, DataType> dataTypes;
    private final Map<QualifiedName, QualifiedName> constructorTypes;
    private final Map<QualifiedName, TypeClass> typeClasses;

    private Environment(
        Map<QualifiedName, DataType> dataTypes,
        Map<QualifiedName, QualifiedName> constructorTypes,
        Map<QualifiedName, TypeClass> typeClasses
    ) {
        this.dataTypes = dataTypes;
        this.constructorTypes = constructorTypes;
        this.typeClasses = typeClasses;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Environment empty() {
        return new Builder().build();
    }

    public Optional<QualifiedName> typeOfConstructor(QualifiedName constructor) {
        return Optional.ofNullable(this.constructorTypes.get(constructor));
    }

    // all constructors of the type the given one belongs to
    public Optional<List<AstNode.DataConstructor>> constructorsOf(
        QualifiedName constructor
    ) {
        return this.typeOfConstructor(constructor)
            .map(type -> this.dataTypes.get(type).constructors());
    }

    public Optional<TypeClass> typeClass(QualifiedName name) {
        return Optional.ofNullable(this.typeClasses.get(name));
    }

}

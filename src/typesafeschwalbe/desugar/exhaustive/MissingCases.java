package typesafeschwalbe.desugar.exhaustive;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import typesafeschwalbe.desugar.ast.AstNode;
import typesafeschwalbe.desugar.ast.Binder;
import typesafeschwalbe.desugar.ast.ModuleName;
import typesafeschwalbe.desugar.ast.QualifiedName;

public class MissingCases {

    public static record Single(
        List<Binder> missing,
        Coverage coverage
    ) {}

    public static record Multiple(
        List<List<Binder>> missing,
        Coverage coverage
    ) {}

    private final Environment env;
    private final ModuleName moduleName;

    public MissingCases(Environment env, ModuleName moduleName) {
        this.env = env;
        this.moduleName = moduleName;
    }

    public Multiple multiple(List<Binder> uncovered, List<Binder> clause) {
        if(uncovered.size() != clause.size()) {
            throw new IllegalStateException(
                "Clause has " + clause.size() + " binders, but "
                    + uncovered.size() + " were expected!"
            );
        }
        List<List<Binder>> missing = new ArrayList<>();
        Coverage coverage = Coverage.COVERED;
        for(int columnI = 0; columnI < uncovered.size(); columnI += 1) {
            Single column = this.single(
                uncovered.get(columnI), clause.get(columnI)
            );
            for(Binder binder: column.missing()) {
                List<Binder> row = new ArrayList<>(uncovered);
                row.set(columnI, binder);
                missing.add(row);
            }
            coverage = coverage.and(column.coverage());
        }
        return new Multiple(missing, coverage);
    }

    public Single single(Binder uncovered, Binder clause) {
        switch(clause.type) {
            case NULL:
            case VARIABLE:
                return new Single(List.of(), Coverage.COVERED);
            case NAMED:
                return this.single(
                    uncovered, clause.<Binder.Named>getValue().binder()
                );
            case TYPED:
                return this.single(
                    uncovered, clause.<Binder.Typed>getValue().binder()
                );
            case PARENS:
                return this.single(uncovered, clause.<Binder>getValue());
            default:
                break;
        }
        boolean wildcard = uncovered.type == Binder.Type.NULL
            || uncovered.type == Binder.Type.VARIABLE;
        if(clause.type == Binder.Type.CONSTRUCTOR) {
            Binder.Constructor constructor = clause.getValue();
            if(wildcard) {
                return this.expandConstructors(constructor.name(), clause);
            }
            if(uncovered.type == Binder.Type.CONSTRUCTOR) {
                return this.constructors(uncovered, constructor);
            }
        }
        if(clause.type == Binder.Type.OBJECT_LITERAL) {
            Map<String, Binder> fields = clause.getValue();
            if(wildcard) {
                return this.objects(Map.of(), fields);
            }
            if(uncovered.type == Binder.Type.OBJECT_LITERAL) {
                return this.objects(uncovered.getValue(), fields);
            }
        }
        if(clause.type == Binder.Type.BOOLEAN_LITERAL) {
            boolean value = clause.getValue();
            if(wildcard) {
                return new Single(
                    List.of(Binder.bool(!value)), Coverage.COVERED
                );
            }
            if(uncovered.type == Binder.Type.BOOLEAN_LITERAL) {
                if(uncovered.<Boolean>getValue() == value) {
                    return new Single(List.of(), Coverage.COVERED);
                }
                return new Single(List.of(uncovered), Coverage.NOT_COVERED);
            }
        }
        return new Single(List.of(uncovered), Coverage.UNKNOWN);
    }

    private Single expandConstructors(QualifiedName name, Binder clause) {
        QualifiedName qualified = name.qualify(this.moduleName);
        List<AstNode.DataConstructor> siblings = this.env
            .constructorsOf(qualified)
            .orElseThrow(() -> new IllegalStateException(
                "Constructor '" + qualified + "' is not in the environment!"
            ));
        List<Binder> missing = new ArrayList<>();
        for(AstNode.DataConstructor sibling: siblings) {
            Binder expanded = Binder.constructor(
                new QualifiedName(qualified.module(), sibling.name()),
                Binder.wildcards(sibling.arguments().size())
            );
            missing.addAll(this.single(expanded, clause).missing());
        }
        return new Single(missing, Coverage.COVERED);
    }

    private Single constructors(
        Binder uncovered, Binder.Constructor clause
    ) {
        Binder.Constructor data = uncovered.getValue();
        QualifiedName uncoveredName = data.name().qualify(this.moduleName);
        QualifiedName clauseName = clause.name().qualify(this.moduleName);
        if(!uncoveredName.equals(clauseName)) {
            return new Single(List.of(uncovered), Coverage.NOT_COVERED);
        }
        Multiple arguments = this.multiple(data.arguments(), clause.arguments());
        List<Binder> missing = new ArrayList<>();
        for(List<Binder> row: arguments.missing()) {
            missing.add(Binder.constructor(data.name(), row));
        }
        return new Single(missing, arguments.coverage());
    }

    // outer join over the sorted field names, absent fields are wildcards
    private Single objects(
        Map<String, Binder> uncovered, Map<String, Binder> clause
    ) {
        TreeSet<String> names = new TreeSet<>(uncovered.keySet());
        names.addAll(clause.keySet());
        List<Binder> uncoveredFields = new ArrayList<>();
        List<Binder> clauseFields = new ArrayList<>();
        for(String name: names) {
            uncoveredFields.add(
                uncovered.getOrDefault(name, Binder.wildcard())
            );
            clauseFields.add(clause.getOrDefault(name, Binder.wildcard()));
        }
        Multiple fields = this.multiple(uncoveredFields, clauseFields);
        List<Binder> missing = new ArrayList<>();
        for(List<Binder> row: fields.missing()) {
            Map<String, Binder> object = new LinkedHashMap<>();
            int fieldI = 0;
            for(String name: names) {
                object.put(name, row.get(fieldI));
                fieldI += 1;
            }
            missing.add(Binder.object(object));
        }
        return new Single(missing, fields.coverage());
    }

}

package typesafeschwalbe.desugar;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import typesafeschwalbe.desugar.ast.Binder;
import typesafeschwalbe.desugar.ast.ModuleName;

public record Error(
    Kind kind,
    String message,
    Optional<Source> location,
    List<Hint> hints,
    List<List<Binder>> examples,
    boolean hasMoreExamples
) {

    public enum Kind {
        MULTIPLE_FIXITIES(true),
        NON_ASSOCIATIVE_CHAIN(true),
        MIXED_ASSOCIATIVITY(true),
        INVALID_OPERATOR_IN_BINDER(true),
        UNKNOWN_OPERATOR(true),
        NOT_EXHAUSTIVE_PATTERN(false),
        OVERLAPPING_PATTERN(false),
        INCOMPLETE_EXHAUSTIVITY_CHECK(false);

        public final boolean fatal;

        private Kind(boolean fatal) {
            this.fatal = fatal;
        }
    }

    public static record Hint(
        Type type, String subject, Optional<Source> location
    ) {

        public enum Type {
            IN_MODULE,
            IN_VALUE_DECLARATION,
            AT_POSITION
        }

        public static Hint inModule(ModuleName module) {
            return new Hint(Type.IN_MODULE, module.toString(), Optional.empty());
        }

        public static Hint inValueDeclaration(String name) {
            return new Hint(
                Type.IN_VALUE_DECLARATION, name, Optional.empty()
            );
        }

        public static Hint atPosition(Source location) {
            return new Hint(
                Type.AT_POSITION, location.toString(), Optional.of(location)
            );
        }

        @Override
        public String toString() {
            switch(this.type) {
                case IN_MODULE: return "in module " + this.subject;
                case IN_VALUE_DECLARATION:
                    return "in value declaration " + this.subject;
                case AT_POSITION: return "at " + this.subject;
                default:
                    throw new RuntimeException("unhandled hint type!");
            }
        }

    }

    public Error {
        hints = List.copyOf(hints);
        examples = List.copyOf(examples);
    }

    public Error(Kind kind, String message, Optional<Source> location) {
        this(kind, message, location, List.of(), List.of(), false);
    }

    public Error(Kind kind, String message, Source location) {
        this(kind, message, Optional.ofNullable(location));
    }

    public boolean isFatal() {
        return this.kind.fatal;
    }

    public Error withHint(Hint hint) {
        List<Hint> hints = new ArrayList<>(this.hints.size() + 1);
        hints.add(hint);
        hints.addAll(this.hints);
        return new Error(
            this.kind, this.message, this.location, hints,
            this.examples, this.hasMoreExamples
        );
    }

    public Error withHints(List<Hint> outer) {
        List<Hint> hints = new ArrayList<>(outer);
        hints.addAll(this.hints);
        return new Error(
            this.kind, this.message, this.location, hints,
            this.examples, this.hasMoreExamples
        );
    }

    public Error withExamples(
        List<List<Binder>> examples, boolean hasMoreExamples
    ) {
        return new Error(
            this.kind, this.message, this.location, this.hints,
            examples, hasMoreExamples
        );
    }

    public String render() {
        StringBuilder output = new StringBuilder();
        output.append(this.isFatal()? "error: " : "warning: ");
        output.append(this.message);
        output.append("\n");
        for(List<Binder> example: this.examples) {
            output.append("    ");
            output.append(example.stream()
                .map(Binder::toString)
                .collect(Collectors.joining(", ")));
            output.append("\n");
        }
        if(this.hasMoreExamples) {
            output.append("    ...\n");
        }
        if(this.location.isPresent()) {
            output.append("  at ");
            output.append(this.location.get());
            output.append("\n");
        }
        for(int hintI = this.hints.size() - 1; hintI >= 0; hintI -= 1) {
            output.append("  ");
            output.append(this.hints.get(hintI));
            output.append("\n");
        }
        return output.toString();
    }

}

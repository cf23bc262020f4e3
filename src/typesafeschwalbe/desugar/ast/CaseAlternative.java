package typesafeschwalbe.desugar.ast;

import java.util.List;
import java.util.Optional;

public record CaseAlternative(
    List<Binder> binders,
    Optional<AstNode> value,
    List<Guarded> guarded
) {

    public static record Guarded(
        AstNode guard,
        AstNode value
    ) {}

    public CaseAlternative {
        binders = List.copyOf(binders);
        guarded = List.copyOf(guarded);
        if(value.isPresent() == !guarded.isEmpty()) {
            throw new IllegalArgumentException(
                "A case alternative has either one value or guarded values!"
            );
        }
    }

    public static CaseAlternative of(List<Binder> binders, AstNode value) {
        return new CaseAlternative(binders, Optional.of(value), List.of());
    }

    public static CaseAlternative guarded(
        List<Binder> binders, List<Guarded> guarded
    ) {
        return new CaseAlternative(binders, Optional.empty(), guarded);
    }

    public boolean isGuarded() {
        return this.value.isEmpty();
    }

}

package typesafeschwalbe.desugar.ast;

import java.util.List;

public record ModuleName(List<String> elements) {

    public ModuleName {
        elements = List.copyOf(elements);
    }

    public static ModuleName of(String dotted) {
        return new ModuleName(List.of(dotted.split("\\.")));
    }

    @Override
    public String toString() {
        return String.join(".", this.elements);
    }

}

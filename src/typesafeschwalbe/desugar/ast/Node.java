package typesafeschwalbe.desugar.ast;

import java.util.Objects;

import typesafeschwalbe.desugar.Source;

// equality is structural and ignores source locations
public abstract class Node<K extends Enum<K>> {

    public final K type;
    private final Object value;
    public final Source source;

    protected Node(K type, Object value, Source source) {
        this.type = type;
        this.value = value;
        this.source = source;
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) this.value;
    }

    @Override
    public boolean equals(Object otherRaw) {
        if(this == otherRaw) { return true; }
        if(otherRaw == null || otherRaw.getClass() != this.getClass()) {
            return false;
        }
        Node<?> other = (Node<?>) otherRaw;
        return this.type == other.type
            && Objects.equals(this.value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.type, this.value);
    }

}

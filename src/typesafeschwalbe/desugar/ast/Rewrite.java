package typesafeschwalbe.desugar.ast;

@FunctionalInterface
public interface Rewrite<T, E extends Exception> {

    T apply(T node) throws E;

}

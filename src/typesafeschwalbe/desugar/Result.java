package typesafeschwalbe.desugar;

import java.util.List;

public class Result<T> {

    private final T value;
    private final List<Error> errors;
    private final List<Error> warnings;

    private Result(T value, List<Error> errors, List<Error> warnings) {
        this.value = value;
        this.errors = errors;
        this.warnings = warnings;
    }

    public static <T> Result<T> ofValue(T value) {
        return new Result<T>(value, null, List.of());
    }

    public static <T> Result<T> ofValue(T value, List<Error> warnings) {
        return new Result<T>(value, null, List.copyOf(warnings));
    }

    public static <T> Result<T> ofError(Error... errors) {
        return new Result<T>(null, List.of(errors), List.of());
    }

    public static <T> Result<T> ofError(List<Error> errors) {
        return new Result<T>(null, List.copyOf(errors), List.of());
    }

    public static <T> Result<T> ofError(
        List<Error> errors, List<Error> warnings
    ) {
        return new Result<T>(
            null, List.copyOf(errors), List.copyOf(warnings)
        );
    }

    public boolean isValue() {
        return this.errors == null;
    }

    public T getValue() {
        if(this.errors != null) {
            throw new IllegalStateException(
                "Attempted to get the value of a 'Result' without any value!"
            );
        }
        return this.value;
    }

    public boolean isError() {
        return this.errors != null;
    }

    public List<Error> getError() {
        if(this.errors == null) {
            throw new IllegalStateException(
                "Attempted to get the errors of a 'Result' without any errors!"
            );
        }
        return this.errors;
    }

    public List<Error> getWarnings() {
        return this.warnings;
    }

}

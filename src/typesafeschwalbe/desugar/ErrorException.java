package typesafeschwalbe.desugar;

public class ErrorException extends Exception {

    public final Error error;

    public ErrorException(Error error) {
        super(error.message());
        this.error = error;
    }

    public ErrorException withHint(Error.Hint hint) {
        ErrorException wrapped = new ErrorException(this.error.withHint(hint));
        wrapped.setStackTrace(this.getStackTrace());
        return wrapped;
    }

}

package typesafeschwalbe.desugar;

public record Source(String file, int startOffset, int endOffset) {

    public Source(Source start, Source end) {
        this(start.file, start.startOffset, end.endOffset);
        if(!start.file.equals(end.file)) {
            throw new IllegalArgumentException(
                "Provided source locations are not from the same file!"
            );
        }
    }

    public static Source internal(String moduleName) {
        return new Source("<" + moduleName + ">", 0, 0);
    }

    public static Source spanning(Source start, Source end) {
        if(start == null) { return end; }
        if(end == null) { return start; }
        if(!start.file.equals(end.file)) { return start; }
        return new Source(start, end);
    }

    public boolean isInternal() {
        return this.file.startsWith("<");
    }

    @Override
    public String toString() {
        return "@\"" + this.file + "\":" + this.startOffset
            + "-" + this.endOffset;
    }

}

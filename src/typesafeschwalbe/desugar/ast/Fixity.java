package typesafeschwalbe.desugar.ast;

public record Fixity(Associativity associativity, int precedence) {

    public enum Associativity {
        LEFT("infixl"),
        RIGHT("infixr"),
        NONE("infix");

        public final String keyword;

        private Associativity(String keyword) {
            this.keyword = keyword;
        }

        public static Associativity fromKeyword(String keyword) {
            for(Associativity associativity: Associativity.values()) {
                if(associativity.keyword.equals(keyword)) {
                    return associativity;
                }
            }
            throw new IllegalArgumentException(
                "'" + keyword + "' is not an associativity"
            );
        }
    }

    // unknown operators bind loosest, below every declarable precedence
    public static final Fixity DEFAULT = new Fixity(Associativity.LEFT, -1);

    @Override
    public String toString() {
        return this.associativity.keyword + " " + this.precedence;
    }

}

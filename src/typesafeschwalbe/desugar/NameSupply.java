package typesafeschwalbe.desugar;

public interface NameSupply {

    String freshName();

    static NameSupply counter() {
        return new NameSupply() {
            private int nextId = 0;

            @Override
            public String freshName() {
                int id = this.nextId;
                this.nextId += 1;
                return "$" + id;
            }
        };
    }

}

package fol.term;

public record FSymbol(String name, int arity) {
    public FSymbol {
        if (arity < 0) throw new IllegalArgumentException("Negative arity for " + name);
    }

    public String toString() {
        return name + "\\" + arity;
    }
}

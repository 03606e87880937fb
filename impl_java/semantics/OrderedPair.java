package semantics;

/**
 * The value of {@code pair(first, second)}.
 */
public record OrderedPair(Object first, Object second) {
    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}

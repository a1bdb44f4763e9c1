package tree;

/**
 * Length of the edge between a vertex and its parent.
 *
 * Always finite and non-negative; construction fails otherwise.
 */
public final class BranchLength {

    private final double value;

    private BranchLength(double value) {
        this.value = value;
    }

    /**
     * @throws IllegalArgumentException if {@code value} is negative, NaN or infinite
     */
    public static BranchLength of(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Branch length must be finite, got " + value);
        }
        if (value < 0.0) {
            throw new IllegalArgumentException("Branch length must be non-negative, got " + value);
        }
        return new BranchLength(value);
    }

    public double value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BranchLength)) return false;
        return Double.compare(value, ((BranchLength) o).value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}

package games.nertz.layout;

/**
 * A point in the normalised table space, where both coordinates lie in [0.0, 1.0].
 */
public record Point(double x, double y) {

    /**
     * Euclidean distance to {@code other}.
     */
    public double distanceTo(Point other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    /**
     * Returns this point with both coordinates rounded to four decimal digits.
     */
    public Point rounded() {
        return new Point(round4(x), round4(y));
    }

    private static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }

    @Override
    public String toString() {
        return String.format("(%.4f, %.4f)", x, y);
    }
}

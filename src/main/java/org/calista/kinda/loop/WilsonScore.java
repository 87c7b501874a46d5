package org.calista.kinda.loop;

/**
 * Wilson score interval bounds for a binomial proportion.
 */
public final class WilsonScore {

    private WilsonScore() {
    }

    /**
     * Lower bound of the Wilson interval. NaN when n &lt;= 0 or z is not a positive number.
     */
    public static double lowerBound(int successes, int n, double z) {
        if (n <= 0 || !(z > 0.0) || successes < 0 || successes > n) return Double.NaN;
        double p = (double) successes / n;
        double z2 = z * z;
        double denom = 1.0 + z2 / n;
        double center = p + z2 / (2.0 * n);
        double margin = z * Math.sqrt(p * (1.0 - p) / n + z2 / (4.0 * n * (double) n));
        return (center - margin) / denom;
    }

    public static double upperBound(int successes, int n, double z) {
        if (n <= 0 || !(z > 0.0) || successes < 0 || successes > n) return Double.NaN;
        double p = (double) successes / n;
        double z2 = z * z;
        double denom = 1.0 + z2 / n;
        double center = p + z2 / (2.0 * n);
        double margin = z * Math.sqrt(p * (1.0 - p) / n + z2 / (4.0 * n * (double) n));
        return (center + margin) / denom;
    }
}

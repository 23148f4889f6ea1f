package com.synapse.x.utils.basic;

import lombok.experimental.UtilityClass;

@UtilityClass
public final class VectorMath {

    /**
     * Cosine similarity in [-1, 1]. Zero when either vector has zero norm.
     * <p>
     * Each vector is scaled by its largest absolute component first, so components near
     * {@code Double.MAX_VALUE} or {@code Double.MIN_NORMAL} neither overflow nor flush to zero.
     * </p>
     */
    public static double cosine(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("dimension mismatch: " + a.length + " vs " + b.length);
        }
        double scaleA = maxAbs(a);
        double scaleB = maxAbs(b);
        if (scaleA == 0.0 || scaleB == 0.0) return 0.0;
        if (!Double.isFinite(scaleA) || !Double.isFinite(scaleB)) return Double.NaN;

        double dot = 0.0, na = 0.0, nb = 0.0;
        for (int i = 0; i < a.length; i++) {
            double x = a[i] / scaleA;
            double y = b[i] / scaleB;
            dot += x * y;
            na += x * x;
            nb += y * y;
        }
        double c = dot / (Math.sqrt(na) * Math.sqrt(nb));
        return Math.max(-1.0, Math.min(1.0, c));
    }

    private static double maxAbs(double[] v) {
        double max = 0.0;
        for (double x : v) {
            double abs = Math.abs(x);
            if (abs > max || Double.isNaN(abs)) max = abs;
        }
        return max;
    }

    /**
     * Clamps into [0, 1]. NaN maps to 0.
     */
    public static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }

    /**
     * min/max ratio of two non-negative magnitudes; 1 when both are zero.
     */
    public static double ratio(double a, double b) {
        double hi = Math.max(a, b);
        if (hi <= 0.0) return 1.0;
        return Math.min(a, b) / hi;
    }

    public static double halfLifeDecay(double elapsed, double halfLife) {
        if (halfLife <= 0.0) return elapsed <= 0.0 ? 1.0 : 0.0;
        return Math.exp(-Math.log(2.0) * Math.max(0.0, elapsed) / halfLife);
    }
}

package com.telemetrysentinel.core.scoring;

/**
 * NaN-skipping column statistics over a row-major matrix.
 */
final class ColumnStatistics {

    private ColumnStatistics() {
        // utility class - not instantiable
    }

    /**
     * @return the mean of the non-NaN values of column {@code c}, or
     *         {@code NaN} when the column holds no value
     */
    static double mean(double[][] rows, int c) {
        double sum = 0;
        int n = 0;
        for (double[] row : rows) {
            if (!Double.isNaN(row[c])) {
                sum += row[c];
                n++;
            }
        }
        return n == 0 ? Double.NaN : sum / n;
    }

    /**
     * Population standard deviation of the non-NaN values of column {@code c}.
     */
    static double stdDev(double[][] rows, int c, double mean) {
        if (Double.isNaN(mean)) {
            return Double.NaN;
        }
        double sumSquaredDiff = 0;
        int n = 0;
        for (double[] row : rows) {
            if (!Double.isNaN(row[c])) {
                double diff = row[c] - mean;
                sumSquaredDiff += diff * diff;
                n++;
            }
        }
        return Math.sqrt(sumSquaredDiff / n);
    }

    static double min(double[][] rows, int c) {
        double min = Double.NaN;
        for (double[] row : rows) {
            if (!Double.isNaN(row[c]) && (Double.isNaN(min) || row[c] < min)) {
                min = row[c];
            }
        }
        return min;
    }

    static double max(double[][] rows, int c) {
        double max = Double.NaN;
        for (double[] row : rows) {
            if (!Double.isNaN(row[c]) && (Double.isNaN(max) || row[c] > max)) {
                max = row[c];
            }
        }
        return max;
    }
}

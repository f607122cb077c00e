package org.calista.elicitation.info;

import java.util.Arrays;

/**
 * Snapshot of the numbers the stopping rule looks at. Plain values, for logs and reports.
 */
public final class StoppingDiagnostics {

    public final int vignettesShown;
    public final int minVignettes;
    public final int maxVignettes;
    public final double fimDeterminant;
    public final double fimDetThreshold;
    public final double maxVariance;
    public final double minVariance;
    public final double meanVariance;
    public final double maxVarianceThreshold;
    public final double[] variances;
    public final boolean belowMinimum;
    public final boolean maximumReached;
    public final boolean informationSufficient;
    public final boolean uncertaintyLow;

    StoppingDiagnostics(int vignettesShown, int minVignettes, int maxVignettes,
                        double fimDeterminant, double fimDetThreshold,
                        double[] variances, double maxVarianceThreshold) {
        this.vignettesShown = vignettesShown;
        this.minVignettes = minVignettes;
        this.maxVignettes = maxVignettes;
        this.fimDeterminant = fimDeterminant;
        this.fimDetThreshold = fimDetThreshold;
        this.variances = Arrays.copyOf(variances, variances.length);
        this.maxVariance = Arrays.stream(variances).max().orElse(0.0);
        this.minVariance = Arrays.stream(variances).min().orElse(0.0);
        this.meanVariance = Arrays.stream(variances).average().orElse(0.0);
        this.maxVarianceThreshold = maxVarianceThreshold;
        this.belowMinimum = vignettesShown < minVignettes;
        this.maximumReached = vignettesShown >= maxVignettes;
        this.informationSufficient = fimDeterminant > fimDetThreshold;
        this.uncertaintyLow = maxVariance < maxVarianceThreshold;
    }

    @Override
    public String toString() {
        return "StoppingDiagnostics{n=" + vignettesShown
                + ", det=" + fimDeterminant
                + ", maxVar=" + maxVariance
                + ", minVar=" + minVariance
                + ", meanVar=" + meanVariance
                + ", belowMin=" + belowMinimum
                + ", maxReached=" + maximumReached
                + ", infoSufficient=" + informationSufficient
                + ", uncertaintyLow=" + uncertaintyLow + "}";
    }
}

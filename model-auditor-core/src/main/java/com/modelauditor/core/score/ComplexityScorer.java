package com.modelauditor.core.score;

import com.modelauditor.core.model.ComplexityScore;
import com.modelauditor.core.model.GraphStats;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Rates how hard a workbook is to review, on a 1-5 scale.
 *
 * <p>Tiers are tested from 5 down to 2; the first tier with any breakpoint
 * exceeded sets the score, and the exceeded breakpoints become its drivers.
 * A workbook exceeding nothing scores 1.
 *
 * <table>
 *   <caption>Breakpoints (strictly greater than)</caption>
 *   <tr><th>Tier</th><th>Sheets</th><th>Formulas</th><th>Depth</th><th>Cross-sheet ratio</th><th>Formula density</th></tr>
 *   <tr><td>5</td><td>30</td><td>10000</td><td>50</td><td>0.5</td><td>-</td></tr>
 *   <tr><td>4</td><td>15</td><td>2000</td><td>25</td><td>0.35</td><td>-</td></tr>
 *   <tr><td>3</td><td>8</td><td>500</td><td>12</td><td>0.2</td><td>0.6</td></tr>
 *   <tr><td>2</td><td>3</td><td>50</td><td>5</td><td>0.05</td><td>0.3</td></tr>
 * </table>
 */
public final class ComplexityScorer {

    private static final List<Tier> TIERS = List.of(
        new Tier(5, 30, 10_000, 50, 0.5, Double.NaN),
        new Tier(4, 15, 2_000, 25, 0.35, Double.NaN),
        new Tier(3, 8, 500, 12, 0.2, 0.6),
        new Tier(2, 3, 50, 5, 0.05, 0.3)
    );

    private ComplexityScorer() {
        // Utility class
    }

    /**
     * Scores graph statistics.
     *
     * @param stats statistics, may be null
     * @return score; 1 for null or empty statistics
     */
    public static ComplexityScore score(GraphStats stats) {
        if (stats == null) {
            return ComplexityScore.lowest();
        }
        for (Tier tier : TIERS) {
            List<String> drivers = tier.exceeded(stats);
            if (!drivers.isEmpty()) {
                return new ComplexityScore(tier.score, drivers);
            }
        }
        return ComplexityScore.lowest();
    }

    private record Tier(int score, int sheets, int formulas, int depth, double crossSheetRatio, double density) {

        List<String> exceeded(GraphStats stats) {
            List<String> drivers = new ArrayList<>();
            if (stats.sheetCount() > sheets) {
                drivers.add("Sheet count " + stats.sheetCount() + " > " + sheets);
            }
            if (stats.formulaCells() > formulas) {
                drivers.add("Formula count " + stats.formulaCells() + " > " + formulas);
            }
            if (stats.maxDepth() > depth) {
                drivers.add("Dependency depth " + stats.maxDepth() + " > " + depth);
            }
            if (stats.crossSheetEdgeRatio() > crossSheetRatio) {
                drivers.add(String.format(Locale.ROOT, "Cross-sheet references %.0f%% > %.0f%%",
                    stats.crossSheetEdgeRatio() * 100, crossSheetRatio * 100));
            }
            if (!Double.isNaN(density) && stats.formulaDensity() > density) {
                drivers.add(String.format(Locale.ROOT, "Formula density %.0f%% > %.0f%%",
                    stats.formulaDensity() * 100, density * 100));
            }
            return drivers;
        }
    }
}

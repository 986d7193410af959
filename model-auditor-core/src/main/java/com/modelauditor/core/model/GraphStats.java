package com.modelauditor.core.model;

/**
 * Aggregate figures describing a workbook's calculation graph.
 *
 * @param sheetCount sheets in the workbook
 * @param populatedCells non-empty cells
 * @param formulaCells cells holding a formula
 * @param literalCells cells holding a typed value
 * @param errorCells cells whose value is an error token
 * @param nodeCount graph nodes, including empty and missing ones
 * @param edgeCount distinct dependency edges
 * @param missingNodes referenced coordinates with no cell behind them
 * @param crossSheetEdges edges whose endpoints sit on different sheets
 * @param maxDepth longest dependency chain, in edges, outside cycles
 * @param maxFanIn largest number of precedents of one cell
 * @param maxFanOut largest number of dependents of one cell
 * @param cyclicComponents strongly-connected components that form a cycle
 * @param leafInputs non-formula cells that feed at least one formula
 * @param terminalOutputs formula cells nothing else references
 */
public record GraphStats(
    int sheetCount,
    int populatedCells,
    int formulaCells,
    int literalCells,
    int errorCells,
    int nodeCount,
    int edgeCount,
    int missingNodes,
    int crossSheetEdges,
    int maxDepth,
    int maxFanIn,
    int maxFanOut,
    int cyclicComponents,
    int leafInputs,
    int terminalOutputs
) {
    /**
     * Returns statistics for an empty workbook.
     *
     * @return all-zero statistics
     */
    public static GraphStats empty() {
        return new GraphStats(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    /**
     * Share of populated cells that hold a formula.
     *
     * @return ratio between 0 and 1
     */
    public double formulaDensity() {
        return populatedCells == 0 ? 0.0 : (double) formulaCells / populatedCells;
    }

    /**
     * Share of edges that cross a sheet boundary.
     *
     * @return ratio between 0 and 1
     */
    public double crossSheetEdgeRatio() {
        return edgeCount == 0 ? 0.0 : (double) crossSheetEdges / edgeCount;
    }
}

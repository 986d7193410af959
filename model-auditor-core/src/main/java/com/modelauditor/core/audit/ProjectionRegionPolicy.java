package com.modelauditor.core.audit;

import com.modelauditor.core.workbook.WorkbookSnapshot;

import java.util.Optional;

/**
 * Decides which columns of a sheet hold forecast periods.
 *
 * @see HeaderLabelProjectionPolicy
 */
@FunctionalInterface
public interface ProjectionRegionPolicy {

    /**
     * Locates the projection region of a sheet.
     *
     * @param workbook loaded workbook
     * @param sheet sheet name
     * @return region, or empty when the sheet shows no recognizable forecast columns
     */
    Optional<ProjectionRegion> locate(WorkbookSnapshot workbook, String sheet);
}

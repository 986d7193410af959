package com.modelauditor.core.report;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Lookup of the report generators registered on the class path.
 */
public final class ReportGenerators {

    private ReportGenerators() {
        // Utility class
    }

    /**
     * Discovers all generators, sorted by id.
     *
     * @return generators
     */
    public static List<ReportGenerator> discover() {
        List<ReportGenerator> generators = new ArrayList<>();
        ServiceLoader.load(ReportGenerator.class).forEach(generators::add);
        generators.sort(Comparator.comparing(ReportGenerator::getId));
        return generators;
    }

    /**
     * Finds a generator by id, ignoring case.
     *
     * @param id format id
     * @return generator, or empty when no generator has that id
     */
    public static Optional<ReportGenerator> find(String id) {
        String wanted = id.trim().toLowerCase(Locale.ROOT);
        return discover().stream().filter(g -> g.getId().equals(wanted)).findFirst();
    }
}

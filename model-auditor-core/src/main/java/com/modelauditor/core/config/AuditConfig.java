package com.modelauditor.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;

/**
 * Root configuration for an audit run.
 *
 * <p>Loaded from {@code modelauditor.yaml}. Every section and every setting is
 * optional; anything left out takes its default.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * detectors:
 *   mode: EXPLICIT
 *   enabled:
 *     - balance-sheet
 *     - hard-coded-plug
 *
 * parser:
 *   maxRangeCells: 50000
 *   parallelism: 4
 *
 * plugs:
 *   headerScanRows: 5
 *   excludedSheetKeywords: [raw, cache, data]
 *
 * balanceSheet:
 *   sheet: "BS"
 *   tolerance: 1.0
 *
 * output:
 *   directory: "./audit"
 *   formats: [markdown, json]
 *   historyFile: "audit_history.csv"
 * }</pre>
 *
 * @param detectors detector selection
 * @param parser formula parser settings
 * @param audit engine settings
 * @param plugs hard-coded plug heuristic settings
 * @param balanceSheet balance sheet check settings
 * @param output report output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditConfig(
    @JsonProperty("detectors") DetectorConfig detectors,
    @JsonProperty("parser") ParserConfig parser,
    @JsonProperty("audit") EngineConfig audit,
    @JsonProperty("plugs") PlugConfig plugs,
    @JsonProperty("balanceSheet") BalanceSheetConfig balanceSheet,
    @JsonProperty("output") OutputConfig output
) {
    public AuditConfig {
        detectors = detectors == null ? DetectorConfig.defaults() : detectors;
        parser = parser == null ? ParserConfig.defaults() : parser;
        audit = audit == null ? EngineConfig.defaults() : audit;
        plugs = plugs == null ? PlugConfig.defaults() : plugs;
        balanceSheet = balanceSheet == null ? BalanceSheetConfig.defaults() : balanceSheet;
        output = output == null ? OutputConfig.defaults() : output;
    }

    /**
     * Creates the default configuration: every detector enabled in AUTO mode.
     *
     * @return default configuration
     */
    public static AuditConfig defaults() {
        return new AuditConfig(null, null, null, null, null, null);
    }

    /**
     * Detector selection mode.
     */
    public enum DetectorMode {
        /** Run every discovered detector except the disabled ones. */
        AUTO,
        /** Run only the detectors listed under {@code enabled}. */
        EXPLICIT
    }

    /**
     * Detector selection.
     *
     * @param mode selection mode; inferred from {@code enabled} when absent
     * @param enabled detector ids to run (EXPLICIT mode)
     * @param disabled detector ids never to run
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DetectorConfig(
        @JsonProperty("mode") DetectorMode mode,
        @JsonProperty("enabled") List<String> enabled,
        @JsonProperty("disabled") List<String> disabled
    ) {
        public DetectorConfig {
            enabled = enabled == null ? List.of() : List.copyOf(enabled);
            disabled = disabled == null ? List.of() : List.copyOf(disabled);
        }

        public static DetectorConfig defaults() {
            return new DetectorConfig(null, null, null);
        }

        /**
         * Returns the mode in effect: the configured one, else EXPLICIT when an
         * enabled list is given, else AUTO.
         *
         * @return effective mode
         */
        public DetectorMode getEffectiveMode() {
            if (mode != null) {
                return mode;
            }
            return enabled.isEmpty() ? DetectorMode.AUTO : DetectorMode.EXPLICIT;
        }

        /**
         * Checks if a detector should run.
         *
         * @param detectorId detector id
         * @return true if enabled
         */
        public boolean isEnabled(String detectorId) {
            if (disabled.contains(detectorId)) {
                return false;
            }
            return switch (getEffectiveMode()) {
                case AUTO -> true;
                case EXPLICIT -> enabled.contains(detectorId);
            };
        }
    }

    /**
     * Formula parser settings.
     *
     * @param maxRangeCells cap on cells one range reference expands to
     * @param parallelism worker threads used to parse formulas; 1 parses inline
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ParserConfig(
        @JsonProperty("maxRangeCells") Integer maxRangeCells,
        @JsonProperty("parallelism") Integer parallelism
    ) {
        public ParserConfig {
            maxRangeCells = maxRangeCells == null || maxRangeCells < 1 ? 100_000 : maxRangeCells;
            parallelism = parallelism == null || parallelism < 1
                ? Math.max(1, Math.min(4, Runtime.getRuntime().availableProcessors()))
                : parallelism;
        }

        public static ParserConfig defaults() {
            return new ParserConfig(null, null);
        }
    }

    /**
     * Audit engine settings.
     *
     * @param parallel run detectors concurrently
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EngineConfig(
        @JsonProperty("parallel") Boolean parallel
    ) {
        public EngineConfig {
            parallel = parallel != null && parallel;
        }

        public static EngineConfig defaults() {
            return new EngineConfig(null);
        }
    }

    /**
     * Hard-coded plug heuristic settings.
     *
     * @param headerScanRows rows scanned from the top of a sheet for period labels
     * @param minFormulaCells formulas a projection row needs before it is checked
     * @param patternTolerance relative tolerance for matching a literal to the row's trend
     * @param excludedSheetKeywords sheets whose name contains one of these are skipped
     * @param historicalMarkers label markers of actual periods
     * @param projectionMarkers label markers of forecast periods
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PlugConfig(
        @JsonProperty("headerScanRows") Integer headerScanRows,
        @JsonProperty("minFormulaCells") Integer minFormulaCells,
        @JsonProperty("patternTolerance") Double patternTolerance,
        @JsonProperty("excludedSheetKeywords") List<String> excludedSheetKeywords,
        @JsonProperty("historicalMarkers") List<String> historicalMarkers,
        @JsonProperty("projectionMarkers") List<String> projectionMarkers
    ) {
        public PlugConfig {
            headerScanRows = headerScanRows == null || headerScanRows < 1 ? 5 : headerScanRows;
            minFormulaCells = minFormulaCells == null || minFormulaCells < 1 ? 3 : minFormulaCells;
            patternTolerance = patternTolerance == null || patternTolerance < 0 ? 0.005 : patternTolerance;
            excludedSheetKeywords = lower(excludedSheetKeywords, List.of("raw", "cache", "data"));
            historicalMarkers = lower(historicalMarkers, List.of("a", "actual", "actuals", "hist", "historical", "ltm"));
            projectionMarkers = lower(projectionMarkers,
                List.of("e", "f", "p", "b", "forecast", "projected", "projection", "budget", "plan", "est", "estimate"));
        }

        public static PlugConfig defaults() {
            return new PlugConfig(null, null, null, null, null, null);
        }
    }

    /**
     * Balance sheet integrity settings.
     *
     * @param sheet explicit balance sheet name; overrides the synonym search
     * @param sheetSynonyms name fragments identifying the balance sheet
     * @param assetsLabels labels of the total assets row
     * @param liabilitiesLabels labels of the total liabilities row
     * @param equityLabels labels of the total equity row
     * @param combinedLabels labels of a combined liabilities-and-equity row
     * @param labelColumns leftmost columns searched for labels
     * @param tolerance largest absolute imbalance accepted per period
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BalanceSheetConfig(
        @JsonProperty("sheet") String sheet,
        @JsonProperty("sheetSynonyms") List<String> sheetSynonyms,
        @JsonProperty("assetsLabels") List<String> assetsLabels,
        @JsonProperty("liabilitiesLabels") List<String> liabilitiesLabels,
        @JsonProperty("equityLabels") List<String> equityLabels,
        @JsonProperty("combinedLabels") List<String> combinedLabels,
        @JsonProperty("labelColumns") Integer labelColumns,
        @JsonProperty("tolerance") Double tolerance
    ) {
        public BalanceSheetConfig {
            sheetSynonyms = lower(sheetSynonyms, List.of("balance sheet", "balance", "bs", "statement of financial position"));
            assetsLabels = lower(assetsLabels, List.of("total assets"));
            liabilitiesLabels = lower(liabilitiesLabels, List.of("total liabilities"));
            equityLabels = lower(equityLabels, List.of("total equity", "total shareholders' equity",
                "total stockholders' equity", "total shareholders equity", "total stockholders equity"));
            combinedLabels = lower(combinedLabels, List.of("total liabilities and equity",
                "total liabilities & equity", "total liabilities and shareholders' equity",
                "total liabilities and stockholders' equity", "total liabilities & shareholders' equity"));
            labelColumns = labelColumns == null || labelColumns < 1 ? 2 : labelColumns;
            tolerance = tolerance == null || tolerance < 0 ? 1.0 : tolerance;
        }

        public static BalanceSheetConfig defaults() {
            return new BalanceSheetConfig(null, null, null, null, null, null, null, null);
        }
    }

    /**
     * Report output settings.
     *
     * @param directory directory reports are written to
     * @param formats report format ids
     * @param historyFile CSV file each audit appends a summary row to; null disables the log
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("formats") List<String> formats,
        @JsonProperty("historyFile") String historyFile
    ) {
        public OutputConfig {
            directory = directory == null || directory.isBlank() ? "./audit-report" : directory;
            formats = formats == null || formats.isEmpty() ? List.of("markdown") : List.copyOf(formats);
            historyFile = historyFile == null || historyFile.isBlank() ? null : historyFile;
        }

        public static OutputConfig defaults() {
            return new OutputConfig(null, null, null);
        }
    }

    private static List<String> lower(List<String> values, List<String> fallback) {
        List<String> source = values == null || values.isEmpty() ? fallback : values;
        return source.stream().map(v -> v.toLowerCase(Locale.ROOT).trim()).toList();
    }
}

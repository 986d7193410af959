package com.modelauditor.core.formula;

import com.modelauditor.core.model.CellAddresses;
import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.SpreadsheetError;
import com.modelauditor.core.workbook.UsedRange;
import com.modelauditor.core.workbook.WorkbookSnapshot;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the cells a formula depends on.
 *
 * <p>References are resolved against the workbook the formula belongs to:
 * <ul>
 *   <li>sheet names are matched ignoring case; a reference to a sheet the workbook
 *       does not have yields its top-left anchor cell, marked direct, so it shows up
 *       as a dangling pointer</li>
 *   <li>whole rows and columns are clipped to the sheet's used range</li>
 *   <li>explicit ranges are clipped to the used range; on a sheet with no content
 *       they are expanded as written</li>
 *   <li>3-D spans such as {@code Jan:Mar!B4} cover every sheet between the two ends
 *       in workbook order</li>
 *   <li>defined names are replaced by the references of their definition;
 *       names the workbook does not define are ignored</li>
 * </ul>
 *
 * <p>A parser created without a workbook treats every sheet name as valid and
 * expands explicit ranges as written.
 *
 * <p>Parsing never throws: text that cannot be tokenized yields no references and
 * a warning.
 */
public class FormulaParser {

    /** Default cap on cells produced by a single range reference. */
    public static final int DEFAULT_MAX_RANGE_CELLS = 100_000;

    private static final int MAX_NAME_DEPTH = 8;

    private static final Pattern CELL = Pattern.compile("\\$?([A-Za-z]{1,3})\\$?([0-9]+)");
    private static final Pattern COLUMNS = Pattern.compile("\\$?([A-Za-z]{1,3}):\\$?([A-Za-z]{1,3})");
    private static final Pattern ROWS = Pattern.compile("\\$?([0-9]+):\\$?([0-9]+)");
    private static final List<String> FUNCTION_PREFIXES = List.of("_XLFN.", "_XLWS.", "_XLUDF.");

    private final WorkbookSnapshot workbook;
    private final int maxRangeCells;

    /**
     * Creates a parser with no workbook context.
     */
    public FormulaParser() {
        this(null, DEFAULT_MAX_RANGE_CELLS);
    }

    /**
     * Creates a parser that resolves references against a workbook.
     *
     * @param workbook snapshot supplying sheet order, used ranges, defined names and
     *                 the external link table; may be null
     * @param maxRangeCells cap on the cells produced by one range reference
     */
    public FormulaParser(WorkbookSnapshot workbook, int maxRangeCells) {
        if (maxRangeCells < 1) {
            throw new IllegalArgumentException("maxRangeCells must be positive: " + maxRangeCells);
        }
        this.workbook = workbook;
        this.maxRangeCells = maxRangeCells;
    }

    /**
     * Parses one formula.
     *
     * @param formula formula text, with or without the leading {@code =}
     * @param sheet sheet holding the formula; unprefixed references resolve here
     * @return references, external references, error literals and called functions
     */
    public ParsedFormula parse(String formula, String sheet) {
        Collector out = new Collector();
        try {
            collect(formula, sheet, out, 0);
        } catch (FormulaParseException e) {
            return ParsedFormula.unparseable("Could not tokenize formula: " + e.getMessage());
        }
        return out.result();
    }

    private void collect(String formula, String sheet, Collector out, int depth) {
        for (Token token : FormulaTokenizer.tokenize(formula)) {
            switch (token.type()) {
                case REFERENCE -> resolveReference(token.text(), sheet, out, depth);
                case NAME -> resolveName(sheet, token.text(), out, depth);
                case ERROR -> SpreadsheetError.fromToken(token.text()).ifPresent(out.errors::add);
                case FUNCTION -> out.functions.add(normalizeFunction(token.text()));
                default -> {
                    // literals, operators and table references carry no cell dependency
                }
            }
        }
    }

    private void resolveReference(String text, String sheet, Collector out, int depth) {
        int bang = prefixEnd(text);
        String body = bang < 0 ? text : text.substring(bang + 1);
        if (bang < 0) {
            resolveBody(List.of(sheet), body, out, depth);
            return;
        }

        String prefix = unquote(text.substring(0, bang));
        int open = prefix.indexOf('[');
        if (open >= 0) {
            resolveExternal(prefix, open, body, sheet, out, depth);
            return;
        }
        if ("#REF!".equalsIgnoreCase(body)) {
            out.errors.add(SpreadsheetError.REF);
            return;
        }
        sheetsFor(prefix, body, out).ifPresent(sheets -> resolveBody(sheets, body, out, depth));
    }

    private void resolveExternal(String prefix, int open, String body, String sheet, Collector out, int depth) {
        int close = prefix.indexOf(']', open);
        String path = prefix.substring(0, open);
        String book = prefix.substring(open + 1, close < 0 ? prefix.length() : close);
        String externalSheet = close < 0 || close + 1 >= prefix.length() ? null : prefix.substring(close + 1);

        if (workbook != null && path.isEmpty() && book.chars().allMatch(Character::isDigit) && !book.isEmpty()) {
            int index = Integer.parseInt(book) - 1;
            if (index >= 0 && index < workbook.externalWorkbooks().size()) {
                book = workbook.externalWorkbooks().get(index);
            }
        }

        if (workbook != null && path.isEmpty() && book.equalsIgnoreCase(workbook.workbookName())) {
            // qualified with the workbook's own name
            if (externalSheet == null) {
                resolveName(sheet, body, out, depth);
            } else {
                sheetsFor(externalSheet, body, out).ifPresent(sheets -> resolveBody(sheets, body, out, depth));
            }
            return;
        }
        out.externals.add(new ExternalReference(path + book, externalSheet, body));
    }

    private Optional<List<String>> sheetsFor(String prefix, String body, Collector out) {
        int colon = prefix.indexOf(':');
        if (colon < 0) {
            return canonical(prefix, body, out).map(List::of);
        }

        String first = prefix.substring(0, colon);
        String last = prefix.substring(colon + 1);
        Optional<String> start = canonical(first, body, out);
        Optional<String> end = canonical(last, body, out);
        if (start.isEmpty() || end.isEmpty()) {
            return Optional.empty();
        }
        if (workbook == null) {
            return Optional.of(start.get().equals(end.get()) ? List.of(start.get()) : List.of(start.get(), end.get()));
        }
        List<String> order = workbook.sheetNames();
        int from = order.indexOf(start.get());
        int to = order.indexOf(end.get());
        return Optional.of(List.copyOf(order.subList(Math.min(from, to), Math.max(from, to) + 1)));
    }

    private Optional<String> canonical(String name, String body, Collector out) {
        if (workbook == null) {
            return Optional.of(name);
        }
        Optional<String> resolved = workbook.canonicalSheet(name);
        if (resolved.isEmpty()) {
            anchor(name, body).ifPresent(out::addDirect);
        }
        return resolved;
    }

    private void resolveBody(List<String> sheets, String body, Collector out, int depth) {
        Matcher cell = CELL.matcher(body);
        Matcher columns = COLUMNS.matcher(body);
        Matcher rows = ROWS.matcher(body);
        int colon = body.indexOf(':');

        if (colon < 0 && cell.matches()) {
            int column = CellAddresses.columnIndex(cell.group(1));
            int row = parseRow(cell.group(2));
            if (column > 0 && row > 0) {
                for (String sheet : sheets) {
                    out.addDirect(new CellRef(sheet, row, column));
                }
                return;
            }
        } else if (colon > 0 && CELL.matcher(body.substring(0, colon)).matches()
            && CELL.matcher(body.substring(colon + 1)).matches()) {
            Matcher from = CELL.matcher(body.substring(0, colon));
            Matcher to = CELL.matcher(body.substring(colon + 1));
            from.matches();
            to.matches();
            int c1 = CellAddresses.columnIndex(from.group(1));
            int c2 = CellAddresses.columnIndex(to.group(1));
            int r1 = parseRow(from.group(2));
            int r2 = parseRow(to.group(2));
            if (c1 > 0 && c2 > 0 && r1 > 0 && r2 > 0) {
                for (String sheet : sheets) {
                    addArea(sheet, Math.min(r1, r2), Math.min(c1, c2), Math.max(r1, r2), Math.max(c1, c2), false, body, out);
                }
                return;
            }
        } else if (columns.matches()) {
            int c1 = CellAddresses.columnIndex(columns.group(1));
            int c2 = CellAddresses.columnIndex(columns.group(2));
            if (c1 > 0 && c2 > 0) {
                for (String sheet : sheets) {
                    addArea(sheet, 1, Math.min(c1, c2), CellAddresses.MAX_ROW, Math.max(c1, c2), true, body, out);
                }
                return;
            }
        } else if (rows.matches()) {
            int r1 = parseRow(rows.group(1));
            int r2 = parseRow(rows.group(2));
            if (r1 > 0 && r2 > 0) {
                for (String sheet : sheets) {
                    addArea(sheet, Math.min(r1, r2), 1, Math.max(r1, r2), CellAddresses.MAX_COLUMN, true, body, out);
                }
                return;
            }
        }

        // sheet-qualified defined name
        for (String sheet : sheets) {
            resolveName(sheet, body, out, depth);
        }
    }

    private void addArea(String sheet, int r1, int c1, int r2, int c2, boolean whole, String text, Collector out) {
        Optional<UsedRange> used = workbook == null ? Optional.empty() : workbook.usedRange(sheet);
        int top = r1;
        int left = c1;
        int bottom = r2;
        int right = c2;
        if (used.isPresent()) {
            UsedRange range = used.get();
            top = Math.max(top, range.firstRow());
            left = Math.max(left, range.firstColumn());
            bottom = Math.min(bottom, range.lastRow());
            right = Math.min(right, range.lastColumn());
            if (top > bottom || left > right) {
                return;
            }
        } else if (whole) {
            return;
        }

        long cells = (long) (bottom - top + 1) * (right - left + 1);
        if (cells > maxRangeCells) {
            out.warnings.add(String.format("Range %s!%s covers %d cells; only the first %d were kept",
                CellAddresses.quoteSheet(sheet), text, cells, maxRangeCells));
        }
        int added = 0;
        for (int row = top; row <= bottom && added < maxRangeCells; row++) {
            for (int column = left; column <= right && added < maxRangeCells; column++) {
                out.refs.add(new CellRef(sheet, row, column));
                added++;
            }
        }
    }

    private void resolveName(String sheet, String name, Collector out, int depth) {
        if (workbook == null) {
            return;
        }
        Optional<String> definition = workbook.definedName(sheet, name);
        if (definition.isEmpty()) {
            return;
        }
        if (depth >= MAX_NAME_DEPTH) {
            out.warnings.add("Defined name " + name + " is nested too deeply to resolve");
            return;
        }
        try {
            collect(definition.get(), sheet, out, depth + 1);
        } catch (FormulaParseException e) {
            out.warnings.add("Defined name " + name + " could not be parsed: " + e.getMessage());
        }
    }

    private static Optional<CellRef> anchor(String sheet, String body) {
        Matcher cell = CELL.matcher(body.contains(":") ? body.substring(0, body.indexOf(':')) : body);
        if (cell.matches()) {
            int column = CellAddresses.columnIndex(cell.group(1));
            int row = parseRow(cell.group(2));
            if (column > 0 && row > 0) {
                return Optional.of(new CellRef(sheet, row, column));
            }
        }
        Matcher columns = COLUMNS.matcher(body);
        if (columns.matches()) {
            int column = CellAddresses.columnIndex(columns.group(1));
            return column > 0 ? Optional.of(new CellRef(sheet, 1, column)) : Optional.empty();
        }
        Matcher rows = ROWS.matcher(body);
        if (rows.matches()) {
            int row = parseRow(rows.group(1));
            return row > 0 ? Optional.of(new CellRef(sheet, row, 1)) : Optional.empty();
        }
        return Optional.empty();
    }

    private static int parseRow(String digits) {
        if (digits.length() > 7) {
            return -1;
        }
        int row = Integer.parseInt(digits);
        return row >= 1 && row <= CellAddresses.MAX_ROW ? row : -1;
    }

    /**
     * Returns the index of the {@code !} that ends the sheet prefix, or -1.
     */
    static int prefixEnd(String text) {
        if (text.startsWith("'")) {
            int i = 1;
            while (i < text.length()) {
                if (text.charAt(i) == '\'') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                        i += 2;
                        continue;
                    }
                    return i + 1 < text.length() && text.charAt(i + 1) == '!' ? i + 1 : -1;
                }
                i++;
            }
            return -1;
        }
        int from = text.startsWith("[") ? Math.max(0, text.indexOf(']')) : 0;
        return text.indexOf('!', from);
    }

    private static String unquote(String prefix) {
        if (prefix.length() >= 2 && prefix.startsWith("'") && prefix.endsWith("'")) {
            return prefix.substring(1, prefix.length() - 1).replace("''", "'");
        }
        return prefix;
    }

    private static String normalizeFunction(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        for (String prefix : FUNCTION_PREFIXES) {
            if (upper.startsWith(prefix)) {
                return upper.substring(prefix.length());
            }
        }
        return upper;
    }

    private static final class Collector {
        private final Set<CellRef> refs = new LinkedHashSet<>();
        private final Set<CellRef> direct = new HashSet<>();
        private final Set<ExternalReference> externals = new LinkedHashSet<>();
        private final Set<SpreadsheetError> errors = new LinkedHashSet<>();
        private final Set<String> functions = new LinkedHashSet<>();
        private final List<String> warnings = new ArrayList<>();

        void addDirect(CellRef ref) {
            refs.add(ref);
            direct.add(ref);
        }

        ParsedFormula result() {
            Optional<String> warning = warnings.isEmpty() ? Optional.empty() : Optional.of(String.join("; ", warnings));
            return new ParsedFormula(new ArrayList<>(refs), direct, new ArrayList<>(externals),
                new ArrayList<>(errors), new ArrayList<>(functions), warning);
        }
    }
}

package com.modelauditor.core.formula;

import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.SpreadsheetError;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * What a formula refers to.
 *
 * @param references precedent cells in order of first appearance, without duplicates
 * @param directReferences subset of {@code references} written as single cells (or
 *                         anchors of references to sheets that do not exist);
 *                         an absent direct reference is a dangling pointer
 * @param externalReferences references into other workbooks
 * @param errorLiterals error tokens written into the formula text, such as {@code #REF!}
 * @param functions called function names, upper-case, without {@code _xlfn.} prefixes
 * @param warning set when the formula could not be fully understood
 */
public record ParsedFormula(
    List<CellRef> references,
    Set<CellRef> directReferences,
    List<ExternalReference> externalReferences,
    List<SpreadsheetError> errorLiterals,
    List<String> functions,
    Optional<String> warning
) {
    public ParsedFormula {
        references = List.copyOf(references);
        directReferences = Set.copyOf(directReferences);
        externalReferences = List.copyOf(externalReferences);
        errorLiterals = List.copyOf(errorLiterals);
        functions = List.copyOf(functions);
        warning = warning == null ? Optional.empty() : warning;
    }

    /**
     * Result for a formula that could not be tokenized.
     *
     * @param message reason
     * @return result with no references
     */
    public static ParsedFormula unparseable(String message) {
        return new ParsedFormula(List.of(), Set.of(), List.of(), List.of(), List.of(), Optional.of(message));
    }

    public boolean hasWarning() {
        return warning.isPresent();
    }

    public boolean isDirect(CellRef ref) {
        return directReferences.contains(ref);
    }
}

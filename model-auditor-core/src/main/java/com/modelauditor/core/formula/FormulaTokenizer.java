package com.modelauditor.core.formula;

import com.modelauditor.core.model.SpreadsheetError;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits spreadsheet formula text into {@link Token}s.
 *
 * <p>Recognizes string, number, boolean and error literals, operators, parentheses,
 * argument separators ({@code ,} and {@code ;}), array constants, function calls
 * (dotted and {@code _xlfn.} prefixed names included), table references and cell
 * references with their optional sheet, 3-D span or external workbook prefix.
 *
 * <p>Whitespace is dropped. Parentheses, braces and brackets must balance.
 */
public final class FormulaTokenizer {

    private static final String SHEET_CHARS = "[\\p{L}\\p{N}_.\\\\]";
    private static final String QUOTED_SHEET = "'(?:[^']|'')+'";
    private static final String UNQUOTED_SHEET =
        "(?:\\[[^\\]]+\\])?" + SHEET_CHARS + "+(?::" + SHEET_CHARS + "+)?";
    private static final String PREFIX = "(?:" + QUOTED_SHEET + "|" + UNQUOTED_SHEET + ")!";
    private static final String CELL = "\\$?[A-Za-z]{1,3}\\$?[0-9]+";
    private static final String AREA = CELL + "(?::" + CELL + ")?"
        + "|\\$?[A-Za-z]{1,3}:\\$?[A-Za-z]{1,3}"
        + "|\\$?[0-9]+:\\$?[0-9]+";
    private static final String NAME = "[\\p{L}_\\\\][\\p{L}\\p{N}_.?]*";
    private static final String END = "(?![\\p{L}\\p{N}_.(!\\[])";

    private static final Pattern AREA_REFERENCE = Pattern.compile("(?:" + PREFIX + ")?(?:" + AREA + ")" + END);
    private static final Pattern PREFIXED_NAME = Pattern.compile(PREFIX + NAME + "(?![\\p{L}\\p{N}_.(])");
    private static final Pattern EXTERNAL_NAME = Pattern.compile("\\[[^\\]]+\\]!" + NAME + "(?![\\p{L}\\p{N}_.(])");
    private static final Pattern PREFIXED_REF_ERROR = Pattern.compile(PREFIX + "#REF!", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER = Pattern.compile("(?:[0-9]+\\.?[0-9]*|\\.[0-9]+)(?:[eE][-+]?[0-9]+)?");
    private static final Pattern WORD = Pattern.compile(NAME);

    private static final List<String> ERROR_TOKENS = Arrays.stream(SpreadsheetError.values())
        .map(SpreadsheetError::token)
        .sorted(Comparator.comparingInt(String::length).reversed())
        .toList();

    private FormulaTokenizer() {
        // Utility class
    }

    /**
     * Tokenizes a formula. A leading {@code =} is skipped.
     *
     * @param formula formula text
     * @return tokens in source order
     * @throws FormulaParseException if the text is not a well-formed formula
     */
    public static List<Token> tokenize(String formula) {
        if (formula == null) {
            throw new FormulaParseException("Formula is null", 0);
        }
        String body = formula.startsWith("=") ? formula.substring(1) : formula;
        List<Token> tokens = new ArrayList<>();
        Deque<Character> open = new ArrayDeque<>();
        int i = 0;
        int length = body.length();

        while (i < length) {
            char c = body.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            int end = matchReference(body, i);
            if (end > i) {
                tokens.add(new Token(TokenType.REFERENCE, body.substring(i, end), i));
                i = end;
                continue;
            }

            switch (c) {
                case '"' -> i = readString(body, i, tokens);
                case '#' -> i = readError(body, i, tokens);
                case '(' -> {
                    open.push('(');
                    tokens.add(new Token(TokenType.OPEN_PAREN, "(", i++));
                }
                case ')' -> {
                    expectOpen(open, '(', i);
                    tokens.add(new Token(TokenType.CLOSE_PAREN, ")", i++));
                }
                case '{' -> {
                    open.push('{');
                    tokens.add(new Token(TokenType.ARRAY_OPEN, "{", i++));
                }
                case '}' -> {
                    expectOpen(open, '{', i);
                    tokens.add(new Token(TokenType.ARRAY_CLOSE, "}", i++));
                }
                case ',', ';' -> tokens.add(new Token(TokenType.SEPARATOR, String.valueOf(c), i++));
                case '[' -> {
                    int close = matchBracket(body, i);
                    tokens.add(new Token(TokenType.STRUCTURED_REFERENCE, body.substring(i, close), i));
                    i = close;
                }
                case '<', '>' -> {
                    boolean pair = i + 1 < length && (body.charAt(i + 1) == '=' || (c == '<' && body.charAt(i + 1) == '>'));
                    int width = pair ? 2 : 1;
                    tokens.add(new Token(TokenType.OPERATOR, body.substring(i, i + width), i));
                    i += width;
                }
                case '+', '-', '*', '/', '^', '&', '=', '%', ':', '@' ->
                    tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c), i++));
                case '\'' -> throw new FormulaParseException("Malformed quoted sheet reference", i);
                default -> {
                    if (Character.isDigit(c) || c == '.') {
                        i = readNumber(body, i, tokens);
                    } else if (Character.isLetter(c) || c == '_' || c == '\\') {
                        i = readWord(body, i, tokens);
                    } else {
                        throw new FormulaParseException("Unexpected character '" + c + "'", i);
                    }
                }
            }
        }

        if (!open.isEmpty()) {
            throw new FormulaParseException("Unclosed '" + open.peek() + "'", length);
        }
        return tokens;
    }

    private static int matchReference(String body, int start) {
        char c = body.charAt(start);
        if (!(Character.isLetterOrDigit(c) || c == '$' || c == '\'' || c == '[' || c == '_' || c == '\\')) {
            return start;
        }
        for (Pattern pattern : List.of(AREA_REFERENCE, PREFIXED_REF_ERROR, PREFIXED_NAME, EXTERNAL_NAME)) {
            Matcher matcher = pattern.matcher(body).region(start, body.length());
            if (matcher.lookingAt()) {
                return matcher.end();
            }
        }
        return start;
    }

    private static int readString(String body, int start, List<Token> tokens) {
        StringBuilder text = new StringBuilder();
        int i = start + 1;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '"') {
                if (i + 1 < body.length() && body.charAt(i + 1) == '"') {
                    text.append('"');
                    i += 2;
                    continue;
                }
                tokens.add(new Token(TokenType.STRING, text.toString(), start));
                return i + 1;
            }
            text.append(c);
            i++;
        }
        throw new FormulaParseException("Unterminated string literal", start);
    }

    private static int readError(String body, int start, List<Token> tokens) {
        String rest = body.substring(start).toUpperCase(Locale.ROOT);
        for (String error : ERROR_TOKENS) {
            if (rest.startsWith(error)) {
                tokens.add(new Token(TokenType.ERROR, error, start));
                return start + error.length();
            }
        }
        // Spill-range operator, as in A1#
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).is(TokenType.REFERENCE)) {
            tokens.add(new Token(TokenType.OPERATOR, "#", start));
            return start + 1;
        }
        throw new FormulaParseException("Unknown error literal", start);
    }

    private static int readNumber(String body, int start, List<Token> tokens) {
        Matcher matcher = NUMBER.matcher(body).region(start, body.length());
        if (!matcher.lookingAt()) {
            throw new FormulaParseException("Malformed number", start);
        }
        tokens.add(new Token(TokenType.NUMBER, matcher.group(), start));
        return matcher.end();
    }

    private static int readWord(String body, int start, List<Token> tokens) {
        Matcher matcher = WORD.matcher(body).region(start, body.length());
        if (!matcher.lookingAt()) {
            throw new FormulaParseException("Malformed name", start);
        }
        String word = matcher.group();
        int end = matcher.end();
        int next = skipWhitespace(body, end);

        if (next < body.length() && body.charAt(next) == '(') {
            tokens.add(new Token(TokenType.FUNCTION, word.toUpperCase(Locale.ROOT), start));
            return end;
        }
        if (end < body.length() && body.charAt(end) == '[') {
            int close = matchBracket(body, end);
            tokens.add(new Token(TokenType.STRUCTURED_REFERENCE, body.substring(start, close), start));
            return close;
        }
        if ("TRUE".equalsIgnoreCase(word) || "FALSE".equalsIgnoreCase(word)) {
            tokens.add(new Token(TokenType.BOOLEAN, word.toUpperCase(Locale.ROOT), start));
            return end;
        }
        tokens.add(new Token(TokenType.NAME, word, start));
        return end;
    }

    private static int matchBracket(String body, int start) {
        int depth = 0;
        for (int i = start; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\'' && i + 1 < body.length()) {
                // escaped special character inside a table column name
                i++;
            } else if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        throw new FormulaParseException("Unclosed '['", start);
    }

    private static void expectOpen(Deque<Character> open, char expected, int position) {
        if (open.isEmpty() || open.peek() != expected) {
            throw new FormulaParseException("Unbalanced '" + (expected == '(' ? ')' : '}') + "'", position);
        }
        open.pop();
    }

    private static int skipWhitespace(String body, int start) {
        int i = start;
        while (i < body.length() && Character.isWhitespace(body.charAt(i))) {
            i++;
        }
        return i;
    }
}

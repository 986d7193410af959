package com.modelauditor.core.model;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Value held by a cell in the evaluated snapshot.
 *
 * <p>Workbooks carry no schema: one column can mix numbers, labels, flags and error
 * tokens. Each variant reports its {@link ValueType} so callers can switch over
 * {@link #type()} exhaustively instead of probing with {@code instanceof}.
 */
public sealed interface TypedValue
    permits TypedValue.NumberValue, TypedValue.TextValue, TypedValue.BooleanValue,
            TypedValue.ErrorValue, TypedValue.EmptyValue {

    /** Shared empty instance. */
    EmptyValue EMPTY = new EmptyValue();

    /**
     * Returns the variant tag.
     *
     * @return value type
     */
    ValueType type();

    /**
     * Returns the value as text the way a report would show it.
     *
     * @return display text, empty string for {@link EmptyValue}
     */
    String display();

    /**
     * Returns the numeric value for {@link NumberValue}, empty otherwise.
     *
     * @return number or empty
     */
    default OptionalDouble asNumber() {
        return OptionalDouble.empty();
    }

    /**
     * Returns true for {@link EmptyValue}.
     *
     * @return true when the cell holds nothing
     */
    default boolean isEmpty() {
        return type() == ValueType.EMPTY;
    }

    static TypedValue number(double value) {
        return new NumberValue(value);
    }

    static TypedValue text(String value) {
        return new TextValue(value);
    }

    static TypedValue bool(boolean value) {
        return new BooleanValue(value);
    }

    static TypedValue error(SpreadsheetError error) {
        return new ErrorValue(error);
    }

    /**
     * Numeric cell value.
     *
     * @param value the number
     */
    record NumberValue(double value) implements TypedValue {
        @Override
        public ValueType type() {
            return ValueType.NUMBER;
        }

        @Override
        public String display() {
            if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
                return Long.toString((long) value);
            }
            return Double.toString(value);
        }

        @Override
        public OptionalDouble asNumber() {
            return OptionalDouble.of(value);
        }
    }

    /**
     * Text cell value.
     *
     * @param value the text
     */
    record TextValue(String value) implements TypedValue {
        public TextValue {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public ValueType type() {
            return ValueType.TEXT;
        }

        @Override
        public String display() {
            return value;
        }
    }

    /**
     * Boolean cell value.
     *
     * @param value the flag
     */
    record BooleanValue(boolean value) implements TypedValue {
        @Override
        public ValueType type() {
            return ValueType.BOOLEAN;
        }

        @Override
        public String display() {
            return value ? "TRUE" : "FALSE";
        }
    }

    /**
     * Error token stored in place of a value.
     *
     * @param error the error
     */
    record ErrorValue(SpreadsheetError error) implements TypedValue {
        public ErrorValue {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public ValueType type() {
            return ValueType.ERROR;
        }

        @Override
        public String display() {
            return error.token();
        }
    }

    /**
     * Blank cell.
     */
    record EmptyValue() implements TypedValue {
        @Override
        public ValueType type() {
            return ValueType.EMPTY;
        }

        @Override
        public String display() {
            return "";
        }
    }
}

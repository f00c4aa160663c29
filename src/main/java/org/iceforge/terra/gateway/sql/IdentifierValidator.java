package org.iceforge.terra.gateway.sql;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Whitelist checks for anything that ends up in identifier position, plus size and
 * character checks for filter values. Never throws; callers decide how to surface a rejection.
 */
public final class IdentifierValidator {

    public static final int MAX_COLUMN_LENGTH = 100;
    public static final int MAX_FILE_ID_LENGTH = 200;
    public static final int MAX_STRING_LENGTH = 500;
    public static final int MAX_LIST_ITEMS = 100;

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z0-9_.-]+$");
    private static final Pattern DANGEROUS_VALUE = Pattern.compile("[;'\"\\\\]");

    private static final Set<String> RESERVED = Set.of(
            "select", "from", "where", "insert", "update", "delete",
            "drop", "create", "alter", "exec", "execute", "union");

    private IdentifierValidator() {
    }

    public static ValidationResult validateColumn(String name) {
        return validate(name, MAX_COLUMN_LENGTH, "Column name");
    }

    public static ValidationResult validateFileId(String fileId) {
        return validate(fileId, MAX_FILE_ID_LENGTH, "file_id");
    }

    public static ValidationResult validate(String name, int maxLength, String what) {
        if (name == null || name.isEmpty()) {
            return ValidationResult.invalid(what + " must be a non-empty string");
        }
        if (name.length() > maxLength) {
            return ValidationResult.invalid(what + " too long (max " + maxLength + " characters)");
        }
        if (name.contains("..") || name.contains("/") || name.contains("\\")) {
            return ValidationResult.invalid(what + " contains a path traversal sequence: " + name);
        }
        if (!IDENTIFIER.matcher(name).matches()) {
            return ValidationResult.invalid(what + " contains invalid characters (only alphanumeric, _, -, . allowed): " + name);
        }
        if (RESERVED.contains(name.toLowerCase(Locale.ROOT))) {
            return ValidationResult.invalid(what + " cannot be SQL keyword: " + name);
        }
        return ValidationResult.valid();
    }

    public static ValidationResult validateFilterValue(Object value) {
        return validateFilterValue(value, MAX_STRING_LENGTH, MAX_LIST_ITEMS);
    }

    public static ValidationResult validateFilterValue(Object value, int maxStringLength, int maxListItems) {
        if (value instanceof List<?> list) {
            if (list.size() > maxListItems) {
                return ValidationResult.invalid("Filter list too large (max " + maxListItems + " items)");
            }
            for (Object item : list) {
                ValidationResult r = validateScalar(item, maxStringLength);
                if (!r.ok()) {
                    return r;
                }
            }
            return ValidationResult.valid();
        }
        return validateScalar(value, maxStringLength);
    }

    private static ValidationResult validateScalar(Object value, int maxStringLength) {
        if (value instanceof String s) {
            if (s.length() > maxStringLength) {
                return ValidationResult.invalid("Filter value too long (max " + maxStringLength + " chars)");
            }
            if (DANGEROUS_VALUE.matcher(s).find()) {
                return ValidationResult.invalid("Filter value contains potentially dangerous characters");
            }
        }
        return ValidationResult.valid();
    }

    public record ValidationResult(boolean ok, String error) {
        static ValidationResult valid() {
            return new ValidationResult(true, null);
        }

        static ValidationResult invalid(String error) {
            return new ValidationResult(false, error);
        }
    }
}

package org.iceforge.terra.gateway.sql;

import org.iceforge.terra.gateway.engine.QueryException;

import java.util.Objects;

/**
 * A column or table name that has passed {@link IdentifierValidator}. The SQL builders only
 * accept this type in identifier positions, so unvalidated text cannot reach statement text.
 */
public final class Identifier {

    private final String name;

    private Identifier(String name) {
        this.name = name;
    }

    public static Identifier column(String name) {
        IdentifierValidator.ValidationResult r = IdentifierValidator.validateColumn(name);
        if (!r.ok()) {
            throw QueryException.validation("Invalid column name '" + name + "': " + r.error());
        }
        return new Identifier(name);
    }

    public static Identifier table(String name) {
        IdentifierValidator.ValidationResult r =
                IdentifierValidator.validate(name, IdentifierValidator.MAX_FILE_ID_LENGTH, "Table name");
        if (!r.ok()) {
            throw QueryException.validation("Invalid table name '" + name + "': " + r.error());
        }
        return new Identifier(name);
    }

    /**
     * Derives {@code <name>_<suffix>} for generated aliases. Both parts are already safe.
     */
    Identifier derive(String suffix) {
        return new Identifier(name + "_" + suffix);
    }

    public String name() {
        return name;
    }

    /**
     * Double-quoted form. The whitelist excludes quotes, so no escaping is needed.
     */
    public String quoted() {
        return '"' + name + '"';
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Identifier other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return name;
    }
}

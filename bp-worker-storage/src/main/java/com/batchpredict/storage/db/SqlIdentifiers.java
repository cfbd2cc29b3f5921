package com.batchpredict.storage.db;

import java.util.regex.Pattern;

/** Table and column names are interpolated into SQL, so only plain identifiers are accepted. */
public final class SqlIdentifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private SqlIdentifiers() {
    }

    public static boolean isValid(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    /**
     * @return {@code name} unchanged
     * @throws IllegalArgumentException if it is not a plain identifier
     */
    public static String require(String name, String what) {
        if (!isValid(name)) {
            throw new IllegalArgumentException("Invalid SQL identifier for " + what + ": " + name);
        }
        return name;
    }
}

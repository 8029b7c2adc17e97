package com.tenantoptions.database.trigger;

import com.tenantoptions.model.DatabaseVendor;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Deterministic trigger names and identifier quoting.
 *
 * <h2>Naming</h2>
 *
 * <p>A selection table {@code tasks_taskpriorityselection} yields the base name
 * {@code tasks_taskpriorityselection_tenant_check}. The first ten hex characters of the base name's
 * SHA-1 are appended after the base has been cut to fit the vendor's identifier limit:
 *
 * <pre>{@code
 * TriggerNames.triggerName("tasks_taskpriorityselection", DatabaseVendor.ORACLE);
 * // -> "tasks_taskprioritys_" followed by ten hex characters
 * }</pre>
 *
 * <p>Names starting with a digit or an underscore get a {@code t} prefix.
 */
public final class TriggerNames {

    /** Number of hash characters appended to every trigger name. */
    public static final int HASH_LENGTH = 10;

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z0-9_.]+$");

    private TriggerNames() {}

    /**
     * Returns the trigger name guarding inserts into the given selection table.
     *
     * @throws IllegalArgumentException if the table name contains anything but letters, digits,
     *     underscores and dots
     */
    public static String triggerName(String selectionTable, DatabaseVendor vendor) {
        String table = validate(stripQuotes(selectionTable)).replace('.', '_');
        String base = table + "_tenant_check";
        String hash = sha1(base).substring(0, HASH_LENGTH);

        // The t prefix takes the place of the last character.
        String name = startsWithDigitOrUnderscore(base) ? "t" + base.substring(0, base.length() - 1) : base;
        int room = vendor.maxIdentifierLength() - HASH_LENGTH - 1;
        if (name.length() > room) {
            name = name.substring(0, room);
        }
        return name + "_" + hash;
    }

    /**
     * Quotes an identifier for the vendor, quoting each dotted part separately.
     *
     * <p>MySQL uses backticks, every other vendor double quotes.
     */
    public static String quote(String identifier, DatabaseVendor vendor) {
        String quote = vendor == DatabaseVendor.MYSQL ? "`" : "\"";
        return Arrays.stream(validate(stripQuotes(identifier)).split("\\."))
                .map(part -> quote + part + quote)
                .collect(Collectors.joining("."));
    }

    /**
     * Checks an identifier against {@code ^[a-zA-Z0-9_.]+$}.
     *
     * @return the identifier, unchanged
     * @throws IllegalArgumentException if it does not match
     */
    public static String validate(String identifier) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + identifier);
        }
        return identifier;
    }

    // ── Private Helpers ──

    private static String stripQuotes(String identifier) {
        if (identifier == null) {
            return null;
        }
        return identifier.replace("\"", "").replace("`", "").replace("[", "").replace("]", "");
    }

    private static boolean startsWithDigitOrUnderscore(String name) {
        char first = name.charAt(0);
        return first == '_' || Character.isDigit(first);
    }

    private static String sha1(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-1").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 is not available", e);
        }
    }
}

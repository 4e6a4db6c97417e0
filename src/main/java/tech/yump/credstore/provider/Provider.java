package tech.yump.credstore.provider;

import java.util.regex.Pattern;

/**
 * Identity of an external API vendor whose key is stored. Every stored secret is namespaced
 * by its provider as {@code secret_<id>}.
 *
 * @param id lowercase provider identifier, e.g. "openai".
 */
public record Provider(String id) {

    public static final String KEY_PREFIX = "secret_";
    public static final Pattern ID_PATTERN = Pattern.compile("[a-z0-9][a-z0-9_-]{0,31}");

    public Provider {
        if (id == null || !ID_PATTERN.matcher(id).matches()) {
            throw new IllegalArgumentException("Invalid provider id: " + id);
        }
    }

    /**
     * @return the key this provider's secret is stored under in every backend.
     */
    public String storageKey() {
        return KEY_PREFIX + id;
    }

    @Override
    public String toString() {
        return id;
    }
}

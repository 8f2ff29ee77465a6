package org.tova.compiler.internal.i18n;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Analyzer diagnostic texts, read from the {@code compiler_messages} bundle.
 * <p>
 * Diagnostics are matched by tests and editor tooling, so only the root bundle is shipped
 * and the texts are always English.
 */
public final class Messages {

    private static final String BUNDLE = "compiler_messages";
    private static final ResourceBundle MESSAGES = ResourceBundle.getBundle(BUNDLE, Locale.ROOT);

    private Messages() {}

    /**
     * @param key The message key.
     * @param args The message arguments.
     * @return The formatted message; the key itself in angle brackets if it is missing.
     */
    public static String get(String key, Object... args) {
        String pattern;
        try {
            pattern = MESSAGES.getString(key);
        } catch (MissingResourceException e) {
            return "<" + key + ">";
        }
        return args.length == 0 ? pattern.replace("''", "'") : new MessageFormat(pattern, Locale.ROOT).format(args);
    }

    /**
     * @param key The message key.
     * @return {@code true} if the bundle defines the key.
     */
    public static boolean has(String key) {
        return MESSAGES.containsKey(key);
    }
}

package org.tessera.compiler.internal.i18n;

import java.text.MessageFormat;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Lookup of the localized lexer messages in the {@code compiler_messages} bundle.
 * The bundle follows the default locale and falls back to English.
 */
public final class Messages {

    private static final ResourceBundle BUNDLE = ResourceBundle.getBundle("compiler_messages");

    private Messages() {}

    /**
     * Formats the message stored under {@code key}.
     * @param key The key of the message.
     * @param args The {@link MessageFormat} arguments.
     * @return The formatted message, or {@code !key!} if the bundle has no such key.
     */
    public static String get(String key, Object... args) {
        try {
            return MessageFormat.format(BUNDLE.getString(key), args);
        } catch (MissingResourceException e) {
            return "!" + key + "!";
        }
    }
}

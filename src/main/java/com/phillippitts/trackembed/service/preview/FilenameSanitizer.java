package com.phillippitts.trackembed.service.preview;

/**
 * Turns a {@code "name - artist"} key into a file-system-safe file stem.
 * Letters, digits, spaces, hyphens and underscores are kept; everything else becomes {@code '_'}.
 */
public final class FilenameSanitizer {

    private FilenameSanitizer() {}

    public static String sanitize(String key) {
        if (key == null || key.isEmpty()) {
            return "_";
        }
        StringBuilder sb = new StringBuilder(key.length());
        key.codePoints().forEach(cp -> {
            if (Character.isLetterOrDigit(cp) || cp == ' ' || cp == '-' || cp == '_') {
                sb.appendCodePoint(cp);
            } else {
                sb.append('_');
            }
        });
        return sb.toString();
    }
}

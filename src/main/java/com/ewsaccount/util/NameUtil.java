package com.ewsaccount.util;

/**
 * Address and display-name helpers
 */
public final class NameUtil {

    private NameUtil() {}

    /**
     * Strip angle brackets (<>) from an email address
     */
    public static String stripAngleBrackets(String email) {
        if (email == null) return null;
        String stripped = email.trim();
        if (stripped.startsWith("<")) stripped = stripped.substring(1);
        if (stripped.endsWith(">")) stripped = stripped.substring(0, stripped.length() - 1);
        return stripped.trim();
    }

    /**
     * Check that an address has a local part and a domain separated by '@'
     */
    public static boolean isEmailAddress(String email) {
        return email != null && email.indexOf('@') > 0 && email.lastIndexOf('@') < email.length() - 1;
    }

    /**
     * Extract domain from an email address
     */
    public static String extractDomain(String email) {
        if (email == null || !email.contains("@")) return null;
        return email.substring(email.lastIndexOf('@') + 1).toLowerCase();
    }

    /**
     * Title-case a display name: every run of letters starts upper-case, the rest is lower-case.
     * "SENT items" -> "Sent Items", "junk e-mail" -> "Junk E-Mail".
     */
    public static String titleCase(String name) {
        if (name == null) return null;
        StringBuilder sb = new StringBuilder(name.length());
        boolean inWord = false;
        int i = 0;
        while (i < name.length()) {
            int cp = name.codePointAt(i);
            if (Character.isLetter(cp)) {
                sb.appendCodePoint(inWord ? Character.toLowerCase(cp) : Character.toTitleCase(cp));
                inWord = true;
            } else {
                sb.appendCodePoint(cp);
                inWord = false;
            }
            i += Character.charCount(cp);
        }
        return sb.toString();
    }
}

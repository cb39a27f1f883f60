package com.mqol.teamservice.domain;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Team slug rules: lower-case letters, digits and single hyphens, 2 to 100 characters.
 */
public final class Slugs {

    private static final Pattern VALID = Pattern.compile("^[a-z0-9]+(-[a-z0-9]+)*$");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final int MAX_LENGTH = 100;

    private Slugs() {
        // utility class
    }

    /**
     * Derives a slug from a display name, e.g. "Acme Clinic (North)" becomes "acme-clinic-north".
     *
     * @throws IllegalArgumentException if the name contains no letters or digits
     */
    public static String fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name must not be null");
        }
        String ascii = Normalizer.normalize(name, Normalizer.Form.NFD)
                .replaceAll("\\p{M}", "")
                .toLowerCase(Locale.ROOT);
        String slug = NON_ALNUM.matcher(ascii).replaceAll("-").replaceAll("^-+|-+$", "");
        if (slug.length() > MAX_LENGTH) {
            slug = slug.substring(0, MAX_LENGTH).replaceAll("-+$", "");
        }
        return requireValid(slug);
    }

    /**
     * @throws IllegalArgumentException if the slug breaks the rules
     */
    public static String requireValid(String slug) {
        if (slug == null || slug.length() < 2 || slug.length() > MAX_LENGTH || !VALID.matcher(slug).matches()) {
            throw new IllegalArgumentException(
                    "Invalid team slug '%s': use 2-100 lower-case letters, digits and hyphens".formatted(slug));
        }
        return slug;
    }
}

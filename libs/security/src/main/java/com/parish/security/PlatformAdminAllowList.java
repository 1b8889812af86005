package com.parish.security;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable set of platform operator emails. Built once from configuration and injected
 * wherever platform-admin status has to be decided.
 *
 * @param emails normalized emails
 */
public record PlatformAdminAllowList(Set<String> emails) {

    public PlatformAdminAllowList {
        emails = emails == null ? Set.of() : emails.stream()
                .map(PlatformAdminAllowList::normalize)
                .filter(email -> !email.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Builds an allow-list from raw configured values.
     */
    public static PlatformAdminAllowList of(Collection<String> emails) {
        return new PlatformAdminAllowList(emails == null ? Set.of() : new HashSet<>(emails));
    }

    /**
     * Checks whether the email belongs to a platform operator, ignoring case and
     * surrounding whitespace.
     */
    public boolean contains(String email) {
        return email != null && emails.contains(normalize(email));
    }

    /**
     * Trims and lower-cases an email. Null becomes the empty string.
     */
    public static String normalize(String email) {
        return email == null ? "" : email.strip().toLowerCase(Locale.ROOT);
    }
}

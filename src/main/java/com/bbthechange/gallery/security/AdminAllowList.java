package com.bbthechange.gallery.security;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable set of administrator e-mail addresses, compared case-insensitively.
 */
public final class AdminAllowList {

    private final Set<String> emails;

    public AdminAllowList(Collection<String> emails) {
        this.emails = emails == null ? Set.of() : emails.stream()
            .filter(e -> e != null && !e.isBlank())
            .map(AdminAllowList::normalize)
            .collect(Collectors.toUnmodifiableSet());
    }

    public boolean contains(String email) {
        return email != null && emails.contains(normalize(email));
    }

    public int size() {
        return emails.size();
    }

    private static String normalize(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}

package com.deepansh.honeypot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The five evidence sets harvested from a conversation.
 *
 * Sets keep first-seen order so reports read in the order the scammer
 * revealed things. Entries are trimmed; blanks are never stored.
 * Equality is set equality, so order does not matter when comparing.
 */
@Data
@NoArgsConstructor
public class Evidence {

    private Set<String> bankAccounts = new LinkedHashSet<>();
    private Set<String> upiIds = new LinkedHashSet<>();
    private Set<String> phishingLinks = new LinkedHashSet<>();
    private Set<String> phoneNumbers = new LinkedHashSet<>();
    private Set<String> suspiciousKeywords = new LinkedHashSet<>();

    public static Evidence empty() {
        return new Evidence();
    }

    public static Evidence of(Collection<String> bankAccounts,
                              Collection<String> upiIds,
                              Collection<String> phishingLinks,
                              Collection<String> phoneNumbers,
                              Collection<String> suspiciousKeywords) {
        Evidence e = new Evidence();
        e.bankAccounts = clean(bankAccounts);
        e.upiIds = clean(upiIds);
        e.phishingLinks = clean(phishingLinks);
        e.phoneNumbers = clean(phoneNumbers);
        e.suspiciousKeywords = clean(suspiciousKeywords);
        return e;
    }

    /**
     * Set-union per field. Neither operand is modified; a null
     * {@code other} is treated as empty.
     */
    public Evidence union(Evidence other) {
        if (other == null) {
            return Evidence.of(bankAccounts, upiIds, phishingLinks, phoneNumbers, suspiciousKeywords);
        }
        Evidence merged = new Evidence();
        merged.bankAccounts = unionOf(bankAccounts, other.bankAccounts);
        merged.upiIds = unionOf(upiIds, other.upiIds);
        merged.phishingLinks = unionOf(phishingLinks, other.phishingLinks);
        merged.phoneNumbers = unionOf(phoneNumbers, other.phoneNumbers);
        merged.suspiciousKeywords = unionOf(suspiciousKeywords, other.suspiciousKeywords);
        return merged;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return isNullOrEmpty(bankAccounts) && isNullOrEmpty(upiIds) && isNullOrEmpty(phishingLinks)
                && isNullOrEmpty(phoneNumbers) && isNullOrEmpty(suspiciousKeywords);
    }

    public int size() {
        return sizeOf(bankAccounts) + sizeOf(upiIds) + sizeOf(phishingLinks)
                + sizeOf(phoneNumbers) + sizeOf(suspiciousKeywords);
    }

    private static Set<String> unionOf(Collection<String> left, Collection<String> right) {
        Set<String> result = clean(left);
        result.addAll(clean(right));
        return result;
    }

    private static Set<String> clean(Collection<String> values) {
        Set<String> result = new LinkedHashSet<>();
        if (values == null) return result;
        for (String v : values) {
            if (v == null) continue;
            String trimmed = v.trim();
            if (!trimmed.isEmpty()) result.add(trimmed);
        }
        return result;
    }

    private static boolean isNullOrEmpty(Collection<String> c) {
        return c == null || c.isEmpty();
    }

    private static int sizeOf(Collection<String> c) {
        return c == null ? 0 : c.size();
    }
}

package com.bhzfootball.agenda;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps any spelling of a monitored team to its canonical name.
 * <p>
 * Matching order:
 * <ul>
 *   <li>exact match of the normalized key against the alias table;</li>
 *   <li>the longest alias key contained in the input key (handles "Cruzeiro EC (MG)" and similar);</li>
 *   <li>best normalized Levenshtein similarity at or above {@link #SIMILARITY_THRESHOLD};</li>
 *   <li>otherwise the trimmed input, unchanged.</li>
 * </ul>
 * An unrecognized team is valid output, it is simply not canonicalized. The mapping is idempotent.
 *
 * @author BHZ Football Agenda Team
 * @since 1.0
 */
public class TeamCanonicalizer {
    private static final Logger logger = LoggerFactory.getLogger(TeamCanonicalizer.class);

    /** Minimum similarity accepted by the fuzzy step. */
    public static final double SIMILARITY_THRESHOLD = 0.75;

    private final TeamAliasTable aliases;
    private final List<String> keysLongestFirst;

    public TeamCanonicalizer(TeamAliasTable aliases) {
        this.aliases = aliases;
        // stable sort keeps table order among keys of equal length
        this.keysLongestFirst = aliases.keys().stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Canonicalizes a team name.
     * @param name scraped team name (may be null)
     * @return canonical name, the trimmed input when nothing matched, null for null input
     */
    public String canonicalize(String name) {
        if (name == null) return null;
        String trimmed = name.trim();
        String key = TeamAliasTable.normalizeKey(trimmed);
        if (key.isEmpty()) return trimmed;

        String exact = aliases.lookup(key);
        if (exact != null) return exact;

        for (String aliasKey : keysLongestFirst) {
            if (key.contains(aliasKey)) {
                return aliases.lookup(aliasKey);
            }
        }

        String bestKey = null;
        double bestScore = 0.0;
        for (String aliasKey : aliases.keys()) {
            double score = similarity(key, aliasKey);
            if (score > bestScore) {
                bestScore = score;
                bestKey = aliasKey;
            }
        }
        if (bestKey != null && bestScore >= SIMILARITY_THRESHOLD) {
            logger.debug("Fuzzy team match '{}' -> '{}' (score {})", trimmed, aliases.lookup(bestKey), bestScore);
            return aliases.lookup(bestKey);
        }
        return trimmed;
    }

    /**
     * Key used to compare two names after canonicalization.
     */
    public String comparisonKey(String name) {
        return TeamAliasTable.normalizeKey(canonicalize(name));
    }

    public Set<String> comparisonKeys(Collection<String> names) {
        return names.stream().map(this::comparisonKey).collect(Collectors.toUnmodifiableSet());
    }

    /**
     * True when the name canonicalizes to one of the target keys.
     */
    public boolean isTarget(String name, Set<String> targetKeys) {
        return name != null && targetKeys.contains(comparisonKey(name));
    }

    /**
     * Normalized Levenshtein similarity in [0, 1].
     */
    static double similarity(String a, String b) {
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) return 1.0;
        return 1.0 - (double) levenshtein(a, b) / longest;
    }

    private static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) previous[j] = j;
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}

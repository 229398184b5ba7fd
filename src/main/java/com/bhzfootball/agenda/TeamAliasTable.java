package com.bhzfootball.agenda;

import java.text.Normalizer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Read-only mapping from a normalized lookup key to one canonical team name.
 * Each canonical name is registered under its own key, so canonical output always maps back to itself.
 */
public final class TeamAliasTable {

    private final Map<String, String> byKey;

    private TeamAliasTable(Map<String, String> byKey) {
        this.byKey = Collections.unmodifiableMap(byKey);
    }

    /**
     * Builds a table from raw alias spellings to canonical names. Aliases are normalized with {@link #normalizeKey(String)}.
     * @param aliases alias spelling to canonical name, iteration order is kept
     * @return immutable table
     */
    public static TeamAliasTable of(Map<String, String> aliases) {
        Map<String, String> keyed = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : aliases.entrySet()) {
            String canonical = entry.getValue().trim();
            keyed.putIfAbsent(normalizeKey(canonical), canonical);
            String key = normalizeKey(entry.getKey());
            if (!key.isEmpty()) keyed.putIfAbsent(key, canonical);
        }
        return new TeamAliasTable(keyed);
    }

    /**
     * Aliases of the three Belo Horizonte clubs, merged from every provider the bot scrapes.
     */
    public static TeamAliasTable mineiroDefaults() {
        Map<String, String> aliases = new LinkedHashMap<>();
        aliases.put("cruzeiro", "Cruzeiro");
        aliases.put("cruzeiro ec", "Cruzeiro");
        aliases.put("cruzeiro esporte clube", "Cruzeiro");
        aliases.put("raposa", "Cruzeiro");
        aliases.put("atlético-mg", "Atletico-MG");
        aliases.put("atletico mineiro", "Atletico-MG");
        aliases.put("clube atlético mineiro", "Atletico-MG");
        aliases.put("atlético", "Atletico-MG");
        aliases.put("galo", "Atletico-MG");
        aliases.put("américa-mg", "America-MG");
        aliases.put("america mineiro", "America-MG");
        aliases.put("américa futebol clube", "America-MG");
        aliases.put("américa", "America-MG");
        aliases.put("coelho", "America-MG");
        // namesakes from other states, registered so the substring and fuzzy steps never fold them into BH clubs
        aliases.put("atlético-go", "Atletico-GO");
        aliases.put("athletico-pr", "Athletico-PR");
        aliases.put("athletico paranaense", "Athletico-PR");
        aliases.put("américa-rn", "America-RN");
        return of(aliases);
    }

    /**
     * Decomposes accents, strips combining marks, lower-cases and drops everything that is not a letter or digit.
     * @param name raw name (may be null)
     * @return lookup key, empty for null/blank input
     */
    public static String normalizeKey(String name) {
        if (name == null || name.isBlank()) return "";
        String decomposed = Normalizer.normalize(name, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        return decomposed.toLowerCase(java.util.Locale.ROOT).replaceAll("[^\\p{Alnum}]", "");
    }

    public String lookup(String key) {
        return byKey.get(key);
    }

    public Set<String> keys() {
        return byKey.keySet();
    }

    public Map<String, String> asMap() {
        return byKey;
    }
}

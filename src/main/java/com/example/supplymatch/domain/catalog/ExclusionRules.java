package com.example.supplymatch.domain.catalog;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Names of catalog categories whose whole subtree is hidden from matching.
 *
 * @param exactNames     lower-cased category names that match exactly
 * @param fragmentRules  each rule matches a name containing all of its fragments
 */
public record ExclusionRules(Set<String> exactNames, List<List<String>> fragmentRules) {

    public ExclusionRules {
        exactNames = exactNames.stream()
                .map(ExclusionRules::normalize)
                .filter(name -> !name.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        fragmentRules = fragmentRules.stream()
                .map(rule -> rule.stream()
                        .map(ExclusionRules::normalize)
                        .filter(fragment -> !fragment.isEmpty())
                        .toList())
                .filter(rule -> !rule.isEmpty())
                .toList();
    }

    public static ExclusionRules defaults() {
        return new ExclusionRules(
                Set.of("yandex", "yandex - корни", "кухня", "услуги",
                        "gonzo gaming - нетка", "gonzo gaming-нетка", "корни меню"),
                List.of(List.of("yandex"), List.of("gonzo gaming", "нетка")));
    }

    /**
     * Parses fragment rules written as {@code "gonzo gaming+нетка"}, where {@code +} joins fragments
     * that must all be present.
     */
    public static List<List<String>> parseFragmentRules(List<String> rawRules) {
        return rawRules.stream()
                .map(rule -> List.of(rule.split("\\+")))
                .toList();
    }

    public boolean matches(String categoryName) {
        String name = normalize(categoryName);
        if (name.isEmpty()) {
            return false;
        }
        if (exactNames.contains(name)) {
            return true;
        }
        for (List<String> rule : fragmentRules) {
            if (rule.stream().allMatch(name::contains)) {
                return true;
            }
        }
        return false;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.strip().toLowerCase(Locale.ROOT);
    }
}

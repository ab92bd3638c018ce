package com.example.umarell.importer;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Finds which {@code room_to_sensor_map} key a space corresponds to. Keys and space
 * attributes are compared after reducing both to lowercase alphanumeric words.
 */
public class RoomKeyMatcher {

    private final Set<String> keys;

    public RoomKeyMatcher(Set<String> keys) {
        this.keys = keys;
    }

    static String normalize(String text) {
        if (text == null) return "";
        return text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").trim();
    }

    private static String orEmpty(String s) {
        return s == null ? "" : s;
    }

    /** Matching key, or null. */
    public String match(SpaceRecord space) {
        String name = normalize(space.name());
        String longName = normalize(space.longName());
        String globalId = normalize(space.globalId());
        String longThenName = normalize(orEmpty(space.longName()) + " " + orEmpty(space.name()));
        String nameThenLong = normalize(orEmpty(space.name()) + " " + orEmpty(space.longName()));
        List<String> exact = List.of(globalId, name, longName, longThenName, nameThenLong);

        for (String key : keys) {
            String k = normalize(key);
            if (k.isEmpty()) continue;
            if (exact.contains(k)) {
                return key;
            }
            if (longThenName.contains(k) || nameThenLong.contains(k)) {
                return key;
            }
            if ((!longThenName.isEmpty() && k.contains(longThenName))
                    || (!nameThenLong.isEmpty() && k.contains(nameThenLong))) {
                return key;
            }
        }
        return null;
    }
}

package com.example.umarell.data;

/**
 * Optional predicates over Room nodes. With {@code anyOf} the predicates are OR-ed,
 * which is how a zone name is tried as both a category and a floor.
 */
public record TopologyFilter(String category, String floor, String nameContains, boolean anyOf) {

    public static TopologyFilter of(String category, String floor, String nameContains) {
        return new TopologyFilter(trimToNull(category), trimToNull(floor), trimToNull(nameContains), false);
    }

    public static TopologyFilter all() {
        return new TopologyFilter(null, null, null, false);
    }

    public static TopologyFilter zone(String zone) {
        String z = trimToNull(zone);
        return new TopologyFilter(z, z, null, true);
    }

    public boolean isEmpty() {
        return category == null && floor == null && nameContains == null;
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}

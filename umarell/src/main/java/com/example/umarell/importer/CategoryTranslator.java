package com.example.umarell.importer;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Italian space category (as written in the building model) to an English one.
 * The first keyword contained in the Italian text wins, so order matters.
 */
public final class CategoryTranslator {

    private static final Map<String, String> IT_TO_EN = new LinkedHashMap<>();

    static {
        IT_TO_EN.put("UFFICI", "Office");
        IT_TO_EN.put("AULE", "Classroom");
        IT_TO_EN.put("AULA", "Classroom");
        IT_TO_EN.put("SERVIZI", "Restroom");
        IT_TO_EN.put("WC", "Restroom");
        IT_TO_EN.put("CIRC.ORIZ", "Corridor");
        IT_TO_EN.put("CONNETTIVO", "Corridor");
        IT_TO_EN.put("SCALE", "Stairs");
        IT_TO_EN.put("DEPOSITI", "Storage");
        IT_TO_EN.put("DEPOSITO", "Storage");
        IT_TO_EN.put("TECNICI", "Technical Room");
        IT_TO_EN.put("LOCALE TECNICO", "Technical Room");
        IT_TO_EN.put("LABORATORI", "Laboratory");
        IT_TO_EN.put("LABORATORIO", "Laboratory");
        IT_TO_EN.put("RISTORO", "Break Room");
        IT_TO_EN.put("SPAZI COMPLEMENTARI", "Support Space");
        IT_TO_EN.put("SALA RIUNIONI", "Meeting Room");
        IT_TO_EN.put("SALA STUDIO", "Study Room");
    }

    private CategoryTranslator() {
    }

    /** English category, or null when nothing matches. */
    public static String toEnglish(String categoryIt) {
        if (categoryIt == null || categoryIt.isBlank()) {
            return null;
        }
        String upper = categoryIt.toUpperCase(Locale.ROOT);
        for (Map.Entry<String, String> e : IT_TO_EN.entrySet()) {
            if (upper.contains(e.getKey())) {
                return e.getValue();
            }
        }
        return null;
    }
}

package com.delta.propertytracker.crawl.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Known comunas of the Santiago metropolitan area, recognized by accent-insensitive
 * whole-word match. When several occur in one address the earliest one wins; ties go to
 * the longer name.
 */
public final class ComunaCatalog {
    private static final List<String> SANTIAGO_METRO = List.of(
        "Las Condes", "Vitacura", "Lo Barnechea", "Providencia", "Ñuñoa", "La Reina",
        "Santiago", "Peñalolén", "Macul", "La Florida", "Estación Central", "Independencia",
        "Recoleta", "Huechuraba", "Quilicura", "Conchalí", "Renca", "Quinta Normal", "Lo Prado",
        "Pudahuel", "Cerro Navia", "Maipú", "Cerrillos", "Pedro Aguirre Cerda", "San Miguel",
        "San Joaquín", "La Cisterna", "El Bosque", "La Granja", "San Ramón", "La Pintana",
        "Lo Espejo", "San Bernardo", "Puente Alto", "Colina", "Lampa"
    );

    private record Known(String name, Pattern pattern) {
    }

    private final List<Known> comunas = new ArrayList<>();

    public ComunaCatalog(List<String> names) {
        for (String name : names) {
            String folded = TextNormalizer.fold(name);
            comunas.add(new Known(name, Pattern.compile("\\b" + Pattern.quote(folded) + "\\b")));
        }
    }

    public static ComunaCatalog santiagoMetro() {
        return new ComunaCatalog(SANTIAGO_METRO);
    }

    /** Canonical comuna name found in {@code text}, or {@code null}. */
    public String find(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String folded = TextNormalizer.fold(text);
        String best = null;
        int bestStart = Integer.MAX_VALUE;
        for (Known known : comunas) {
            Matcher matcher = known.pattern().matcher(folded);
            if (!matcher.find()) {
                continue;
            }
            int start = matcher.start();
            if (start < bestStart || (start == bestStart && known.name().length() > best.length())) {
                best = known.name();
                bestStart = start;
            }
        }
        return best;
    }
}

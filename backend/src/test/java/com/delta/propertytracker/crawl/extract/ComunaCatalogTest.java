package com.delta.propertytracker.crawl.extract;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ComunaCatalogTest {

    private final ComunaCatalog catalog = ComunaCatalog.santiagoMetro();

    @Test
    void earliestComunaInAddressWins() {
        assertEquals("Las Condes", catalog.find("San Carlos de Apoquindo, Las Condes, Santiago"));
    }

    @Test
    void matchesWithoutAccents() {
        assertEquals("Ñuñoa", catalog.find("Departamento en Nunoa"));
        assertEquals("Maipú", catalog.find("MAIPU centro"));
    }

    @Test
    void requiresWholeWords() {
        assertNull(catalog.find("Calle Colinas del Sol"));
        assertNull(catalog.find(null));
    }

    @Test
    void longerNameWinsAtTheSamePosition() {
        ComunaCatalog overlapping = new ComunaCatalog(List.of("San", "San Miguel"));
        assertEquals("San Miguel", overlapping.find("Gran Avenida, San Miguel"));
    }
}

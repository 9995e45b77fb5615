package com.delta.propertytracker.crawl.extract;

import com.delta.propertytracker.crawl.extract.ExtractionPatterns.NumericField;
import org.junit.jupiter.api.Test;

import java.time.Year;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ExtractionPatternsTest {

    @Test
    void readsRoomCountsInEitherWordOrder() {
        assertEquals(3, ExtractionPatterns.findInteger(NumericField.BEDROOMS, "Departamento 3 dormitorios 2 baños"));
        assertEquals(2, ExtractionPatterns.findInteger(NumericField.BATHROOMS, "Departamento 3 dormitorios 2 baños"));
        assertEquals(4, ExtractionPatterns.findInteger(NumericField.BEDROOMS, "Dormitorios: 4"));
        assertEquals(1, ExtractionPatterns.findInteger(NumericField.PARKING, "Incluye 1 estacionamiento"));
        assertNull(ExtractionPatterns.findInteger(NumericField.BEDROOMS, "Oficina en arriendo"));
    }

    @Test
    void readsSurfacesWithDecimalComma() {
        assertEquals(85.5, ExtractionPatterns.findDecimal(NumericField.TOTAL_AREA, "85,5 m² totales"));
        assertEquals(70.0, ExtractionPatterns.findDecimal(NumericField.BUILT_AREA, "70 m² útiles"));
        assertEquals(120.0, ExtractionPatterns.findDecimal(NumericField.TOTAL_AREA, "Superficie total: 120 m²"));
    }

    @Test
    void readsFloorAndBuildingHeight() {
        assertEquals(12, ExtractionPatterns.findInteger(NumericField.FLOOR, "Ubicado en piso 12 con vista"));
        assertEquals(20, ExtractionPatterns.findInteger(NumericField.TOTAL_FLOORS, "Edificio de 20 pisos"));
    }

    @Test
    void buildingAgeAcceptsOnlyPlausibleYears() {
        Year now = Year.of(2024);
        assertEquals(9, ExtractionPatterns.buildingAge("Año de construcción: 2015", now));
        assertNull(ExtractionPatterns.buildingAge("Año de construcción: 2030", now));
        assertEquals(12, ExtractionPatterns.buildingAge("Construido en 1850, antigüedad 12 años", now));
    }

    @Test
    void negativeElevatorPhraseWins() {
        assertEquals(Boolean.FALSE, ExtractionPatterns.elevator("Edificio sin ascensor"));
        assertEquals(Boolean.TRUE, ExtractionPatterns.elevator("Con ascensor y conserjería"));
        assertNull(ExtractionPatterns.elevator("Sin datos del edificio"));
    }

    @Test
    void readsCompoundOrientation() {
        assertEquals("norte y poniente", ExtractionPatterns.orientation("Orientación: Norte y Poniente"));
        assertEquals("sur", ExtractionPatterns.orientation("orientacion sur"));
        assertNull(ExtractionPatterns.orientation("Vista despejada"));
    }

    @Test
    void convertsPublicationAgeToDays() {
        assertEquals(2, ExtractionPatterns.listingAge("Publicado hace 2 días").days());
        assertEquals(90, ExtractionPatterns.listingAge("Publicado hace 3 meses").days());
        assertEquals(365, ExtractionPatterns.listingAge("Publicado hace 1 año").days());
        assertEquals(0, ExtractionPatterns.listingAge("Publicado hoy").days());
        assertNull(ExtractionPatterns.listingAge("Sin fecha"));
    }

    @Test
    void readsMaintenanceFeeNearItsLabel() {
        assertEquals("$ 150.000", ExtractionPatterns.maintenanceFee("Gastos comunes: $ 150.000 aprox."));
        assertNull(ExtractionPatterns.maintenanceFee("Sin gastos informados"));
        assertEquals("$ 95.000", ExtractionPatterns.clpAmount("Mensual $ 95.000"));
    }
}

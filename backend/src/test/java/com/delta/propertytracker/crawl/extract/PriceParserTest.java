package com.delta.propertytracker.crawl.extract;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PriceParserTest {

    @Test
    void readsUfWithDottedThousands() {
        ParsedPrice price = PriceParser.parse("UF 8.500");
        assertEquals(8500.0, price.priceUf());
        assertNull(price.priceClp());
        assertEquals("UF", price.currency());
        assertEquals("UF 8.500", price.raw());
    }

    @Test
    void keepsBothFiguresAndPrefersUf() {
        ParsedPrice price = PriceParser.parse("UF 8.500 ($ 255.000.000)");
        assertEquals(8500.0, price.priceUf());
        assertEquals(255_000_000.0, price.priceClp());
        assertEquals("UF", price.currency());
    }

    @Test
    void readsPesoOnlyPrices() {
        ParsedPrice price = PriceParser.parse("$ 320.000.000");
        assertNull(price.priceUf());
        assertEquals(320_000_000.0, price.priceClp());
        assertEquals("CLP", price.currency());
    }

    @Test
    void readsSuffixUfWithDecimalComma() {
        ParsedPrice price = PriceParser.parse("8.500,5 UF");
        assertEquals(8500.5, price.priceUf());
    }

    @Test
    void textWithoutFiguresHasNoCurrency() {
        ParsedPrice price = PriceParser.parse("Precio a convenir");
        assertFalse(price.hasFigure());
        assertNull(price.currency());
        assertNull(PriceParser.parse("   "));
        assertNull(PriceParser.parse(null));
    }

    @Test
    void missingFiguresAreFilledFromAnotherPrice() {
        ParsedPrice uf = PriceParser.parse("UF 8.500");
        ParsedPrice merged = uf.withMissingFiguresFrom(PriceParser.parse("$ 310.250.000"));
        assertThat(merged.priceUf()).isEqualTo(8500.0);
        assertThat(merged.priceClp()).isEqualTo(310_250_000.0);
        assertThat(merged.currency()).isEqualTo("UF");
        assertThat(merged.raw()).isEqualTo("UF 8.500");
    }

    @Test
    void looksLikePriceNeedsAMarkerOrADigit() {
        assertTrue(PriceParser.looksLikePrice("UF"));
        assertTrue(PriceParser.looksLikePrice("desde 4.100"));
        assertFalse(PriceParser.looksLikePrice("Consultar"));
        assertFalse(PriceParser.looksLikePrice(null));
    }
}

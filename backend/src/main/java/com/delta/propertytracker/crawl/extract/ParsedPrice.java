package com.delta.propertytracker.crawl.extract;

public record ParsedPrice(String raw, Double priceUf, Double priceClp, String currency) {
    public static final String UF = "UF";
    public static final String CLP = "CLP";

    public boolean hasFigure() {
        return priceUf != null || priceClp != null;
    }

    /** Fills figures this price lacks from {@code other}; the raw text stays this one's. */
    public ParsedPrice withMissingFiguresFrom(ParsedPrice other) {
        if (other == null) {
            return this;
        }
        Double uf = priceUf != null ? priceUf : other.priceUf();
        Double clp = priceClp != null ? priceClp : other.priceClp();
        String resolved = uf != null ? UF : (clp != null ? CLP : null);
        return new ParsedPrice(raw, uf, clp, resolved);
    }
}

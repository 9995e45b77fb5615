package com.delta.propertytracker.crawl.extract;

import com.delta.propertytracker.crawl.browser.BrowserSession;
import com.delta.propertytracker.crawl.browser.ElementHandle;
import com.delta.propertytracker.crawl.extract.ExtractionPatterns.NumericField;
import com.delta.propertytracker.crawl.model.ListingReference;
import com.delta.propertytracker.crawl.model.PropertyRecord;
import com.delta.propertytracker.crawl.util.ListingUrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Selector and regex strategies for listing cards and detail pages. Every field is read
 * through a {@link FallbackProbe}; a field no strategy can read stays {@code null}.
 */
@Component
public class FieldExtractor {
    private static final Logger log = LoggerFactory.getLogger(FieldExtractor.class);

    private static final int MIN_TITLE_LENGTH = 11;
    private static final int MAX_TITLE_LENGTH = 300;
    private static final int MAX_CARD_PRICE_LENGTH = 60;
    private static final int MAX_DETAIL_PRICE_LENGTH = 120;
    private static final int MAX_AGENT_LENGTH = 200;

    private static final List<String> CARD_TITLE_SELECTORS = List.of(
        ".ui-search-item__title",
        ".poly-component__title",
        "h2",
        "h3",
        "h4",
        "[class*=\"title\"]",
        "[data-testid*=\"title\"]",
        "a[href*=\"MLC\"]"
    );
    private static final List<String> CARD_PRICE_SELECTORS = List.of(
        ".andes-money-amount",
        "[class*=\"price\"]",
        "[class*=\"money\"]",
        "[class*=\"amount\"]",
        "[data-testid*=\"price\"]",
        ".andes-money-amount__fraction",
        ".price-tag-fraction",
        ".price",
        "span",
        "div"
    );
    private static final List<String> CARD_LINK_SELECTORS = List.of(
        ".ui-search-item__group--title a",
        ".poly-component__title a",
        "a[href*=\"MLC\"]",
        "[data-testid=\"item-link\"]",
        "a"
    );
    private static final List<String> CARD_LOCATION_SELECTORS = List.of(
        ".ui-search-item__location",
        ".poly-component__location",
        ".location",
        "[data-testid=\"location\"]",
        "span[class*=\"location\"]"
    );

    private static final List<String> DETAIL_PRICE_SELECTORS = List.of(
        ".ui-pdp-price__second-line",
        ".andes-money-amount",
        "[class*=\"price\"]",
        ".price-tag-fraction",
        ".andes-money-amount__fraction"
    );
    // Figures inside the main price block only; related-listing widgets also carry price classes.
    private static final String MAIN_PRICE_FIGURES =
        ".ui-pdp-price [class*=\"price\"], .ui-pdp-price__main-container [class*=\"price\"]";
    private static final List<String> ATTRIBUTE_SELECTORS = List.of(
        ".andes-table tbody tr",
        "[class*=\"attribute\"]",
        ".ui-pdp-highlighted-specs-res__icon-label",
        "[class*=\"specs\"] div",
        ".property-features li"
    );
    private static final List<String> ADDRESS_SELECTORS = List.of(
        ".ui-vip-location__subtitle p",
        "[class*=\"address\"]",
        ".ui-vip-location__subtitle",
        "[class*=\"location\"]"
    );
    private static final List<String> IMAGE_SELECTORS = List.of(
        ".ui-pdp-gallery img",
        "[class*=\"gallery\"] img",
        ".property-images img",
        "img[src*=\"http\"]"
    );
    private static final List<String> VIDEO_SELECTORS = List.of(
        "iframe[src*=\"youtube\"]",
        "iframe[src*=\"vimeo\"]",
        "video source"
    );
    private static final List<String> AGENT_SELECTORS = List.of(
        "[class*=\"seller\"]",
        "[class*=\"agent\"]",
        ".ui-vip-profile-info"
    );

    private static final Pattern STATIC_MAP_CENTER = Pattern.compile("center=([+-]?\\d+\\.\\d+)(?:,|%2C)([+-]?\\d+\\.\\d+)");
    private static final Pattern JSON_LATITUDE = Pattern.compile("\"latitude\"\\s*:\\s*\"?([+-]?\\d+(?:\\.\\d+)?)");
    private static final Pattern JSON_LONGITUDE = Pattern.compile("\"longitude\"\\s*:\\s*\"?([+-]?\\d+(?:\\.\\d+)?)");
    private static final Pattern SCRIPT_LAT = Pattern.compile("\\blat[\"']?\\s*:\\s*([+-]?\\d+\\.?\\d*)");
    private static final Pattern SCRIPT_LNG = Pattern.compile("\\b(?:lng|lon)[\"']?\\s*:\\s*([+-]?\\d+\\.?\\d*)");

    public record GeoPoint(double latitude, double longitude) {
    }

    private final Clock clock;
    private final AmenityTable amenityTable = AmenityTable.defaultTable();
    private final ComunaCatalog comunaCatalog = ComunaCatalog.santiagoMetro();

    private final FallbackProbe<ExtractionScope, String> cardTitle = FallbackProbe.<ExtractionScope, String>forField("title")
        .plausibleWhen(text -> text.length() >= MIN_TITLE_LENGTH && text.length() <= MAX_TITLE_LENGTH)
        .candidates(CARD_TITLE_SELECTORS, selector -> scope -> scope.firstText(selector))
        .candidate("card text", ExtractionScope::ownText)
        .build();

    private final FallbackProbe<ExtractionScope, String> cardPrice = FallbackProbe.<ExtractionScope, String>forField("price")
        .plausibleWhen(text -> PriceParser.looksLikePrice(text) && text.length() <= MAX_CARD_PRICE_LENGTH)
        .candidates(CARD_PRICE_SELECTORS, selector -> scope -> scope.firstText(selector))
        .build();

    private final FallbackProbe<ExtractionScope, String> cardLink = FallbackProbe.<ExtractionScope, String>forField("detailUrl")
        .plausibleWhen(ListingUrlUtils::looksLikeListingLink)
        .candidates(CARD_LINK_SELECTORS, selector -> scope -> scope.firstAttr(selector, "href"))
        .candidate("card href", scope -> scope.ownAttr("href"), href -> href.contains("MLC"))
        .build();

    private final FallbackProbe<ExtractionScope, String> cardLocation = FallbackProbe.<ExtractionScope, String>forField("location")
        .plausibleWhen(text -> text.length() >= 3 && text.length() <= 150)
        .candidates(CARD_LOCATION_SELECTORS, selector -> scope -> scope.firstText(selector))
        .build();

    private final FallbackProbe<ExtractionScope, String> detailPrice = FallbackProbe.<ExtractionScope, String>forField("price")
        .plausibleWhen(text -> PriceParser.looksLikePrice(text) && text.length() <= MAX_DETAIL_PRICE_LENGTH)
        .candidates(DETAIL_PRICE_SELECTORS, selector -> scope -> scope.firstText(selector))
        .build();

    private final FallbackProbe<ExtractionScope, String> maintenanceFee = FallbackProbe.<ExtractionScope, String>forField("maintenanceFee")
        .candidate("[class*=\"maintenance\"]", scope -> ExtractionPatterns.clpAmount(scope.firstText("[class*=\"maintenance\"]")))
        .candidate("gastos comunes text", scope -> ExtractionPatterns.maintenanceFee(scope.pageText()))
        .build();

    private final FallbackProbe<ExtractionScope, String> address = FallbackProbe.<ExtractionScope, String>forField("address")
        .plausibleWhen(text -> text.length() > 5 && text.length() <= 200)
        .candidates(ADDRESS_SELECTORS, selector -> scope -> scope.firstText(selector))
        .build();

    private final FallbackProbe<ExtractionScope, GeoPoint> coordinates = FallbackProbe.<ExtractionScope, GeoPoint>forField("coordinates")
        .candidate("data-lat", scope -> attributePoint(scope, "[data-lat]", "data-lat", "data-lng", "data-lon", "data-longitude"))
        .candidate("data-latitude", scope -> attributePoint(scope, "[data-latitude]", "data-latitude", "data-longitude"))
        .candidate("static map", scope -> staticMapPoint(scope.firstAttr("img[src*=\"center=\"]", "src")))
        .candidate("json", scope -> regexPoint(scope.pageContent(), JSON_LATITUDE, JSON_LONGITUDE))
        .candidate("script", scope -> regexPoint(scope.pageContent(), SCRIPT_LAT, SCRIPT_LNG))
        .build();

    private final FallbackProbe<ExtractionScope, String> video = FallbackProbe.<ExtractionScope, String>forField("videoUrl")
        .candidates(VIDEO_SELECTORS, selector -> scope -> scope.firstAttr(selector, "src"))
        .build();

    private final FallbackProbe<ExtractionScope, String> agent = FallbackProbe.<ExtractionScope, String>forField("agentInfo")
        .plausibleWhen(text -> text.length() < MAX_AGENT_LENGTH)
        .candidates(AGENT_SELECTORS, selector -> scope -> scope.firstText(selector))
        .build();

    public FieldExtractor(Clock clock) {
        this.clock = clock;
    }

    /**
     * Title, price text and detail link of one result card. Returns empty when none of the
     * three could be read.
     */
    public Optional<ListingReference> extractCard(BrowserSession session, ElementHandle card, String sourceSelector, int pageIndex) {
        ExtractionScope scope = ExtractionScope.element(session, card);
        String title = cardTitle.probeValue(scope).orElse(null);
        String price = cardPrice.probeValue(scope).orElse(null);
        String link = cardLink.probeValue(scope).orElse(null);
        if (title == null && price == null && link == null) {
            return Optional.empty();
        }
        String location = cardLocation.probeValue(scope).orElse(null);
        return Optional.of(new ListingReference(title, price, link, sourceSelector, pageIndex, location));
    }

    public void extractFinancial(ExtractionScope page, PropertyRecord record) {
        detailPrice.probe(page).ifPresent(match -> {
            ParsedPrice parsed = PriceParser.parse(match.value());
            if (parsed.priceUf() == null || parsed.priceClp() == null) {
                for (String text : page.texts(MAIN_PRICE_FIGURES)) {
                    parsed = parsed.withMissingFiguresFrom(PriceParser.parse(text));
                }
            }
            record.applyPrice(parsed);
        });
        maintenanceFee.probeValue(page).ifPresent(record::setMaintenanceFee);
    }

    public void extractPhysical(ExtractionScope page, PropertyRecord record) {
        List<String> sources = new ArrayList<>();
        for (String selector : ATTRIBUTE_SELECTORS) {
            sources.addAll(page.texts(selector));
        }
        sources.add(page.pageText());
        for (String text : sources) {
            if (record.getBedrooms() == null) {
                record.setBedrooms(ExtractionPatterns.findInteger(NumericField.BEDROOMS, text));
            }
            if (record.getBathrooms() == null) {
                record.setBathrooms(ExtractionPatterns.findInteger(NumericField.BATHROOMS, text));
            }
            if (record.getTotalAreaM2() == null) {
                record.setTotalAreaM2(ExtractionPatterns.findDecimal(NumericField.TOTAL_AREA, text));
            }
            if (record.getBuiltAreaM2() == null) {
                record.setBuiltAreaM2(ExtractionPatterns.findDecimal(NumericField.BUILT_AREA, text));
            }
            if (record.getParkingSpots() == null) {
                record.setParkingSpots(ExtractionPatterns.findInteger(NumericField.PARKING, text));
            }
        }
    }

    public void extractLocation(ExtractionScope page, PropertyRecord record, boolean withCoordinates) {
        address.probeValue(page).ifPresent(value -> {
            record.setAddress(value);
            int comma = value.indexOf(',');
            if (comma > 0) {
                record.setNeighborhood(value.substring(0, comma).trim());
            }
        });
        String comuna = comunaCatalog.find(record.getAddress());
        if (comuna == null) {
            comuna = comunaCatalog.find(record.getTitle());
        }
        record.setComuna(comuna);
        record.setFloorNumber(ExtractionPatterns.findInteger(NumericField.FLOOR, page.pageText()));
        if (withCoordinates) {
            coordinates.probeValue(page).ifPresent(point -> {
                record.setLatitude(point.latitude());
                record.setLongitude(point.longitude());
            });
        }
    }

    public void extractBuilding(ExtractionScope page, PropertyRecord record) {
        String text = page.pageText();
        record.setBuildingAgeYears(ExtractionPatterns.buildingAge(text, Year.now(clock)));
        record.setTotalFloors(ExtractionPatterns.findInteger(NumericField.TOTAL_FLOORS, text));
        record.setHasElevator(ExtractionPatterns.elevator(text));
        record.setOrientation(ExtractionPatterns.orientation(text));
    }

    public void extractAmenities(ExtractionScope page, PropertyRecord record) {
        record.setAmenities(amenityTable.tagsIn(page.pageText()));
    }

    public void extractMedia(ExtractionScope page, PropertyRecord record) {
        for (String selector : IMAGE_SELECTORS) {
            List<String> found = new ArrayList<>();
            for (ElementHandle image : page.all(selector)) {
                String src = page.session().attr(image, "src");
                if (src != null && src.startsWith("http") && !found.contains(src)) {
                    found.add(src);
                }
                if (found.size() >= PropertyRecord.MAX_IMAGES) {
                    break;
                }
            }
            if (!found.isEmpty()) {
                record.setImageUrls(found);
                log.debug("Found {} images with {}", found.size(), selector);
                break;
            }
        }
        video.probeValue(page).ifPresent(record::setVideoUrl);
    }

    public void extractMetadata(ExtractionScope page, PropertyRecord record) {
        ExtractionPatterns.ListingAge age = ExtractionPatterns.listingAge(page.pageText());
        if (age != null) {
            record.setListingDateText(age.text());
            record.setDaysOnMarket(age.days());
        }
        agent.probeValue(page).ifPresent(record::setAgentInfo);
    }

    private static GeoPoint attributePoint(ExtractionScope scope, String selector, String latAttribute, String... lngAttributes) {
        List<ElementHandle> matches = scope.all(selector);
        if (matches.isEmpty()) {
            return null;
        }
        ElementHandle element = matches.get(0);
        Double lat = parseCoordinate(scope.session().attr(element, latAttribute));
        Double lng = null;
        for (String attribute : lngAttributes) {
            lng = parseCoordinate(scope.session().attr(element, attribute));
            if (lng != null) {
                break;
            }
        }
        return lat == null || lng == null ? null : new GeoPoint(lat, lng);
    }

    private static GeoPoint staticMapPoint(String src) {
        if (src == null) {
            return null;
        }
        Matcher matcher = STATIC_MAP_CENTER.matcher(src);
        if (!matcher.find()) {
            return null;
        }
        return new GeoPoint(Double.parseDouble(matcher.group(1)), Double.parseDouble(matcher.group(2)));
    }

    private static GeoPoint regexPoint(String content, Pattern latPattern, Pattern lngPattern) {
        if (content == null || content.isBlank()) {
            return null;
        }
        Matcher lat = latPattern.matcher(content);
        Matcher lng = lngPattern.matcher(content);
        if (!lat.find() || !lng.find()) {
            return null;
        }
        return new GeoPoint(Double.parseDouble(lat.group(1)), Double.parseDouble(lng.group(1)));
    }

    private static Double parseCoordinate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

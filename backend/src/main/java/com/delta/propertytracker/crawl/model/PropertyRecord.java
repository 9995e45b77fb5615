package com.delta.propertytracker.crawl.model;

import com.delta.propertytracker.crawl.extract.ParsedPrice;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * One scraped listing. Every optional field is nullable: {@code null} means the field was
 * not found on the page, never zero.
 */
@JsonPropertyOrder({"listingId", "title", "url", "price", "priceUf", "priceClp", "currency"})
public class PropertyRecord {
    public static final int MAX_IMAGES = 10;

    private final Instant scrapedAt;

    private String listingId = "";
    private String title;
    private String url;

    private String price;
    private Double priceUf;
    private Double priceClp;
    private String currency;
    private String maintenanceFee;

    private Integer bedrooms;
    private Integer bathrooms;
    private Double totalAreaM2;
    private Double builtAreaM2;
    private Integer parkingSpots;

    private String address;
    private String neighborhood;
    private String comuna;
    private Double latitude;
    private Double longitude;
    private Integer floorNumber;

    private Integer buildingAgeYears;
    private Integer totalFloors;
    private Boolean hasElevator;
    private String orientation;

    private final Set<String> amenities = new LinkedHashSet<>();

    private final List<String> imageUrls = new ArrayList<>();
    private String videoUrl;

    private String listingDateText;
    private Integer daysOnMarket;
    private String agentInfo;

    public PropertyRecord(Instant scrapedAt) {
        this.scrapedAt = scrapedAt == null ? Instant.now() : scrapedAt;
    }

    public PropertyRecord copy() {
        PropertyRecord copy = new PropertyRecord(scrapedAt);
        copy.listingId = listingId;
        copy.title = title;
        copy.url = url;
        copy.price = price;
        copy.priceUf = priceUf;
        copy.priceClp = priceClp;
        copy.currency = currency;
        copy.maintenanceFee = maintenanceFee;
        copy.bedrooms = bedrooms;
        copy.bathrooms = bathrooms;
        copy.totalAreaM2 = totalAreaM2;
        copy.builtAreaM2 = builtAreaM2;
        copy.parkingSpots = parkingSpots;
        copy.address = address;
        copy.neighborhood = neighborhood;
        copy.comuna = comuna;
        copy.latitude = latitude;
        copy.longitude = longitude;
        copy.floorNumber = floorNumber;
        copy.buildingAgeYears = buildingAgeYears;
        copy.totalFloors = totalFloors;
        copy.hasElevator = hasElevator;
        copy.orientation = orientation;
        copy.amenities.addAll(amenities);
        copy.imageUrls.addAll(imageUrls);
        copy.videoUrl = videoUrl;
        copy.listingDateText = listingDateText;
        copy.daysOnMarket = daysOnMarket;
        copy.agentInfo = agentInfo;
        return copy;
    }

    /**
     * Applies a parsed price keeping currency and figures consistent: UF wins when a UF
     * figure is present, CLP is used only when no UF figure was found.
     */
    public void applyPrice(ParsedPrice parsed) {
        if (parsed == null) {
            return;
        }
        this.price = parsed.raw();
        this.priceUf = parsed.priceUf();
        this.priceClp = parsed.priceClp();
        this.currency = parsed.currency();
    }

    public Instant getScrapedAt() {
        return scrapedAt;
    }

    public String getListingId() {
        return listingId;
    }

    public void setListingId(String listingId) {
        this.listingId = listingId == null ? "" : listingId.trim();
    }

    public boolean hasListingId() {
        return !listingId.isEmpty();
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getPrice() {
        return price;
    }

    public void setPrice(String price) {
        this.price = price;
    }

    public Double getPriceUf() {
        return priceUf;
    }

    public void setPriceUf(Double priceUf) {
        this.priceUf = priceUf;
    }

    public Double getPriceClp() {
        return priceClp;
    }

    public void setPriceClp(Double priceClp) {
        this.priceClp = priceClp;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public String getMaintenanceFee() {
        return maintenanceFee;
    }

    public void setMaintenanceFee(String maintenanceFee) {
        this.maintenanceFee = maintenanceFee;
    }

    public Integer getBedrooms() {
        return bedrooms;
    }

    public void setBedrooms(Integer bedrooms) {
        this.bedrooms = bedrooms;
    }

    public Integer getBathrooms() {
        return bathrooms;
    }

    public void setBathrooms(Integer bathrooms) {
        this.bathrooms = bathrooms;
    }

    public Double getTotalAreaM2() {
        return totalAreaM2;
    }

    public void setTotalAreaM2(Double totalAreaM2) {
        this.totalAreaM2 = totalAreaM2;
    }

    public Double getBuiltAreaM2() {
        return builtAreaM2;
    }

    public void setBuiltAreaM2(Double builtAreaM2) {
        this.builtAreaM2 = builtAreaM2;
    }

    public Integer getParkingSpots() {
        return parkingSpots;
    }

    public void setParkingSpots(Integer parkingSpots) {
        this.parkingSpots = parkingSpots;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public String getNeighborhood() {
        return neighborhood;
    }

    public void setNeighborhood(String neighborhood) {
        this.neighborhood = neighborhood;
    }

    public String getComuna() {
        return comuna;
    }

    public void setComuna(String comuna) {
        this.comuna = comuna;
    }

    public Double getLatitude() {
        return latitude;
    }

    public void setLatitude(Double latitude) {
        this.latitude = latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public void setLongitude(Double longitude) {
        this.longitude = longitude;
    }

    public Integer getFloorNumber() {
        return floorNumber;
    }

    public void setFloorNumber(Integer floorNumber) {
        this.floorNumber = floorNumber;
    }

    public Integer getBuildingAgeYears() {
        return buildingAgeYears;
    }

    public void setBuildingAgeYears(Integer buildingAgeYears) {
        this.buildingAgeYears = buildingAgeYears;
    }

    public Integer getTotalFloors() {
        return totalFloors;
    }

    public void setTotalFloors(Integer totalFloors) {
        this.totalFloors = totalFloors;
    }

    public Boolean getHasElevator() {
        return hasElevator;
    }

    public void setHasElevator(Boolean hasElevator) {
        this.hasElevator = hasElevator;
    }

    public String getOrientation() {
        return orientation;
    }

    public void setOrientation(String orientation) {
        this.orientation = orientation;
    }

    public Set<String> getAmenities() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(amenities));
    }

    /** Replaces the amenity set; entries are trimmed, lower-cased and deduplicated. */
    public void setAmenities(Collection<String> values) {
        amenities.clear();
        if (values == null) {
            return;
        }
        for (String value : values) {
            addAmenity(value);
        }
    }

    public void addAmenity(String amenity) {
        if (amenity == null || amenity.isBlank()) {
            return;
        }
        amenities.add(amenity.trim().toLowerCase(Locale.ROOT));
    }

    public List<String> amenityList() {
        return List.copyOf(amenities);
    }

    public Boolean getHasPool() {
        return amenities.contains("pool") ? Boolean.TRUE : null;
    }

    public Boolean getHasGym() {
        return amenities.contains("gym") ? Boolean.TRUE : null;
    }

    public Boolean getHasSecurity() {
        return amenities.contains("security") || amenities.contains("doorman") ? Boolean.TRUE : null;
    }

    public List<String> getImageUrls() {
        return List.copyOf(imageUrls);
    }

    public void setImageUrls(Collection<String> values) {
        imageUrls.clear();
        if (values == null) {
            return;
        }
        for (String value : values) {
            addImageUrl(value);
        }
    }

    /** Adds an image URL unless it is a duplicate or the gallery is already full. */
    public boolean addImageUrl(String imageUrl) {
        if (imageUrl == null || imageUrl.isBlank() || imageUrls.size() >= MAX_IMAGES) {
            return false;
        }
        String trimmed = imageUrl.trim();
        if (imageUrls.contains(trimmed)) {
            return false;
        }
        imageUrls.add(trimmed);
        return true;
    }

    public String getVideoUrl() {
        return videoUrl;
    }

    public void setVideoUrl(String videoUrl) {
        this.videoUrl = videoUrl;
    }

    public String getListingDateText() {
        return listingDateText;
    }

    public void setListingDateText(String listingDateText) {
        this.listingDateText = listingDateText;
    }

    public Integer getDaysOnMarket() {
        return daysOnMarket;
    }

    public void setDaysOnMarket(Integer daysOnMarket) {
        this.daysOnMarket = daysOnMarket;
    }

    public String getAgentInfo() {
        return agentInfo;
    }

    public void setAgentInfo(String agentInfo) {
        this.agentInfo = agentInfo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PropertyRecord that)) {
            return false;
        }
        return scrapedAt.equals(that.scrapedAt)
            && listingId.equals(that.listingId)
            && Objects.equals(title, that.title)
            && Objects.equals(url, that.url)
            && Objects.equals(price, that.price)
            && Objects.equals(priceUf, that.priceUf)
            && Objects.equals(priceClp, that.priceClp)
            && Objects.equals(currency, that.currency)
            && Objects.equals(maintenanceFee, that.maintenanceFee)
            && Objects.equals(bedrooms, that.bedrooms)
            && Objects.equals(bathrooms, that.bathrooms)
            && Objects.equals(totalAreaM2, that.totalAreaM2)
            && Objects.equals(builtAreaM2, that.builtAreaM2)
            && Objects.equals(parkingSpots, that.parkingSpots)
            && Objects.equals(address, that.address)
            && Objects.equals(neighborhood, that.neighborhood)
            && Objects.equals(comuna, that.comuna)
            && Objects.equals(latitude, that.latitude)
            && Objects.equals(longitude, that.longitude)
            && Objects.equals(floorNumber, that.floorNumber)
            && Objects.equals(buildingAgeYears, that.buildingAgeYears)
            && Objects.equals(totalFloors, that.totalFloors)
            && Objects.equals(hasElevator, that.hasElevator)
            && Objects.equals(orientation, that.orientation)
            && amenities.equals(that.amenities)
            && imageUrls.equals(that.imageUrls)
            && Objects.equals(videoUrl, that.videoUrl)
            && Objects.equals(listingDateText, that.listingDateText)
            && Objects.equals(daysOnMarket, that.daysOnMarket)
            && Objects.equals(agentInfo, that.agentInfo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
            scrapedAt, listingId, title, url, price, priceUf, priceClp, currency, maintenanceFee,
            bedrooms, bathrooms, totalAreaM2, builtAreaM2, parkingSpots,
            address, neighborhood, comuna, latitude, longitude, floorNumber,
            buildingAgeYears, totalFloors, hasElevator, orientation,
            amenities, imageUrls, videoUrl, listingDateText, daysOnMarket, agentInfo
        );
    }

    @Override
    public String toString() {
        return "PropertyRecord{listingId='" + listingId + "', title='" + title + "', price='" + price + "'}";
    }
}

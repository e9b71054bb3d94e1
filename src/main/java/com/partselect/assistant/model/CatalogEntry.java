package com.partselect.assistant.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;

@Getter
@ToString
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "One parts-catalog record")
public class CatalogEntry {

    /** Part number of the synthetic entry returned when nothing matched locally. */
    public static final String NO_MATCH_PART_NUMBER = "N/A";

    @JsonProperty("partNumber")
    @Schema(description = "PartSelect part number, may be empty", example = "PS11752778")
    private final String partNumber;

    @JsonProperty("manufacturerPart")
    private final String manufacturerPart;

    @JsonProperty("aliases")
    private final List<String> aliases;

    @JsonProperty("name")
    @Schema(example = "Refrigerator Door Shelf Bin")
    private final String name;

    @JsonProperty("brand")
    private final String brand;

    @JsonProperty("brands")
    private final List<String> brands;

    @JsonProperty("appliance")
    @JsonAlias("applianceType")
    @Schema(description = "dishwasher, refrigerator or other", example = "refrigerator")
    private final String appliance;

    @JsonProperty("category")
    @Schema(description = "Keyword cluster such as rack, pump, filter, or general", example = "tray")
    private final String category;

    @JsonProperty("description")
    private final String description;

    @JsonProperty("officialURL")
    private final String officialURL;

    @JsonProperty("installGuide")
    @JsonAlias("installation")
    private final String installGuide;

    @JsonProperty("models")
    @JsonAlias("compatibleModels")
    private final List<String> models;

    @JsonProperty("price")
    private final Double price;

    @JsonProperty("stock")
    private final String stock;

    @JsonProperty("symptoms")
    private final List<String> symptoms;

    @JsonProperty("imageUrl")
    private final String imageUrl;

    @JsonProperty("source")
    private final String source;

    /**
     * Synthetic entry standing in for "no local result", carrying an external search link.
     */
    public static CatalogEntry noMatch(String query, String searchUrl) {
        return CatalogEntry.builder()
                .partNumber(NO_MATCH_PART_NUMBER)
                .name("No local results for '" + query + "'.")
                .description("Try the official catalog.")
                .officialURL(searchUrl)
                .build();
    }

    @JsonIgnore
    public boolean isNoMatch() {
        return NO_MATCH_PART_NUMBER.equals(partNumber);
    }

    public List<String> getModels() {
        return readOnly(models);
    }

    public List<String> getBrands() {
        return readOnly(brands);
    }

    public List<String> getAliases() {
        return readOnly(aliases);
    }

    public List<String> getSymptoms() {
        return readOnly(symptoms);
    }

    /**
     * Unmodifiable copy with null elements dropped.
     */
    private static List<String> readOnly(List<String> values) {
        return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
    }
}

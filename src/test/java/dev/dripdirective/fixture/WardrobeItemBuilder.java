package dev.dripdirective.fixture;

import dev.dripdirective.ingestion.WardrobeItemDescription;

import java.util.List;

/**
 * Test data builder for {@link WardrobeItemDescription} with sensible defaults.
 *
 * <p>Usage: {@code aWardrobeItem().itemId("12").garmentType("blazer").build()}
 */
public final class WardrobeItemBuilder {

    private String itemId = "1";
    private String garmentType = "shirt";
    private String style = "casual";
    private String primaryColor = "white";
    private List<String> secondaryColors = List.of();
    private String pattern;
    private String material;
    private String fitType;
    private String styleVibe;
    private List<String> occasions = List.of();
    private List<String> seasons = List.of();
    private Integer formalityLevel;
    private Integer versatilityScore;
    private String description;
    private String summary;

    private WardrobeItemBuilder() {
    }

    public static WardrobeItemBuilder aWardrobeItem() {
        return new WardrobeItemBuilder();
    }

    public WardrobeItemBuilder itemId(String itemId) {
        this.itemId = itemId;
        return this;
    }

    public WardrobeItemBuilder garmentType(String garmentType) {
        this.garmentType = garmentType;
        return this;
    }

    public WardrobeItemBuilder style(String style) {
        this.style = style;
        return this;
    }

    public WardrobeItemBuilder primaryColor(String primaryColor) {
        this.primaryColor = primaryColor;
        return this;
    }

    public WardrobeItemBuilder secondaryColors(String... colors) {
        this.secondaryColors = List.of(colors);
        return this;
    }

    public WardrobeItemBuilder pattern(String pattern) {
        this.pattern = pattern;
        return this;
    }

    public WardrobeItemBuilder material(String material) {
        this.material = material;
        return this;
    }

    public WardrobeItemBuilder fitType(String fitType) {
        this.fitType = fitType;
        return this;
    }

    public WardrobeItemBuilder styleVibe(String styleVibe) {
        this.styleVibe = styleVibe;
        return this;
    }

    public WardrobeItemBuilder occasions(String... occasions) {
        this.occasions = List.of(occasions);
        return this;
    }

    public WardrobeItemBuilder seasons(String... seasons) {
        this.seasons = List.of(seasons);
        return this;
    }

    public WardrobeItemBuilder formalityLevel(Integer formalityLevel) {
        this.formalityLevel = formalityLevel;
        return this;
    }

    public WardrobeItemBuilder versatilityScore(Integer versatilityScore) {
        this.versatilityScore = versatilityScore;
        return this;
    }

    public WardrobeItemBuilder description(String description) {
        this.description = description;
        return this;
    }

    public WardrobeItemBuilder summary(String summary) {
        this.summary = summary;
        return this;
    }

    public WardrobeItemDescription build() {
        return new WardrobeItemDescription(itemId, garmentType, style, primaryColor,
                secondaryColors, pattern, material, fitType, styleVibe, occasions, seasons,
                formalityLevel, versatilityScore, description, summary);
    }
}

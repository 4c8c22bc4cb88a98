package dev.dripdirective.ingestion;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classified attributes of one wardrobe item, as produced by the external garment classifier.
 *
 * <p>Only {@code itemId}, {@code garmentType}, {@code style} and {@code primaryColor} are required;
 * everything else is optional and simply left out of the embedding text when absent.
 */
public record WardrobeItemDescription(
        String itemId,
        String garmentType,
        String style,
        String primaryColor,
        List<String> secondaryColors,
        @Nullable String pattern,
        @Nullable String material,
        @Nullable String fitType,
        @Nullable String styleVibe,
        List<String> occasions,
        List<String> seasons,
        @Nullable Integer formalityLevel,
        @Nullable Integer versatilityScore,
        @Nullable String description,
        @Nullable String summary) {

    static final int MAX_METADATA_TEXT = 500;

    public WardrobeItemDescription {
        if (itemId == null || itemId.isBlank()) {
            throw new IllegalArgumentException("itemId must not be blank");
        }
        garmentType = garmentType == null ? "" : garmentType;
        style = style == null ? "" : style;
        primaryColor = primaryColor == null ? "" : primaryColor;
        secondaryColors = secondaryColors == null ? List.of() : List.copyOf(secondaryColors);
        occasions = occasions == null ? List.of() : List.copyOf(occasions);
        seasons = seasons == null ? List.of() : List.copyOf(seasons);
    }

    /**
     * Text that gets embedded for this item: {@code Label: value} parts joined with {@code " | "},
     * basic classification first, description and summary last.
     */
    public String embeddingText() {
        List<String> parts = new ArrayList<>();
        parts.add("Garment Type: " + garmentType);
        parts.add("Style: " + style);
        parts.add("Primary Color: " + primaryColor);
        addList(parts, "Secondary Colors", secondaryColors);
        add(parts, "Pattern", pattern);
        add(parts, "Material", material);
        add(parts, "Fit", fitType);
        add(parts, "Style Vibe", styleVibe);
        addList(parts, "Suitable Occasions", occasions);
        addList(parts, "Seasons", seasons);
        if (formalityLevel != null) {
            parts.add("Formality Level: " + formalityLevel + "/10");
        }
        if (versatilityScore != null) {
            parts.add("Versatility: " + versatilityScore + "/10");
        }
        add(parts, "Description", description);
        add(parts, "Summary", summary);
        return String.join(" | ", parts);
    }

    /** Tags stored next to the vector; never interpreted by the store. */
    public Map<String, String> metadata() {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("garment_type", garmentType);
        metadata.put("style", style);
        metadata.put("color", primaryColor);
        if (summary != null && !summary.isBlank()) {
            metadata.put("summary_text", truncate(summary));
        }
        if (!occasions.isEmpty()) {
            metadata.put("occasions", String.join(", ", occasions));
        }
        if (formalityLevel != null) {
            metadata.put("formality", String.valueOf(formalityLevel));
        }
        if (versatilityScore != null) {
            metadata.put("versatility", String.valueOf(versatilityScore));
        }
        return metadata;
    }

    static String truncate(String text) {
        return text.length() <= MAX_METADATA_TEXT ? text : text.substring(0, MAX_METADATA_TEXT);
    }

    private static void add(List<String> parts, String label, @Nullable String value) {
        if (value != null && !value.isBlank()) {
            parts.add(label + ": " + value);
        }
    }

    private static void addList(List<String> parts, String label, List<String> values) {
        if (!values.isEmpty()) {
            parts.add(label + ": " + String.join(", ", values));
        }
    }
}

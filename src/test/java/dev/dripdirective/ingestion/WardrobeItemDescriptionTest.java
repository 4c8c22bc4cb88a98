package dev.dripdirective.ingestion;

import org.junit.jupiter.api.Test;

import static dev.dripdirective.fixture.WardrobeItemBuilder.aWardrobeItem;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WardrobeItemDescriptionTest {

    @Test
    void minimal_item_text_has_basic_classification_only() {
        WardrobeItemDescription item = aWardrobeItem()
                .garmentType("shirt").style("casual").primaryColor("white").build();

        assertThat(item.embeddingText())
                .isEqualTo("Garment Type: shirt | Style: casual | Primary Color: white");
    }

    @Test
    void full_item_text_lists_attributes_in_fixed_order() {
        WardrobeItemDescription item = aWardrobeItem()
                .garmentType("blazer")
                .style("formal")
                .primaryColor("navy")
                .secondaryColors("grey", "white")
                .pattern("pinstripe")
                .material("wool")
                .fitType("slim")
                .styleVibe("classic")
                .occasions("office", "wedding")
                .seasons("autumn", "winter")
                .formalityLevel(8)
                .versatilityScore(6)
                .description("Single-breasted navy blazer")
                .summary("A sharp layering piece")
                .build();

        assertThat(item.embeddingText()).isEqualTo(
                "Garment Type: blazer | Style: formal | Primary Color: navy"
                        + " | Secondary Colors: grey, white | Pattern: pinstripe | Material: wool"
                        + " | Fit: slim | Style Vibe: classic | Suitable Occasions: office, wedding"
                        + " | Seasons: autumn, winter | Formality Level: 8/10 | Versatility: 6/10"
                        + " | Description: Single-breasted navy blazer"
                        + " | Summary: A sharp layering piece");
    }

    @Test
    void blank_optional_fields_are_left_out() {
        WardrobeItemDescription item = aWardrobeItem().pattern(" ").material("").build();

        assertThat(item.embeddingText()).doesNotContain("Pattern").doesNotContain("Material");
    }

    @Test
    void metadata_carries_tags_and_truncated_summary() {
        WardrobeItemDescription item = aWardrobeItem()
                .garmentType("dress")
                .occasions("party")
                .formalityLevel(7)
                .summary("s".repeat(700))
                .build();

        assertThat(item.metadata())
                .containsEntry("garment_type", "dress")
                .containsEntry("occasions", "party")
                .containsEntry("formality", "7")
                .doesNotContainKey("versatility");
        assertThat(item.metadata().get("summary_text")).hasSize(500);
    }

    @Test
    void blank_item_id_is_rejected() {
        assertThatThrownBy(() -> aWardrobeItem().itemId(" ").build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package io.github.dialogcollection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the JSON form of placement settings. The preference store itself is not touched.
 */
class PlacementPreferencesTest {

    @Test
    @DisplayName("Default settings serialize to an empty object")
    void toJson_defaultsAreOmitted() {
        assertEquals("{}", PlacementPreferences.toJson(PlacementSettings.DEFAULT));
    }

    @Test
    @DisplayName("Only non-default values are written, using compact keys")
    void toJson_writesCompactKeys() {
        String json = PlacementPreferences.toJson(new PlacementSettings(20, 10, 8));

        assertEquals("{\"ax\":20,\"gap\":8}", json);
        assertEquals(new PlacementSettings(20, 10, 8), PlacementPreferences.fromJson(json));
    }

    @Test
    @DisplayName("Missing or blank input yields the defaults")
    void fromJson_emptyInput_returnsDefaults() {
        assertEquals(PlacementSettings.DEFAULT, PlacementPreferences.fromJson(null));
        assertEquals(PlacementSettings.DEFAULT, PlacementPreferences.fromJson("  "));
        assertEquals(PlacementSettings.DEFAULT, PlacementPreferences.fromJson("{}"));
    }

    @Test
    @DisplayName("Only the compact keys are read")
    void fromJson_ignoresUnknownKeys() {
        PlacementSettings settings = PlacementPreferences.fromJson("{\"anchorX\":0,\"anchorY\":32,\"gap\":7}");

        assertEquals(PlacementSettings.DEFAULT.withGap(7), settings);
    }

    @Test
    @DisplayName("Malformed JSON falls back to the defaults")
    void fromJson_malformed_returnsDefaults() {
        assertEquals(PlacementSettings.DEFAULT, PlacementPreferences.fromJson("{\"ax\": "));
        assertEquals(PlacementSettings.DEFAULT, PlacementPreferences.fromJson("[1, 2]"));
    }

    @Test
    @DisplayName("Invalid fields fall back one at a time")
    void fromJson_invalidFields_fallBackIndividually() {
        PlacementSettings settings = PlacementPreferences.fromJson("{\"ax\":-4,\"ay\":\"top\",\"gap\":12}");

        assertEquals(new PlacementSettings(PlacementSettings.DEFAULT_ANCHOR_X,
                PlacementSettings.DEFAULT_ANCHOR_Y, 12), settings);
    }

    @Test
    @DisplayName("Settings reject negative values")
    void settings_rejectNegativeValues() {
        assertThrows(IllegalArgumentException.class, () -> new PlacementSettings(-1, 10, 5));
        assertThrows(IllegalArgumentException.class, () -> PlacementSettings.DEFAULT.withGap(-5));
        assertEquals(new PlacementSettings(0, 0, 5), PlacementSettings.DEFAULT.withAnchor(0, 0));
    }
}

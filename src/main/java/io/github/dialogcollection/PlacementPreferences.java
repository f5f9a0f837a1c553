package io.github.dialogcollection;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Handles persistence of {@link PlacementSettings} using the Java preference system.
 * <p>
 * Settings are serialized to compact JSON and stored in a single preference entry.
 * Missing or malformed values fall back to the defaults one field at a time, so a damaged
 * entry never prevents dialogs from being placed.
 */
public final class PlacementPreferences {

    private static final Logger logger = LoggerFactory.getLogger(PlacementPreferences.class);

    static final String PREF_KEY = "dialogPlacement.settings";

    // No pretty printing: a preference value is limited to 8192 chars
    private static final Gson GSON = new GsonBuilder().create();

    private PlacementPreferences() {
        // Utility class - no instantiation
    }

    /**
     * Load the stored settings, or the defaults if nothing usable is stored.
     *
     * @return Settings, never null
     */
    public static PlacementSettings load() {
        try {
            String json = node().get(PREF_KEY, "{}");
            PlacementSettings settings = fromJson(json);
            logger.debug("Loaded placement settings: {}", settings);
            return settings;
        } catch (RuntimeException e) {
            logger.warn("Failed to load placement settings, using defaults: {}", e.getMessage());
            return PlacementSettings.DEFAULT;
        }
    }

    /**
     * Store the given settings, replacing any previous ones.
     */
    public static void save(PlacementSettings settings) {
        Preferences node = node();
        node.put(PREF_KEY, toJson(settings));
        try {
            node.flush();
            logger.info("Saved placement settings: {}", settings);
        } catch (BackingStoreException e) {
            logger.error("Failed to save placement settings: {}", e.getMessage(), e);
        }
    }

    /**
     * Remove the stored settings so that the defaults apply again.
     */
    public static void reset() {
        Preferences node = node();
        node.remove(PREF_KEY);
        try {
            node.flush();
            logger.info("Reset placement settings to defaults");
        } catch (BackingStoreException e) {
            logger.error("Failed to reset placement settings: {}", e.getMessage(), e);
        }
    }

    /**
     * Serialize settings to compact JSON. Default values are not written.
     */
    public static String toJson(PlacementSettings settings) {
        JsonObject obj = new JsonObject();
        if (settings.anchorX() != PlacementSettings.DEFAULT_ANCHOR_X) {
            obj.addProperty("ax", settings.anchorX());
        }
        if (settings.anchorY() != PlacementSettings.DEFAULT_ANCHOR_Y) {
            obj.addProperty("ay", settings.anchorY());
        }
        if (settings.gap() != PlacementSettings.DEFAULT_GAP) {
            obj.addProperty("gap", settings.gap());
        }
        return GSON.toJson(obj);
    }

    /**
     * Deserialize settings from JSON.
     *
     * @param json JSON object text, may be null or blank
     * @return Settings, never null
     */
    public static PlacementSettings fromJson(String json) {
        if (json == null || json.isBlank()) {
            return PlacementSettings.DEFAULT;
        }

        JsonObject obj;
        try {
            JsonElement root = JsonParser.parseString(json);
            if (!root.isJsonObject()) {
                logger.warn("Placement settings are not a JSON object, using defaults: {}", json);
                return PlacementSettings.DEFAULT;
            }
            obj = root.getAsJsonObject();
        } catch (RuntimeException e) {
            logger.warn("Malformed placement settings, using defaults: {}", e.getMessage());
            return PlacementSettings.DEFAULT;
        }

        int anchorX = getNonNegativeInt(obj, "ax", PlacementSettings.DEFAULT_ANCHOR_X);
        int anchorY = getNonNegativeInt(obj, "ay", PlacementSettings.DEFAULT_ANCHOR_Y);
        int gap = getNonNegativeInt(obj, "gap", PlacementSettings.DEFAULT_GAP);
        return new PlacementSettings(anchorX, anchorY, gap);
    }

    private static Preferences node() {
        return Preferences.userNodeForPackage(PlacementPreferences.class);
    }

    /** Get a non-negative int from a JsonObject, or the default if absent or invalid. */
    private static int getNonNegativeInt(JsonObject obj, String key, int defaultVal) {
        if (!obj.has(key)) {
            return defaultVal;
        }
        try {
            int value = obj.get(key).getAsInt();
            if (value < 0) {
                logger.warn("Ignoring negative placement setting '{}': {}", key, value);
                return defaultVal;
            }
            return value;
        } catch (RuntimeException e) {
            logger.warn("Ignoring invalid placement setting '{}': {}", key, e.getMessage());
            return defaultVal;
        }
    }
}

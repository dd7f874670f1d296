package com.photosync.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.photosync.repository.SyncDatabaseManager;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Settings of one sync root, stored as .photosync/settings.json.
 * Uses Jackson's tree model so unknown keys written by other versions survive a save.
 */
public class SettingsManager {

    private static final String SETTINGS_FILE = "settings.json";

    public static final int DEFAULT_BATCH_SIZE = 16;
    public static final String DEFAULT_TOKEN_FILE = "tokens.json";
    public static final String DEFAULT_API_BASE_URL = "https://photoslibrary.googleapis.com/v1";

    private final Path syncRoot;
    private final File settingsFile;
    private final ObjectMapper mapper;
    private JsonNode rootNode;

    public SettingsManager(Path syncRoot) {
        this.syncRoot = syncRoot;
        this.settingsFile = syncRoot.resolve(SyncDatabaseManager.DB_FOLDER).resolve(SETTINGS_FILE).toFile();
        this.mapper = new ObjectMapper();
        loadSettings();
    }

    private void loadSettings() {
        if (settingsFile.exists()) {
            try {
                rootNode = mapper.readTree(settingsFile);
            } catch (IOException e) {
                System.err.println("Could not read " + settingsFile + ", using defaults: " + e.getMessage());
                rootNode = mapper.createObjectNode();
            }
        } else {
            rootNode = mapper.createObjectNode();
        }
        if (rootNode == null || !rootNode.isObject()) {
            rootNode = mapper.createObjectNode();
        }
    }

    public int getBatchSize() {
        if (rootNode.has("batch_size")) {
            int size = rootNode.get("batch_size").asInt(DEFAULT_BATCH_SIZE);
            if (size > 0) {
                return size;
            }
        }
        return DEFAULT_BATCH_SIZE;
    }

    public void setBatchSize(int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        ((ObjectNode) rootNode).put("batch_size", batchSize);
        saveSettings();
    }

    /**
     * Whether metadata fetching only looks before the oldest and after the newest known item.
     * Disable to rescan everything, e.g. after uploading old photos.
     */
    public boolean isWindowHeuristic() {
        if (rootNode.has("window_heuristic")) {
            return rootNode.get("window_heuristic").asBoolean();
        }
        return true;
    }

    public void setWindowHeuristic(boolean enabled) {
        ((ObjectNode) rootNode).put("window_heuristic", enabled);
        saveSettings();
    }

    public boolean isResyncOnStart() {
        if (rootNode.has("resync_on_start")) {
            return rootNode.get("resync_on_start").asBoolean();
        }
        return false;
    }

    public void setResyncOnStart(boolean enabled) {
        ((ObjectNode) rootNode).put("resync_on_start", enabled);
        saveSettings();
    }

    /**
     * Token file to import credentials from, resolved against the sync root.
     */
    public Path getTokenFile() {
        String name = DEFAULT_TOKEN_FILE;
        if (rootNode.has("token_file")) {
            name = rootNode.get("token_file").asText();
        }
        return syncRoot.resolve(name);
    }

    public void setTokenFile(String tokenFile) {
        ((ObjectNode) rootNode).put("token_file", tokenFile);
        saveSettings();
    }

    public String getApiBaseUrl() {
        if (rootNode.has("api_base_url")) {
            return rootNode.get("api_base_url").asText();
        }
        return DEFAULT_API_BASE_URL;
    }

    private void saveSettings() {
        try {
            File parent = settingsFile.getParentFile();
            if (!parent.exists()) {
                parent.mkdirs();
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(settingsFile, rootNode);
        } catch (IOException e) {
            System.err.println("Could not save " + settingsFile + ": " + e.getMessage());
        }
    }
}

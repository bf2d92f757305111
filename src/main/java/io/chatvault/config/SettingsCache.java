package io.chatvault.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chatvault.model.Tier;
import io.chatvault.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * JSON sidecar with the last-known tier and admin-presence flag. It is a cache for the
 * UI: the database stays authoritative and bootstrap rewrites these values from it.
 */
public final class SettingsCache {
    public static final int SCHEMA = 1;

    private final Path file;

    public SettingsCache(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    /**
     * Loads the sidecar with missing keys forward-filled from the defaults; creates it
     * when absent.
     */
    public synchronized ObjectNode load() {
        try {
            if (!Files.exists(file)) {
                ObjectNode created = defaults();
                save(created);
                return created;
            }
            JsonNode parsed = Jsons.mapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
            ObjectNode merged = parsed != null && parsed.isObject() ? (ObjectNode) parsed : Jsons.mapper().createObjectNode();
            forwardFill(merged, defaults());
            return merged;
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + file, e);
        }
    }

    public Optional<Tier> cachedTier() {
        return Tier.parse(textOrEmpty(load().path("security").path("mode")));
    }

    /** {@code null} when admin presence is unknown. */
    public Boolean cachedHasAdmin() {
        JsonNode node = load().path("auth").path("has_admin");
        return node.isBoolean() ? node.asBoolean() : null;
    }

    public boolean signupRequiresApproval() {
        return load().path("auth").path("signup_requires_approval").asBoolean(true);
    }

    public synchronized boolean recordTier(Tier tier) {
        ObjectNode root = load();
        ObjectNode security = section(root, "security");
        if (tier.dbValue().equals(textOrEmpty(security.path("mode")))) {
            return false;
        }
        security.put("mode", tier.dbValue());
        save(root);
        return true;
    }

    public synchronized boolean recordAdminPresence(Boolean hasAdmin) {
        ObjectNode root = load();
        ObjectNode auth = section(root, "auth");
        JsonNode current = auth.path("has_admin");
        Boolean cached = current.isBoolean() ? current.asBoolean() : null;
        if (hasAdmin == null ? cached == null : hasAdmin.equals(cached)) {
            return false;
        }
        if (hasAdmin == null) {
            auth.putNull("has_admin");
        } else {
            auth.put("has_admin", hasAdmin);
        }
        save(root);
        return true;
    }

    private void save(ObjectNode root) {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(tmp, Jsons.toJson(root), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write settings: " + file, e);
        }
    }

    private static String textOrEmpty(JsonNode node) {
        return node.isTextual() ? node.asText() : "";
    }

    private static ObjectNode section(ObjectNode root, String name) {
        JsonNode existing = root.get(name);
        if (existing != null && existing.isObject()) {
            return (ObjectNode) existing;
        }
        return root.putObject(name);
    }

    private static void forwardFill(ObjectNode target, ObjectNode defaults) {
        Iterator<Map.Entry<String, JsonNode>> it = defaults.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode existing = target.get(entry.getKey());
            if (existing == null) {
                target.set(entry.getKey(), entry.getValue().deepCopy());
            } else if (existing.isObject() && entry.getValue().isObject()) {
                forwardFill((ObjectNode) existing, (ObjectNode) entry.getValue());
            }
        }
    }

    private static ObjectNode defaults() {
        ObjectNode root = Jsons.mapper().createObjectNode();
        root.put("schema", SCHEMA);
        ObjectNode logging = root.putObject("logging");
        logging.put("level", "INFO");
        logging.put("max_bytes", 10L * 1024L * 1024L);
        logging.put("backup_count", 5);
        ObjectNode auth = root.putObject("auth");
        auth.putNull("has_admin");
        auth.put("signup_requires_approval", true);
        ObjectNode security = root.putObject("security");
        security.putNull("mode");
        return root;
    }
}

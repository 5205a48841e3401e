package com.neurasense.jitai.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.neurasense.jitai.domain.CatalogEntry;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the intervention catalog from the configured file or the bundled classpath copy.
 * <p>
 * Accepts either a top-level array of entries or an object with an {@code items} array.
 * Entries without an id are ignored.
 */
@ApplicationScoped
public class CatalogLoader {

    private static final Logger LOG = Logger.getLogger(CatalogLoader.class);

    static final String BUILTIN_RESOURCE = "catalog/tool_items.json";

    @ConfigProperty(name = "app.catalog.path")
    Optional<String> catalogPath;

    private final ObjectMapper mapper = new ObjectMapper();

    public List<CatalogEntry> load() {
        Optional<Path> path = catalogPath.filter(p -> !p.isBlank()).map(Path::of);
        if (path.isPresent() && Files.isRegularFile(path.get())) {
            try (InputStream in = Files.newInputStream(path.get())) {
                List<CatalogEntry> entries = parse(in);
                LOG.infof("Loaded %d catalog entries from %s", entries.size(), path.get());
                return entries;
            } catch (IOException e) {
                LOG.warnf("Failed to read catalog %s, using builtin: %s", path.get(), e.getMessage());
            }
        } else if (path.isPresent()) {
            LOG.warnf("Catalog file %s not found, using builtin", path.get());
        }
        return loadBuiltin();
    }

    public List<CatalogEntry> loadBuiltin() {
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(BUILTIN_RESOURCE)) {
            if (in == null) {
                LOG.warnf("Builtin catalog %s missing from classpath", BUILTIN_RESOURCE);
                return List.of();
            }
            return parse(in);
        } catch (IOException e) {
            LOG.errorf(e, "Failed to read builtin catalog");
            return List.of();
        }
    }

    List<CatalogEntry> parse(InputStream in) throws IOException {
        JsonNode root = mapper.readTree(in);
        JsonNode items = root != null && root.isObject() ? root.get("items") : root;
        List<CatalogEntry> entries = new ArrayList<>();
        if (items == null || !items.isArray()) {
            return entries;
        }
        for (JsonNode item : items) {
            CatalogEntry entry = mapper.treeToValue(item, CatalogEntry.class);
            if (entry.getId() != null && !entry.getId().isBlank()) {
                entries.add(entry);
            }
        }
        return entries;
    }
}

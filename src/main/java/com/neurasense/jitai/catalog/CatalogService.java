package com.neurasense.jitai.catalog;

import com.neurasense.jitai.domain.CatalogEntry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup of catalog display metadata by identifier.
 * <p>
 * A missing entry never breaks resolution: callers get empty and fall back to the identifier.
 */
@ApplicationScoped
public class CatalogService {

    private static final Logger LOG = Logger.getLogger(CatalogService.class);

    @Inject
    CatalogLoader loader;

    // Current index (volatile for safe publication)
    private volatile Map<String, CatalogEntry> byId = Map.of();

    @PostConstruct
    void init() {
        reload();
    }

    /**
     * Builds a service over fixed entries, without a loader.
     */
    public static CatalogService of(List<CatalogEntry> entries) {
        CatalogService service = new CatalogService();
        service.index(entries);
        return service;
    }

    public void reload() {
        List<CatalogEntry> entries = loader.load();
        index(entries);
        LOG.infof("Catalog ready with %d entries", byId.size());
    }

    public Optional<CatalogEntry> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.get(id));
    }

    public Collection<CatalogEntry> all() {
        return byId.values();
    }

    public int size() {
        return byId.size();
    }

    private void index(List<CatalogEntry> entries) {
        Map<String, CatalogEntry> next = new LinkedHashMap<>();
        for (CatalogEntry entry : entries) {
            next.putIfAbsent(entry.getId(), entry);
        }
        byId = Collections.unmodifiableMap(next);
    }
}

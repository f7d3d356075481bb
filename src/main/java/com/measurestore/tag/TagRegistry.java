package com.measurestore.tag;

import com.measurestore.contract.ConstraintViolationException;
import com.measurestore.contract.InputRules;
import com.measurestore.registry.Entity;
import com.measurestore.registry.Metric;
import com.measurestore.store.MeasureStore;
import com.measurestore.store.UniqueKeyConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Classification tags for entities and metrics. Links are idempotent and disappear with
 * either side.
 */
@Service
public class TagRegistry {

    private static final Logger log = LoggerFactory.getLogger(TagRegistry.class);

    private final MeasureStore store;
    private final InputRules rules;

    public TagRegistry(MeasureStore store, InputRules rules) {
        this.store = store;
        this.rules = rules;
    }

    public Tag getOrCreateTag(TagKind kind, String name) {
        if (kind == null) {
            throw new ConstraintViolationException("tag kind is required");
        }
        rules.requireName(name, "tag name");
        Optional<Tag> existing = store.findTag(kind, name);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            Tag created = store.insertTag(kind, name);
            log.info("Registered tag id={} kind={} name={}", created.id(), kind.getValue(), name);
            return created;
        } catch (UniqueKeyConflictException ex) {
            return store.findTag(ex.getExistingId())
                .orElseThrow(() -> new IllegalStateException("tag vanished after conflict: " + ex.getExistingId()));
        }
    }

    public Optional<Tag> findTag(long id) {
        return store.findTag(id);
    }

    public void tagEntity(long entityId, long tagId) {
        if (store.linkEntityTag(entityId, tagId)) {
            log.info("Tagged entity={} with tag={}", entityId, tagId);
        }
    }

    public void tagMetric(long metricId, long tagId) {
        if (store.linkMetricTag(metricId, tagId)) {
            log.info("Tagged metric={} with tag={}", metricId, tagId);
        }
    }

    public List<Tag> tagsOfEntity(long entityId) {
        return store.tagsOfEntity(entityId);
    }

    public List<Tag> tagsOfMetric(long metricId) {
        return store.tagsOfMetric(metricId);
    }

    public List<Entity> entitiesTagged(long tagId) {
        return store.entitiesWithTag(tagId);
    }

    public List<Metric> metricsTagged(long tagId) {
        return store.metricsWithTag(tagId);
    }

    public void deleteTag(long tagId) {
        int links = store.deleteTag(tagId);
        log.info("Deleted tag id={} with {} link(s)", tagId, links);
    }
}

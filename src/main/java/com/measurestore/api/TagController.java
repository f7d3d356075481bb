package com.measurestore.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.measurestore.registry.Entity;
import com.measurestore.tag.Tag;
import com.measurestore.tag.TagKind;
import com.measurestore.tag.TagRegistry;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1")
public class TagController {

    public record TagRequest(
        @JsonProperty("kind") String kind,
        @JsonProperty("name") String name
    ) {}

    private final TagRegistry tags;

    public TagController(TagRegistry tags) {
        this.tags = tags;
    }

    @PostMapping("/tags")
    public Tag tag(@RequestBody TagRequest request) {
        return tags.getOrCreateTag(TagKind.fromValue(request.kind()), request.name());
    }

    @GetMapping("/tags/{id}/entities")
    public List<Entity> taggedEntities(@PathVariable long id) {
        return tags.entitiesTagged(id);
    }

    @DeleteMapping("/tags/{id}")
    public Map<String, Object> deleteTag(@PathVariable long id) {
        tags.deleteTag(id);
        return Map.of("status", "deleted", "tag_id", id);
    }

    @PutMapping("/entities/{entityId}/tags/{tagId}")
    public Map<String, Object> tagEntity(@PathVariable long entityId, @PathVariable long tagId) {
        tags.tagEntity(entityId, tagId);
        return Map.of("status", "tagged", "entity_id", entityId, "tag_id", tagId);
    }

    @GetMapping("/entities/{entityId}/tags")
    public List<Tag> entityTags(@PathVariable long entityId) {
        return tags.tagsOfEntity(entityId);
    }

    @PutMapping("/metrics/{metricId}/tags/{tagId}")
    public Map<String, Object> tagMetric(@PathVariable long metricId, @PathVariable long tagId) {
        tags.tagMetric(metricId, tagId);
        return Map.of("status", "tagged", "metric_id", metricId, "tag_id", tagId);
    }

    @GetMapping("/metrics/{metricId}/tags")
    public List<Tag> metricTags(@PathVariable long metricId) {
        return tags.tagsOfMetric(metricId);
    }
}

package im.arun.planindex.index;

import im.arun.planindex.model.ExtractedObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-process repository. Pages and objects keep insertion order.
 */
public class InMemoryObjectRepository implements ObjectRepository {

    private final Map<UUID, Map<UUID, Map<String, ExtractedObject>>> objects = new ConcurrentHashMap<>();
    private final Map<UUID, ProjectIndex> indices = new ConcurrentHashMap<>();

    @Override
    public void savePageObjects(UUID projectId, UUID pageId, List<? extends ExtractedObject> pageObjects) {
        Map<UUID, Map<String, ExtractedObject>> pages = pagesOf(projectId);
        synchronized (pages) {
            pages.put(pageId, byId(pageObjects, new LinkedHashMap<>()));
        }
    }

    @Override
    public void upsertObjects(UUID projectId, UUID pageId, List<? extends ExtractedObject> pageObjects) {
        Map<UUID, Map<String, ExtractedObject>> pages = pagesOf(projectId);
        synchronized (pages) {
            byId(pageObjects, pages.computeIfAbsent(pageId, k -> new LinkedHashMap<>()));
        }
    }

    @Override
    public List<ExtractedObject> findByProject(UUID projectId) {
        Map<UUID, Map<String, ExtractedObject>> pages = objects.get(projectId);
        if (pages == null) {
            return List.of();
        }
        List<ExtractedObject> result = new ArrayList<>();
        synchronized (pages) {
            pages.values().forEach(page -> result.addAll(page.values()));
        }
        return result;
    }

    @Override
    public List<ExtractedObject> findByPage(UUID projectId, UUID pageId) {
        Map<UUID, Map<String, ExtractedObject>> pages = objects.get(projectId);
        if (pages == null) {
            return List.of();
        }
        synchronized (pages) {
            Map<String, ExtractedObject> page = pages.get(pageId);
            return page == null ? List.of() : new ArrayList<>(page.values());
        }
    }

    @Override
    public Optional<ExtractedObject> findById(UUID projectId, String objectId) {
        return findByProject(projectId).stream()
                .filter(object -> object.getId().equals(objectId))
                .findFirst();
    }

    @Override
    public void saveIndex(ProjectIndex index) {
        indices.put(index.getProjectId(), index);
    }

    @Override
    public Optional<ProjectIndex> findIndex(UUID projectId) {
        return Optional.ofNullable(indices.get(projectId));
    }

    private Map<UUID, Map<String, ExtractedObject>> pagesOf(UUID projectId) {
        return objects.computeIfAbsent(projectId, k -> new LinkedHashMap<>());
    }

    private static Map<String, ExtractedObject> byId(List<? extends ExtractedObject> source,
                                                     Map<String, ExtractedObject> target) {
        for (ExtractedObject object : source) {
            target.put(object.getId(), object);
        }
        return target;
    }
}

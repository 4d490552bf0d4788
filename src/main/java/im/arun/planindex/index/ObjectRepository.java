package im.arun.planindex.index;

import im.arun.planindex.model.ExtractedObject;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage for extracted objects and project indices. Objects are grouped per page and
 * identified by their deterministic id, so saving the same id again replaces it.
 */
public interface ObjectRepository {

    /**
     * Replace the objects of one page.
     */
    void savePageObjects(UUID projectId, UUID pageId, List<? extends ExtractedObject> objects);

    /**
     * Add or replace objects on a page without touching the others, e.g. schedule tables
     * produced outside the extraction run.
     */
    void upsertObjects(UUID projectId, UUID pageId, List<? extends ExtractedObject> objects);

    List<ExtractedObject> findByProject(UUID projectId);

    List<ExtractedObject> findByPage(UUID projectId, UUID pageId);

    Optional<ExtractedObject> findById(UUID projectId, String objectId);

    void saveIndex(ProjectIndex index);

    Optional<ProjectIndex> findIndex(UUID projectId);
}

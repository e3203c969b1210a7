package com.relevx.domain;

import java.util.Map;

/**
 * Custom project writes not expressible as derived queries.
 */
public interface ProjectRepositoryCustom {

    /**
     * Partial update of the given fields, applied only if the stored version still equals {@code expectedVersion}.
     * Increments the version; sets updatedAt to now unless the fields carry one.
     *
     * @return true if the document was updated, false if it was missing or modified concurrently
     */
    boolean updateFields(String projectId, Long expectedVersion, Map<String, Object> fields);
}

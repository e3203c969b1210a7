package com.relevx.domain;

import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Map;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed conditional partial updates for projects.
 */
@Repository
@RequiredArgsConstructor
public class ProjectRepositoryImpl implements ProjectRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean updateFields(String projectId, Long expectedVersion, Map<String, Object> fields) {
        Criteria criteria = where("_id").is(projectId);
        criteria = expectedVersion == null
                ? criteria.and("version").exists(false)
                : criteria.and("version").is(expectedVersion);

        Update update = new Update();
        fields.forEach(update::set);
        if (!fields.containsKey("updatedAt")) {
            update.set("updatedAt", Instant.now());
        }
        if (expectedVersion == null) {
            update.set("version", 1L);
        } else {
            update.inc("version", 1);
        }
        UpdateResult result = mongoTemplate.updateFirst(new Query(criteria), update, Project.class);
        return result.getModifiedCount() > 0;
    }
}

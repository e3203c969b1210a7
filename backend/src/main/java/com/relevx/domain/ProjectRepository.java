package com.relevx.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for projects. Soft-deleted projects keep status DELETED and a renamed title.
 */
public interface ProjectRepository extends MongoRepository<Project, String>, ProjectRepositoryCustom {

    /** Non-deleted projects (pass DELETED), oldest first. */
    List<Project> findByUserIdAndStatusNotOrderByCreatedAtAsc(String userId, ProjectStatus status);

    List<Project> findByUserIdAndStatus(String userId, ProjectStatus status);

    Optional<Project> findByUserIdAndTitle(String userId, String title);

    boolean existsByUserIdAndTitle(String userId, String title);
}

package com.relevx.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import com.relevx.config.MongoConfig;
import org.bson.Document;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataMongoTest(properties = "spring.data.mongodb.auto-index-creation=true")
@Testcontainers
@Import(MongoConfig.class)
class ProjectRepositoryMongoIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    ProjectRepository projectRepository;
    @Autowired
    MongoTemplate mongoTemplate;

    @BeforeEach
    void clean() {
        projectRepository.deleteAll();
    }

    private static Project project(String userId, String title, ProjectStatus status, Instant createdAt) {
        Project p = new Project();
        p.setUserId(userId);
        p.setTitle(title);
        p.setFrequency(Frequency.WEEKLY);
        p.setDeliveryTime("09:00");
        p.setTimezone("Europe/Berlin");
        p.setDayOfWeek(2);
        p.setStatus(status);
        p.setNextRunAt(Instant.parse("2024-01-16T08:00:00Z"));
        p.setCreatedAt(createdAt);
        p.setUpdatedAt(createdAt);
        return p;
    }

    @Test
    @DisplayName("non-deleted projects of a user come back oldest first")
    void findsLiveProjectsInCreationOrder() {
        projectRepository.save(project("u1", "second", ProjectStatus.ACTIVE, Instant.parse("2024-01-02T00:00:00Z")));
        projectRepository.save(project("u1", "first", ProjectStatus.DRAFT, Instant.parse("2024-01-01T00:00:00Z")));
        projectRepository.save(project("u1", "[DELETED]:gone#1", ProjectStatus.DELETED, Instant.parse("2024-01-03T00:00:00Z")));
        projectRepository.save(project("u2", "other", ProjectStatus.ACTIVE, Instant.parse("2024-01-01T00:00:00Z")));

        assertThat(projectRepository.findByUserIdAndStatusNotOrderByCreatedAtAsc("u1", ProjectStatus.DELETED))
                .extracting(Project::getTitle)
                .containsExactly("first", "second");
        assertThat(projectRepository.findByUserIdAndStatus("u1", ProjectStatus.ACTIVE)).hasSize(1);
        assertThat(projectRepository.findByUserIdAndTitle("u1", "first")).isPresent();
        assertThat(projectRepository.existsByUserIdAndTitle("u2", "first")).isFalse();
    }

    @Test
    void titleUniquePerUser() {
        projectRepository.save(project("u1", "daily", ProjectStatus.DRAFT, Instant.now()));

        assertThatThrownBy(() -> projectRepository.save(project("u1", "daily", ProjectStatus.DRAFT, Instant.now())))
                .isInstanceOf(DuplicateKeyException.class);
    }

    @Test
    @DisplayName("conditional update applies only for the expected version and bumps it")
    void conditionalUpdate() {
        Project saved = projectRepository.save(project("u1", "daily", ProjectStatus.DRAFT, Instant.now()));
        Long version = saved.getVersion();

        boolean applied = projectRepository.updateFields(saved.getId(), version,
                Map.of("status", ProjectStatus.ACTIVE, "nextRunAt", Instant.parse("2024-01-20T08:00:00Z")));
        boolean stale = projectRepository.updateFields(saved.getId(), version, Map.of("status", ProjectStatus.PAUSED));

        assertThat(applied).isTrue();
        assertThat(stale).isFalse();
        Project reloaded = projectRepository.findById(saved.getId()).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(ProjectStatus.ACTIVE);
        assertThat(reloaded.getNextRunAt()).isEqualTo(Instant.parse("2024-01-20T08:00:00Z"));
        assertThat(reloaded.getVersion()).isEqualTo(version + 1);
        assertThat(reloaded.getUpdatedAt()).isNotNull();
    }

    @Test
    @DisplayName("enums are stored by lower-case wire name and read back")
    void wireNamesInDocuments() {
        Project saved = projectRepository.save(project("u1", "weekly", ProjectStatus.ACTIVE, Instant.now()));

        Document raw = mongoTemplate.getCollection("projects").find(new Document("_id",
                new org.bson.types.ObjectId(saved.getId()))).first();

        assertThat(raw).isNotNull();
        assertThat(raw.getString("frequency")).isEqualTo("weekly");
        assertThat(raw.getString("status")).isEqualTo("active");
        assertThat(projectRepository.findByUserIdAndStatus("u1", ProjectStatus.ACTIVE)).hasSize(1);
    }
}

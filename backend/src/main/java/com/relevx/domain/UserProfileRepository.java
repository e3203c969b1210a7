package com.relevx.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for users.
 */
public interface UserProfileRepository extends MongoRepository<UserProfile, String> {
}

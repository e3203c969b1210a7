package com.relevx.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for plans.
 */
public interface PlanRepository extends MongoRepository<Plan, String> {

    List<Plan> findAllByOrderByPrecedenceAsc();
}

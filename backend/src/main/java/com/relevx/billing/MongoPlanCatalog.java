package com.relevx.billing;

import com.relevx.config.CaffeineConfig;
import com.relevx.domain.Plan;
import com.relevx.domain.PlanRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Plans from the plans collection, ordered by precedence. Cached in planCache.
 */
@Component
@RequiredArgsConstructor
public class MongoPlanCatalog implements PlanCatalog {

    private final PlanRepository planRepository;

    @Override
    @Cacheable(cacheNames = CaffeineConfig.PLAN_CACHE, key = "'all'")
    public List<Plan> getPlans() {
        return List.copyOf(planRepository.findAllByOrderByPrecedenceAsc());
    }
}

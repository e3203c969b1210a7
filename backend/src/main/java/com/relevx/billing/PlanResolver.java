package com.relevx.billing;

import com.relevx.domain.Plan;
import com.relevx.domain.UserProfile;
import com.relevx.domain.UserProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Resolves the plan whose limits apply to a user: the user's paid plan while the subscription is active or
 * trialing, otherwise the plan flagged as default free plan.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlanResolver {

    private final UserProfileRepository userProfileRepository;
    private final SubscriptionOracle subscriptionOracle;
    private final PlanCatalog planCatalog;

    /**
     * @return empty when the user is unknown or no matching plan exists
     * @throws BillingException when the subscription state cannot be determined
     */
    public Optional<Plan> resolveEffectivePlan(String userId) {
        Optional<UserProfile> user = userProfileRepository.findById(userId);
        if (user.isEmpty()) {
            log.warn("No user profile for {}", userId);
            return Optional.empty();
        }
        List<Plan> plans = planCatalog.getPlans();
        if (subscriptionOracle.isSubscribed(user.get())) {
            String planId = user.get().getPlanId();
            return plans.stream().filter(p -> p.getId() != null && p.getId().equals(planId)).findFirst();
        }
        return plans.stream().filter(Plan::isDefaultFreePlan).findFirst();
    }
}

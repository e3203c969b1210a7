package com.relevx.billing;

import com.relevx.domain.Plan;

import java.util.List;

/**
 * Read-only list of subscription plans.
 */
public interface PlanCatalog {

    List<Plan> getPlans();
}

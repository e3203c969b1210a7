package com.relevx.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Subscription plan. Read-only to the scheduler; maxDailyRuns bounds how many projects may be due on one day.
 */
@Document(collection = "plans")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Plan {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String planName;
    private int maxDailyRuns;
    /** Opaque billing price/subscription reference. */
    private String subscriptionReference;
    /** Plan applied to users without an active or trialing subscription. At most one plan sets this. */
    private boolean defaultFreePlan;
    private int precedence;
}

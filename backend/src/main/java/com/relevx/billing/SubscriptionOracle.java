package com.relevx.billing;

import com.relevx.domain.UserProfile;

/**
 * Answers whether a user currently holds a paid subscription.
 */
public interface SubscriptionOracle {

    /**
     * @throws BillingException when the provider cannot be reached or answers with an error
     */
    boolean isSubscribed(UserProfile user);
}

package com.relevx.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * User record as far as plan resolution needs it.
 */
@Document(collection = "users")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class UserProfile {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String email;
    /** Paid plan; only honoured while the subscription is active or trialing. */
    private String planId;
    private Billing billing = new Billing();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Billing {
        private String stripeCustomerId;
        /** Empty or null when the user never subscribed. */
        private String stripeSubscriptionId;
    }
}

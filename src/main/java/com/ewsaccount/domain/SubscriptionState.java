package com.ewsaccount.domain;

import lombok.Value;

/**
 * Server-side pull subscription: id plus the watermark of the last delivered event
 */
@Value
public class SubscriptionState {

    String subscriptionId;
    String watermark;

    public SubscriptionState withWatermark(String newWatermark) {
        return new SubscriptionState(subscriptionId, newWatermark);
    }
}

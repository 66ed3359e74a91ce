package com.ewsaccount.domain;

import lombok.NonNull;
import lombok.Value;

/**
 * Explicit configuration used instead of autodiscovery
 */
@Value
public class ProtocolConfig {

    @NonNull
    Protocol protocol;
}

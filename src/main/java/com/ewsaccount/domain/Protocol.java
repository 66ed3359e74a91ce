package com.ewsaccount.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Connection handle to the remote mailbox service.
 * Opaque to the account; the call layer reads what it needs.
 */
@Value
@Builder
public class Protocol {

    String serviceEndpoint;
    String version;
    Credentials credentials;
    @Builder.Default
    boolean verifySsl = true;
}

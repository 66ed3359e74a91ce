package com.ewsaccount.transport;

import com.ewsaccount.domain.Credentials;
import com.ewsaccount.domain.DiscoveryResult;

/**
 * Locates the service endpoint for a mailbox address
 */
public interface Autodiscovery {

    DiscoveryResult discover(String emailAddress, Credentials credentials, boolean verifySsl);
}

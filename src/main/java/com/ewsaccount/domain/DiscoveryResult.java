package com.ewsaccount.domain;

import lombok.Value;

/**
 * Outcome of autodiscovery. The server may report a different primary address than the one asked for.
 */
@Value
public class DiscoveryResult {

    String primarySmtpAddress;
    Protocol protocol;
}

package com.ewsaccount.domain;

import lombok.ToString;
import lombok.Value;

/**
 * Username/password pair for the remote service
 */
@Value
public class Credentials {

    String username;
    @ToString.Exclude
    String password;
}

package com.ewsaccount.domain;

/**
 * How the service user acts on behalf of the mailbox owner
 */
public enum AccessType {
    DELEGATE,
    IMPERSONATION
}

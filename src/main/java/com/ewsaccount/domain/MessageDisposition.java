package com.ewsaccount.domain;

/**
 * What happens to a message item after update. Ignored for non-message items.
 */
public enum MessageDisposition {
    SAVE_ONLY,
    SEND_ONLY,
    SEND_AND_SAVE_COPY
}

package com.flagship.invoice_followup.template;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Reminder template. A null {@code companyId} marks a global default.
 *
 * {@code dayOffset} is signed: -1 means the day before the due date, 7 a week after it.
 */
@Value
@Builder(toBuilder = true)
public class MessageTemplate {
    UUID id;
    UUID companyId;
    Channel channel;
    int dayOffset;
    String subject;
    String body;

    public boolean isGlobal() {
        return companyId == null;
    }
}

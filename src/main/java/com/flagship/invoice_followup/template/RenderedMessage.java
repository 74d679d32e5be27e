package com.flagship.invoice_followup.template;

import lombok.Value;

/**
 * Template output. {@code subject} is null for channels without one.
 */
@Value
public class RenderedMessage {
    String subject;
    String body;
}

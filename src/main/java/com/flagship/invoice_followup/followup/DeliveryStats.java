package com.flagship.invoice_followup.followup;

import com.flagship.invoice_followup.template.Channel;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
public class DeliveryStats {
    Instant since;
    long total;
    Map<FollowUpStatus, Long> byStatus;
    Map<Channel, Long> byChannel;

    /**
     * Share of attempts that reached the provider, SENT or DELIVERED, over all rows. 0 when empty.
     */
    public double getSuccessRate() {
        if (total == 0) {
            return 0.0;
        }
        long ok = byStatus.getOrDefault(FollowUpStatus.SENT, 0L)
            + byStatus.getOrDefault(FollowUpStatus.DELIVERED, 0L);
        return (double) ok / total;
    }
}

package com.lnradar.notification;

import java.util.List;

/**
 * Outbound message channel. Delivery is at-least-once at best: implementations log failures and never retry.
 */
public interface NotificationChannel {

    /**
     * @param controls rows of buttons; may be empty
     * @return true if the channel accepted the message
     */
    boolean send(String text, List<List<InlineButton>> controls);
}

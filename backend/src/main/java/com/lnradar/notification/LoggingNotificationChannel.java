package com.lnradar.notification;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Used when Telegram is disabled: messages go to the application log only.
 */
@Slf4j
public class LoggingNotificationChannel implements NotificationChannel {

    @Override
    public boolean send(String text, List<List<InlineButton>> controls) {
        log.info("Notification (telegram disabled):\n{}", text);
        return true;
    }
}

package io.fullerstack.ses.core.notify;

/**
 * Notification backends a monitor delivers to, in delivery order.
 */
public enum NotificationBackend {

    PAGER_DUTY("PagerDuty"),
    SLACK("Slack");

    private final String displayName;

    NotificationBackend(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}

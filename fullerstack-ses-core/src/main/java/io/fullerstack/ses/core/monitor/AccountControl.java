package io.fullerstack.ses.core.monitor;

/**
 * Remote switch for account-level sending. Both mutators are idempotent.
 */
public interface AccountControl {

    boolean isSendingEnabled();

    void enableSending();

    void disableSending();
}

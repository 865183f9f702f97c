package io.fullerstack.ses.aws;

import io.fullerstack.ses.core.monitor.AccountControl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.ses.SesClient;
import software.amazon.awssdk.services.ses.model.GetAccountSendingEnabledRequest;
import software.amazon.awssdk.services.ses.model.GetAccountSendingEnabledResponse;
import software.amazon.awssdk.services.ses.model.SesException;
import software.amazon.awssdk.services.ses.model.UpdateAccountSendingEnabledRequest;

import java.util.Objects;

/**
 * Enables and disables account-level sending through SES.
 *
 * @author Fullerstack
 */
public class SesAccountControl implements AccountControl {

  private static final Logger logger = LoggerFactory.getLogger(SesAccountControl.class);

  private final SesClient ses;

  public SesAccountControl(SesClient ses) {
    this.ses = Objects.requireNonNull(ses, "ses cannot be null");
  }

  /**
   * @throws AwsCallException if SES fails or is throttled
   */
  @Override
  public boolean isSendingEnabled() {
    try {
      GetAccountSendingEnabledResponse response =
          ses.getAccountSendingEnabled(GetAccountSendingEnabledRequest.builder().build());
      // SES omits the flag for accounts that were never paused
      return response.enabled() == null || response.enabled();
    } catch (SesException e) {
      throw AwsErrors.wrap("SES", "get account sending status", e);
    }
  }

  @Override
  public void enableSending() {
    update(true);
  }

  @Override
  public void disableSending() {
    update(false);
  }

  /**
   * Flips account sending.
   *
   * @return the new state, true when sending is now enabled
   */
  public boolean toggleSending() {
    boolean enable = !isSendingEnabled();
    update(enable);
    return enable;
  }

  private void update(boolean enabled) {
    try {
      ses.updateAccountSendingEnabled(UpdateAccountSendingEnabledRequest.builder()
          .enabled(enabled)
          .build());
      logger.info("SES account sending {}", enabled ? "enabled" : "disabled");
    } catch (SesException e) {
      throw AwsErrors.wrap("SES", enabled ? "enable account sending" : "disable account sending", e);
    }
  }
}

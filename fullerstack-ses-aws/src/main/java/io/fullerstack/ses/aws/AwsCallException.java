package io.fullerstack.ses.aws;

import io.fullerstack.ses.core.SesMonitorException;

/**
 * Exception thrown when an SES or CloudWatch call fails.
 */
public class AwsCallException extends SesMonitorException {

  private final boolean throttled;

  public AwsCallException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public AwsCallException(String message, Throwable cause, boolean throttled) {
    super(message, cause);
    this.throttled = throttled;
  }

  /**
   * @return true when AWS rejected the call with a throttling error
   */
  public boolean isThrottled() {
    return throttled;
  }
}

package io.fullerstack.ses.aws;

import software.amazon.awssdk.awscore.exception.AwsServiceException;

final class AwsErrors {

  static final String THROTTLING = "ThrottlingException";
  static final String THROTTLING_SES = "Throttling";

  private AwsErrors() {
  }

  static boolean isThrottling(AwsServiceException e) {
    if (e.isThrottlingException()) {
      return true;
    }
    if (e.awsErrorDetails() == null) {
      return false;
    }
    String code = e.awsErrorDetails().errorCode();
    return THROTTLING.equals(code) || THROTTLING_SES.equals(code);
  }

  static AwsCallException wrap(String service, String operation, AwsServiceException e) {
    if (isThrottling(e)) {
      return new AwsCallException(service + " API throttled during " + operation + ", retry later", e, true);
    }
    return new AwsCallException("Failed to " + operation + " via " + service, e);
  }
}

package io.fullerstack.ses.aws;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fullerstack.ses.core.config.ConfigurationException;
import io.fullerstack.ses.core.config.HierarchicalConfig;
import io.fullerstack.ses.core.config.MonitorSettings;
import io.fullerstack.ses.core.monitor.SesAccountMonitor;
import io.fullerstack.ses.core.notify.pagerduty.PagerDutyDispatcher;
import io.fullerstack.ses.core.notify.slack.SlackDispatcher;
import io.fullerstack.ses.core.notify.transport.HttpNotificationTransport;
import io.fullerstack.ses.core.notify.transport.NotificationTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.ses.SesClient;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.Objects;

/**
 * Wires a {@link SesAccountMonitor} from settings and pre-built clients.
 * <p>
 * Clients are never created here; the caller owns and closes them.
 *
 * <pre>
 * try (SesClient ses = SesClient.create(); CloudWatchClient cloudWatch = CloudWatchClient.create()) {
 *   MonitorSettings settings = MonitorSettings.from(HierarchicalConfig.forEnvironment("prod"));
 *   SesAccountMonitor monitor = SesAccountMonitorFactory.create(settings, ses, cloudWatch,
 *       SesAccountMonitorFactory.httpClient(settings));
 *   monitor.runCycle(true);
 * }
 * </pre>
 *
 * @author Fullerstack
 */
public final class SesAccountMonitorFactory {

  private static final Logger logger = LoggerFactory.getLogger(SesAccountMonitorFactory.class);

  private SesAccountMonitorFactory() {
  }

  /**
   * @return HTTP client with the configured connect timeout
   */
  public static HttpClient httpClient(MonitorSettings settings) {
    return HttpClient.newBuilder()
        .connectTimeout(settings.httpTimeout())
        .build();
  }

  public static SesAccountMonitor create(HierarchicalConfig config, SesClient ses, CloudWatchClient cloudWatch) {
    MonitorSettings settings = MonitorSettings.from(config);
    return create(settings, ses, cloudWatch, httpClient(settings));
  }

  public static SesAccountMonitor create(MonitorSettings settings, SesClient ses, CloudWatchClient cloudWatch,
                                         HttpClient httpClient) {
    return create(settings, ses, cloudWatch, httpClient, Clock.systemUTC());
  }

  /**
   * Builds a monitor backed by SES, CloudWatch, PagerDuty and Slack.
   *
   * @param settings   monitor settings
   * @param ses        SES client
   * @param cloudWatch CloudWatch client
   * @param httpClient client shared by both notification transports
   * @param clock      clock for check timestamps
   * @return ready monitor
   * @throws ConfigurationException if a notification URL is not an absolute http(s) URL
   */
  public static SesAccountMonitor create(MonitorSettings settings, SesClient ses, CloudWatchClient cloudWatch,
                                         HttpClient httpClient, Clock clock) {
    Objects.requireNonNull(settings, "settings cannot be null");
    Objects.requireNonNull(httpClient, "httpClient cannot be null");

    ObjectMapper objectMapper = new ObjectMapper();
    NotificationTransport pagerDuty = new HttpNotificationTransport(
        httpClient, objectMapper, uri("pager-duty.events-url", settings.pagerDuty().eventsUrl()), settings.httpTimeout());
    NotificationTransport slack = settings.slack().webhookUrl() == null
        ? unconfigured("Slack webhook URL")
        : new HttpNotificationTransport(
            httpClient, objectMapper, uri("slack.webhook-url", settings.slack().webhookUrl()), settings.httpTimeout());

    logger.info("Creating SES account monitor {} (strategy={}, region={})",
        settings.account().serviceName(), settings.strategyName(), settings.account().region());

    return SesAccountMonitor.builder()
        .settings(settings)
        .metricsSource(new AwsMetricsSource(ses, cloudWatch))
        .accountControl(new SesAccountControl(ses))
        .pagerDutyDispatcher(new PagerDutyDispatcher(pagerDuty, settings.pagerDuty().dryRun()))
        .slackDispatcher(new SlackDispatcher(slack, settings.slack().channels(), settings.slack().dryRun()))
        .clock(clock)
        .build();
  }

  private static URI uri(String key, String value) {
    try {
      return URI.create(value);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid URL for '" + key + "': " + value, e);
    }
  }

  private static NotificationTransport unconfigured(String what) {
    return payload -> {
      throw new IOException(what + " is not configured");
    };
  }
}

package io.fullerstack.ses.aws;

import io.fullerstack.ses.core.model.MetricSeries;
import io.fullerstack.ses.core.model.ReputationMetric;
import io.fullerstack.ses.core.model.SendingStats;
import io.fullerstack.ses.core.monitor.MetricsSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.CloudWatchException;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricDataRequest;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricDataResponse;
import software.amazon.awssdk.services.cloudwatch.model.Metric;
import software.amazon.awssdk.services.cloudwatch.model.MetricDataQuery;
import software.amazon.awssdk.services.cloudwatch.model.MetricDataResult;
import software.amazon.awssdk.services.cloudwatch.model.MetricStat;
import software.amazon.awssdk.services.ses.SesClient;
import software.amazon.awssdk.services.ses.model.GetSendQuotaRequest;
import software.amazon.awssdk.services.ses.model.GetSendQuotaResponse;
import software.amazon.awssdk.services.ses.model.SesException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads SES sending counters and reputation metrics.
 * <p>
 * <b>Sending quota</b>: SES {@code GetSendQuota}.
 * <br>
 * <b>Reputation</b>: CloudWatch {@code GetMetricData} on namespace {@code AWS/SES}, statistic
 * {@code Average}, one query per {@link ReputationMetric}. Pages are followed through
 * {@code nextToken} and samples are merged per query id. SES publishes reputation as a ratio,
 * so values are multiplied by 100.
 *
 * @author Fullerstack
 */
public class AwsMetricsSource implements MetricsSource {

  private static final Logger logger = LoggerFactory.getLogger(AwsMetricsSource.class);

  static final String NAMESPACE = "AWS/SES";
  static final String STATISTIC = "Average";

  private final SesClient ses;
  private final CloudWatchClient cloudWatch;

  /**
   * @param ses        SES client used for the sending quota
   * @param cloudWatch CloudWatch client used for reputation metrics
   */
  public AwsMetricsSource(SesClient ses, CloudWatchClient cloudWatch) {
    this.ses = Objects.requireNonNull(ses, "ses cannot be null");
    this.cloudWatch = Objects.requireNonNull(cloudWatch, "cloudWatch cannot be null");
  }

  /**
   * @throws AwsCallException if SES fails or is throttled
   */
  @Override
  public SendingStats getSendingStats() {
    try {
      GetSendQuotaResponse quota = ses.getSendQuota(GetSendQuotaRequest.builder().build());
      double sent = quota.sentLast24Hours() == null ? 0.0 : quota.sentLast24Hours();
      double max = quota.max24HourSend() == null ? 0.0 : quota.max24HourSend();
      logger.debug("SES send quota: sent={} max={}", sent, max);
      return new SendingStats(sent, max);
    } catch (SesException e) {
      throw AwsErrors.wrap("SES", "get send quota", e);
    }
  }

  /**
   * @throws AwsCallException if CloudWatch fails or is throttled
   */
  @Override
  public List<MetricSeries> getReputationMetrics(Instant start, Instant end, int periodSeconds) {
    Objects.requireNonNull(start, "start cannot be null");
    Objects.requireNonNull(end, "end cannot be null");

    List<MetricDataQuery> queries = Arrays.stream(ReputationMetric.values())
        .map(metric -> query(metric, periodSeconds))
        .toList();

    Map<String, List<MetricSeries.Sample>> samples = new LinkedHashMap<>();
    for (ReputationMetric metric : ReputationMetric.values()) {
      samples.put(metric.id(), new ArrayList<>());
    }

    try {
      String nextToken = null;
      int pages = 0;
      do {
        GetMetricDataResponse response = cloudWatch.getMetricData(GetMetricDataRequest.builder()
            .metricDataQueries(queries)
            .startTime(start)
            .endTime(end)
            .nextToken(nextToken)
            .build());
        pages++;

        for (MetricDataResult result : response.metricDataResults()) {
          List<MetricSeries.Sample> target = samples.get(result.id());
          if (target == null) {
            logger.warn("Ignoring unexpected metric data result {}", result.id());
            continue;
          }
          List<Instant> timestamps = result.timestamps();
          List<Double> values = result.values();
          for (int i = 0; i < Math.min(timestamps.size(), values.size()); i++) {
            target.add(new MetricSeries.Sample(timestamps.get(i), values.get(i) * 100.0));
          }
        }
        nextToken = response.nextToken();
      } while (nextToken != null && !nextToken.isEmpty());

      logger.debug("Fetched reputation metrics between {} and {} in {} page(s)", start, end, pages);
    } catch (CloudWatchException e) {
      throw AwsErrors.wrap("CloudWatch", "get reputation metrics", e);
    }

    return Arrays.stream(ReputationMetric.values())
        .map(metric -> new MetricSeries(metric.id(), metric.label(), samples.get(metric.id())))
        .toList();
  }

  private static MetricDataQuery query(ReputationMetric metric, int periodSeconds) {
    return MetricDataQuery.builder()
        .id(metric.id())
        .label(metric.label())
        .metricStat(MetricStat.builder()
            .metric(Metric.builder()
                .namespace(NAMESPACE)
                .metricName(metric.metricName())
                .build())
            .period(periodSeconds)
            .stat(STATISTIC)
            .build())
        .returnData(true)
        .build();
  }
}

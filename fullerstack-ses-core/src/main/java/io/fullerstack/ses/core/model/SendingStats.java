package io.fullerstack.ses.core.model;

/**
 * Rolling 24-hour sending counters of the account.
 *
 * @param sentLast24Hours messages sent in the last 24 hours
 * @param max24HourSend   messages allowed per 24 hours
 */
public record SendingStats(double sentLast24Hours, double max24HourSend) {
}

package org.courtside.rotation.config;

import org.courtside.rotation.scheduler.QueueConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Queue generation settings, bound from {@code rotation.scheduler.*}.
 *
 * @param maxActiveParticipants largest active pool a session may generate a queue for;
 *                              scoring cost grows with the fourth power of the pool size
 * @param scoringThreads        worker threads for scoring large rounds, 0 to size from available processors
 */
@ConfigurationProperties(prefix = "rotation.scheduler")
public record SchedulerProperties(
    @DefaultValue("3") int maxQueueRounds,
    @DefaultValue("10") int recencyWindow,
    @DefaultValue("20000") int parallelThreshold,
    @DefaultValue("40") int maxActiveParticipants,
    @DefaultValue("0") int scoringThreads
) {

    public QueueConfig toQueueConfig() {
        return new QueueConfig(maxQueueRounds, recencyWindow, parallelThreshold);
    }
}

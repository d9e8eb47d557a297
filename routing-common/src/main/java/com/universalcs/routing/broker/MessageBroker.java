package com.universalcs.routing.broker;

import com.universalcs.routing.error.BrokerException;

/**
 * At-least-once message broker the router submits deferred work to.
 *
 * submit returns once the broker has accepted the work item. It never waits
 * for the work to be processed; callers needing delivery confirmation must
 * observe the broker's own acknowledgement channel.
 */
public interface MessageBroker {

    /**
     * Submit a work item to a queue.
     *
     * @param queue target queue
     * @param workItem work item to enqueue
     * @throws BrokerException if the broker is unreachable or rejects the item
     */
    void submit(WorkQueue queue, WorkItem workItem);
}

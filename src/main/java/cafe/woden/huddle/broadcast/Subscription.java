package cafe.woden.huddle.broadcast;

import cafe.woden.huddle.model.TopicRef;

/**
 * Handle for one subscriber's registration on a broadcaster.
 *
 * @param fromSeq first sequence number the subscriber receives
 */
public record Subscription(TopicRef topic, long id, long fromSeq) {}

package com.ryuqq.provisioner.core.model;

/**
 * Kind of a provisioned resource.
 *
 * <p>{@link #teardownRank()} fixes the order in which kinds are removed: external
 * traffic is cut first (gateway), storage goes last because emptying a bucket is the
 * slowest and most failure-prone deletion.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum ResourceKind {

    /** Object storage bucket (and objects published into it). */
    STORAGE(5),

    /** Key-value table with a change stream. */
    TABLE(3),

    /** Compute function. */
    FUNCTION(2),

    /** HTTP gateway. */
    GATEWAY(0),

    /** Notification topic. */
    TOPIC(4),

    /** Event-source mapping, bucket notification or permission grant. */
    TRIGGER(1);

    private final int teardownRank;

    ResourceKind(int teardownRank) {
        this.teardownRank = teardownRank;
    }

    /**
     * Position of this kind in the teardown sequence (lower is deleted earlier).
     *
     * @return teardown rank
     */
    public int teardownRank() {
        return teardownRank;
    }
}

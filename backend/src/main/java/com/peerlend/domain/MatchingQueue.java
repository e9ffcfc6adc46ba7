package com.peerlend.domain;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Scaled balances of one side of one market (pool or P2P), bucketed by order of magnitude.
 * A user sits in the bucket given by the bit length of their balance; within a bucket users are
 * kept in insertion order. Zero balances are not stored.
 * <p>
 * {@link #getMatch(BigDecimal)} returns the oldest user of the smallest bucket able to absorb the
 * requested value, falling back to the largest bucket, so a single match tends to cover the request.
 * The running {@link #total()} is the mirrored scaled balance of the side.
 */
public final class MatchingQueue {

    private final Map<String, BigDecimal> valueOf;
    private final TreeMap<Integer, LinkedHashSet<String>> buckets;
    private BigDecimal total;

    public MatchingQueue() {
        this.valueOf = new HashMap<>();
        this.buckets = new TreeMap<>();
        this.total = BigDecimal.ZERO;
    }

    public BigDecimal valueOf(String user) {
        return valueOf.getOrDefault(user, BigDecimal.ZERO);
    }

    public BigDecimal total() {
        return total;
    }

    public int size() {
        return valueOf.size();
    }

    public boolean contains(String user) {
        return valueOf.containsKey(user);
    }

    public Map<String, BigDecimal> values() {
        return Collections.unmodifiableMap(valueOf);
    }

    /**
     * Sets the user's balance, moving it to the matching bucket. A zero value removes the user.
     */
    public void update(String user, BigDecimal newValue) {
        Objects.requireNonNull(user, "user must not be null");
        if (newValue == null || newValue.signum() < 0) {
            throw new IllegalArgumentException("Queue value must be non-negative, got: " + newValue);
        }
        BigDecimal former = valueOf(user);
        if (former.compareTo(newValue) == 0) {
            return;
        }
        total = total.subtract(former).add(newValue);

        int formerBucket = bucketOf(former);
        int newBucket = bucketOf(newValue);
        if (newValue.signum() == 0) {
            valueOf.remove(user);
            removeFromBucket(user, formerBucket);
            return;
        }
        valueOf.put(user, newValue);
        if (former.signum() != 0 && formerBucket == newBucket) {
            return;
        }
        if (former.signum() != 0) {
            removeFromBucket(user, formerBucket);
        }
        buckets.computeIfAbsent(newBucket, b -> new LinkedHashSet<>()).add(user);
    }

    /**
     * @return the user to match against {@code value}, or null when the queue is empty
     */
    public String getMatch(BigDecimal value) {
        if (buckets.isEmpty()) {
            return null;
        }
        Integer next = buckets.ceilingKey(bucketOf(value));
        LinkedHashSet<String> bucket = buckets.get(next != null ? next : buckets.lastKey());
        return bucket.iterator().next();
    }

    public MatchingQueue copy() {
        MatchingQueue copy = new MatchingQueue();
        copy.valueOf.putAll(valueOf);
        buckets.forEach((bucket, users) -> copy.buckets.put(bucket, new LinkedHashSet<>(users)));
        copy.total = total;
        return copy;
    }

    private void removeFromBucket(String user, int bucket) {
        LinkedHashSet<String> users = buckets.get(bucket);
        if (users == null) {
            return;
        }
        users.remove(user);
        if (users.isEmpty()) {
            buckets.remove(bucket);
        }
    }

    static int bucketOf(BigDecimal value) {
        if (value == null || value.signum() <= 0) {
            return 0;
        }
        return value.toBigInteger().bitLength();
    }
}

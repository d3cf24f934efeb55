package com.authplatform.credentialsvc.domain.ratelimit;

import java.time.Duration;

/**
 * Counter value right after an increment, and how long until the bucket resets.
 */
public record BucketState(long count, Duration resetAfter) {
}

/**
 * Contains the backoff strategies that produce timeout sequences, such as
 * {@link com.sailfish.insistent.retry.FixedRetryStrategy} and
 * {@link com.sailfish.insistent.retry.ExponentialBackoffRetryStrategy}.
 */
package com.sailfish.insistent.retry;

/**
 * Backoff and retry for transient store failures.
 */
package chatlog.retry;

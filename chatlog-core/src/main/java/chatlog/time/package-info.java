/**
 * Timestamp extraction across the encodings different writers use.
 *
 * @see chatlog.time.TimestampExtractor
 */
package chatlog.time;

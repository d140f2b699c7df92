/**
 * Message model: stored rows, the tagged raw timestamp, kinds, and the normalized read view.
 */
package chatlog.model;

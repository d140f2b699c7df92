/**
 * Bounding the live table: relocation of the oldest messages to the archive, on demand or
 * on a schedule.
 */
package chatlog.compact;

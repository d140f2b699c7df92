/**
 * Read access to archived messages.
 */
package chatlog.archive;

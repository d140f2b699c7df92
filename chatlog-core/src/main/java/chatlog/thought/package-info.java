/**
 * Typed, tagged thoughts posted by a designated agent identity.
 */
package chatlog.thought;

/**
 * Small internal helpers: thread naming and the tag JSON codec.
 */
package chatlog.util;

/**
 * Transaction handling for multi-statement chat log operations.
 */
package chatlog.tx;

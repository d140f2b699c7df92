package chatlog;

/**
 * Outcome of an append.
 *
 * @param id     id of the message that now holds the text
 * @param merged {@code true} if the text was appended to an existing message
 */
public record AppendResult(String id, boolean merged) {
}

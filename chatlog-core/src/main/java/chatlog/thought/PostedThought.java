package chatlog.thought;

/**
 * Id and normalized type of a newly posted thought.
 */
public record PostedThought(String id, ThoughtType type) {
}

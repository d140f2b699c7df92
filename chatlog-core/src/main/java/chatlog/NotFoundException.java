package chatlog;

/**
 * Thrown when an operation references a message id that does not exist.
 */
public final class NotFoundException extends ChatLogException {
  private final String messageId;

  public NotFoundException(String messageId) {
    super(ErrorKind.NOT_FOUND, "Message not found: " + messageId);
    this.messageId = messageId;
  }

  public String messageId() {
    return messageId;
  }
}

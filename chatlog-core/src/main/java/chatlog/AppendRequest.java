package chatlog;

import chatlog.model.MessageKind;
import chatlog.model.StoredTimestamp;

import java.time.Instant;
import java.util.Objects;

/**
 * A message to append to the live log.
 *
 * <p>Only {@code text} is required. A blank sender, recipient or kind is replaced by the
 * writer's defaults. When {@code id} is set the message is always inserted under that id and
 * never merged into the previous message. When {@code timestamp} is unset the writer stamps
 * the message with its clock.
 *
 * @see MessageWriter
 */
public final class AppendRequest {
    /** Earliest structured timestamp every supported database column can hold. */
    public static final Instant MIN_STRUCTURED = Instant.parse("1000-01-01T00:00:00Z");
    /** Latest structured timestamp every supported database column can hold. */
    public static final Instant MAX_STRUCTURED = Instant.parse("9999-12-31T23:59:59.999999Z");

    private final String id;
    private final String sender;
    private final String recipient;
    private final String text;
    private final MessageKind kind;
    private final StoredTimestamp timestamp;

    private AppendRequest(Builder builder) {
        if (builder.text == null || builder.text.isBlank()) {
            throw new MalformedInputException("text is required");
        }
        if (builder.id != null && builder.id.isBlank()) {
            throw new MalformedInputException("id cannot be blank");
        }
        if (builder.timestamp instanceof StoredTimestamp.Structured structured
            && (structured.instant().isBefore(MIN_STRUCTURED) || structured.instant().isAfter(MAX_STRUCTURED))) {
            throw new MalformedInputException("timestamp out of storable range: " + structured.instant());
        }
        this.id = builder.id;
        this.sender = blankToNull(builder.sender);
        this.recipient = blankToNull(builder.recipient);
        this.text = builder.text;
        this.kind = MessageKind.of(builder.kind);
        this.timestamp = builder.timestamp;
    }

    public static Builder builder(String text) {
        return new Builder().text(text);
    }

    /**
     * Shorthand for a plain message without caller id or timestamp.
     */
    public static AppendRequest of(String sender, String recipient, String text, String kind) {
        return builder(text).sender(sender).recipient(recipient).kind(kind).build();
    }

    /** Caller-supplied id, or {@code null} to generate one. */
    public String id() {
        return id;
    }

    /** Sender, or {@code null} for the writer's default identity. */
    public String sender() {
        return sender;
    }

    /** Recipient, or {@code null} for the broadcast recipient. */
    public String recipient() {
        return recipient;
    }

    public String text() {
        return text;
    }

    public MessageKind kind() {
        return kind;
    }

    /** Caller-supplied timestamp, or {@code null} to use the writer's clock. */
    public StoredTimestamp timestamp() {
        return timestamp;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    @Override
    public String toString() {
        return "AppendRequest{"
            + "id='" + id + '\''
            + ", sender='" + sender + '\''
            + ", recipient='" + recipient + '\''
            + ", kind=" + kind
            + ", textLength=" + text.length()
            + '}';
    }

    /** Builder for {@link AppendRequest}. */
    public static final class Builder {
        private String id;
        private String sender;
        private String recipient;
        private String text;
        private String kind;
        private StoredTimestamp timestamp;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sender(String sender) {
            this.sender = sender;
            return this;
        }

        public Builder recipient(String recipient) {
            this.recipient = recipient;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder kind(MessageKind kind) {
            this.kind = kind == null ? null : kind.code();
            return this;
        }

        public Builder timestamp(StoredTimestamp timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
            return this;
        }

        /**
         * @throws MalformedInputException if text is missing or blank, id is blank, or a
         *     structured timestamp lies outside {@link #MIN_STRUCTURED}..{@link #MAX_STRUCTURED}
         */
        public AppendRequest build() {
            return new AppendRequest(this);
        }
    }
}

/**
 * Bounded, chronologically consistent message log shared by several writers.
 *
 * <p>{@link chatlog.ChatLog} is the entry point. Writes go through
 * {@link chatlog.MessageWriter}, which merges bursts from one sender; reads go through
 * {@link chatlog.MessageReader}; {@link chatlog.compact.Compactor} keeps the live table
 * bounded by relocating old messages to the archive.
 */
package chatlog;

package com.ivamare.eventsourcing.replay;

/**
 * One positional difference between two event streams.
 *
 * @param version 1-based position in the streams
 * @param diff    what differs
 */
public record StreamDifference(long version, String diff) {
}

package com.scholary.scribe.transcript;

/**
 * One diarized speech segment.
 *
 * <p>Times are seconds from the start of the recording. {@code startSeconds <= endSeconds} is not
 * guaranteed; the service's values are passed through as given.
 */
public record Utterance(String speaker, String text, double startSeconds, double endSeconds) {}

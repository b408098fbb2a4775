package io.mnemos.core.embedding;

public record TextChunk(String text, int index, int startChar, int endChar, int charCount) {
}

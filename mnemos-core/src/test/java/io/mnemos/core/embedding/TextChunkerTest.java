package io.mnemos.core.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class TextChunkerTest {

    @Test
    void shouldReturnSingleChunkForShortText() {
        List<TextChunk> chunks = new TextChunker().chunk("  a short note  ");

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).text()).isEqualTo("a short note");
        assertThat(chunks.get(0).index()).isZero();
    }

    @Test
    void shouldOverlapConsecutiveWindows() {
        String text = "abcdefghij".repeat(5);

        List<TextChunk> chunks = new TextChunker(20, 5, "\n").chunk(text);

        assertThat(chunks).hasSizeGreaterThan(2);
        for (int i = 1; i < chunks.size(); i++) {
            assertThat(chunks.get(i).startChar()).isEqualTo(chunks.get(i - 1).endChar() - 5);
            assertThat(chunks.get(i).index()).isEqualTo(i);
        }
        assertThat(chunks.get(chunks.size() - 1).endChar()).isEqualTo(text.length());
    }

    @Test
    void shouldPreferBreakingAfterSeparatorInOverlapRegion() {
        String text = "first line of text\nsecond line that keeps going on";

        List<TextChunk> chunks = new TextChunker(22, 6, "\n").chunk(text);

        assertThat(chunks.get(0).text()).isEqualTo("first line of text");
        assertThat(chunks.get(0).endChar()).isEqualTo(19);
    }

    @Test
    void shouldReturnNothingForEmptyText() {
        assertThat(new TextChunker().chunk("")).isEmpty();
        assertThat(new TextChunker().chunk(null)).isEmpty();
    }

    @Test
    void shouldRejectOverlapNotSmallerThanSize() {
        assertThatThrownBy(() -> new TextChunker(10, 10, "\n")).isInstanceOf(IllegalArgumentException.class);
    }
}

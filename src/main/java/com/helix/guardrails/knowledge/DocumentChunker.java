package com.helix.guardrails.knowledge;

import com.helix.guardrails.budget.ModelProfile;
import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.DocumentSplitter;
import dev.langchain4j.data.document.splitter.DocumentSplitters;
import dev.langchain4j.data.segment.TextSegment;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.List;

/**
 * Splits document text into overlapping chunks of at most {@code chunkSize} characters.
 *
 * <p>Backed by LangChain4j's recursive splitter: paragraph, line, sentence, word, then
 * character boundaries, with up to {@code chunkOverlap} characters of trailing sentences
 * carried into the next chunk.
 */
@Getter
public class DocumentChunker {

    private static final int CHARS_PER_CHUNK_TOKEN = 4;
    private static final int MIN_OVERLAP = 16;

    private final int chunkSize;
    private final int chunkOverlap;
    @Getter(AccessLevel.NONE)
    private final DocumentSplitter splitter;

    public DocumentChunker(int chunkSize, int chunkOverlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        if (chunkOverlap < 0 || chunkOverlap > chunkSize) {
            throw new IllegalArgumentException(
                    "chunkOverlap must be between 0 and chunkSize (" + chunkSize + "): " + chunkOverlap);
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
        this.splitter = DocumentSplitters.recursive(chunkSize, chunkOverlap);
    }

    /**
     * Chunker sized for a profile: {@code chunkTokenLimit * 4} characters with
     * {@code max(16, size / 8)} overlap.
     */
    public static DocumentChunker forProfile(ModelProfile profile) {
        int size = profile.chunkTokenLimit() * CHARS_PER_CHUNK_TOKEN;
        return new DocumentChunker(size, Math.min(size, Math.max(MIN_OVERLAP, size / 8)));
    }

    /**
     * Split text into chunks. Chunks are whitespace-stripped and never empty; text that
     * already fits is returned as a single chunk.
     */
    public List<String> split(String text) {
        String stripped = text == null ? "" : text.strip();
        if (stripped.isEmpty()) {
            return List.of();
        }
        if (stripped.length() <= chunkSize) {
            return List.of(stripped);
        }
        return splitter.split(Document.from(stripped)).stream()
                .map(TextSegment::text)
                .map(String::strip)
                .filter(chunk -> !chunk.isEmpty())
                .toList();
    }
}

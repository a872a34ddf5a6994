package com.eainde.comps.chunk;

import com.eainde.comps.model.Chunk;
import com.eainde.comps.model.SelectedSheet;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SheetChunkerTest {

    @Test
    void withDefaults_shouldUseEightyPercentOfOneMillionTokens() {
        assertThat(SheetChunker.withDefaults().budgetChars()).isEqualTo(3_200_000);
    }

    @Test
    void chunk_shouldKeepSmallSheetInOneChunk() {
        // Arrange
        SheetChunker chunker = SheetChunker.builder().budgetChars(1_000).build();
        SelectedSheet sheet = sheet(List.of("Company", "EV"), List.of("PepsiCo", "14.2"), List.of("Nestlé", "16.0"));

        // Act
        List<Chunk> chunks = chunker.chunk(sheet);

        // Assert
        assertThat(chunks).hasSize(1);
        Chunk only = chunks.get(0);
        assertThat(only.text()).isEqualTo("Company | EV\nPepsiCo | 14.2\nNestlé | 16.0\n");
        assertThat(only.startRow()).isZero();
        assertThat(only.endRow()).isEqualTo(3);
        assertThat(only.totalChunks()).isEqualTo(1);
        assertThat(only.isFirstChunk()).isTrue();
        assertThat(only.isLastChunk()).isTrue();
        assertThat(only.truncated()).isFalse();
    }

    @Test
    void chunk_shouldPartitionRowsWithinBudget_forRandomSheets() {
        Random random = new Random(42);
        for (int round = 0; round < 50; round++) {
            int budget = 50 + random.nextInt(200);
            SheetChunker chunker = SheetChunker.builder().budgetChars(budget).build();

            List<List<String>> rows = new ArrayList<>();
            int rowCount = random.nextInt(60);
            for (int r = 0; r < rowCount; r++) {
                rows.add(List.of("Company " + r, "x".repeat(random.nextInt(30))));
            }
            SelectedSheet sheet = new SelectedSheet("f", "f.xlsx", "Comps", rows);

            List<Chunk> chunks = chunker.chunk(sheet);

            int expectedStart = 0;
            StringBuilder joined = new StringBuilder();
            for (int i = 0; i < chunks.size(); i++) {
                Chunk chunk = chunks.get(i);
                assertThat(chunk.chunkIndex()).isEqualTo(i);
                assertThat(chunk.totalChunks()).isEqualTo(chunks.size());
                assertThat(chunk.startRow()).isEqualTo(expectedStart);
                assertThat(chunk.endRow()).isGreaterThan(chunk.startRow());
                assertThat(chunk.size()).isLessThanOrEqualTo(budget);
                expectedStart = chunk.endRow();
                joined.append(chunk.text());
            }
            assertThat(expectedStart).isEqualTo(rowCount);

            StringBuilder expected = new StringBuilder();
            rows.forEach(row -> expected.append(SheetChunker.serializeRow(row)));
            assertThat(joined.toString()).isEqualTo(expected.toString());
        }
    }

    @Test
    void chunk_shouldStartNewChunk_whenNextRowDoesNotFit() {
        // 10 chars per serialized row
        SheetChunker chunker = SheetChunker.builder().budgetChars(25).build();
        SelectedSheet sheet = sheet(List.of("aaaaaaaaa"), List.of("bbbbbbbbb"), List.of("ccccccccc"));

        List<Chunk> chunks = chunker.chunk(sheet);

        assertThat(chunks).extracting(Chunk::startRow).containsExactly(0, 2);
        assertThat(chunks).extracting(Chunk::endRow).containsExactly(2, 3);
        assertThat(chunks.get(0).text()).isEqualTo("aaaaaaaaa\nbbbbbbbbb\n");
    }

    @Test
    void chunk_shouldTruncateOversizedRowIntoItsOwnChunk() {
        // Arrange
        SheetChunker chunker = SheetChunker.builder().budgetChars(40).build();
        SelectedSheet sheet = sheet(
                List.of("PepsiCo"),
                List.of("Nestlé", "y".repeat(100), "z"),
                List.of("Danone"));

        // Act
        List<Chunk> chunks = chunker.chunk(sheet);

        // Assert
        assertThat(chunks).hasSize(3);
        Chunk cut = chunks.get(1);
        assertThat(cut.truncated()).isTrue();
        assertThat(cut.startRow()).isEqualTo(1);
        assertThat(cut.endRow()).isEqualTo(2);
        assertThat(cut.size()).isLessThanOrEqualTo(40);
        assertThat(cut.text()).startsWith("Nestlé | yyy").endsWith(SheetChunker.TRUNCATION_MARKER + "\n");
        assertThat(chunks.get(0).truncated()).isFalse();
        assertThat(chunks.get(2).text()).isEqualTo("Danone\n");
    }

    @Test
    void chunk_shouldReturnNothing_forEmptySheet() {
        SheetChunker chunker = SheetChunker.withDefaults();

        assertThat(chunker.chunk(new SelectedSheet("f", "f.xlsx", "Comps", List.of()))).isEmpty();
    }

    @Test
    void estimateTokens_shouldRoundUp() {
        SheetChunker chunker = SheetChunker.builder().charsPerToken(4).budgetChars(100).build();

        assertThat(chunker.estimateTokens("12345")).isEqualTo(2);
        assertThat(chunker.estimateTokens("")).isZero();
    }

    @Test
    void builder_shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> SheetChunker.builder().budgetRatio(1.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SheetChunker.builder().charsPerToken(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SheetChunker.builder().budgetChars(5).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @SafeVarargs
    private static SelectedSheet sheet(List<String>... rows) {
        return new SelectedSheet("file-1", "deal.xlsx", "Comps", List.of(rows));
    }
}

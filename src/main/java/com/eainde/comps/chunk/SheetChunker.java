package com.eainde.comps.chunk;

import com.eainde.comps.model.Chunk;
import com.eainde.comps.model.SelectedSheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a sheet's rows into size-bounded text chunks for the extraction calls.
 *
 * <h3>Packing:</h3>
 * <p>Greedy. Serialized rows are appended to a running buffer; when the next row would
 * push the buffer past the budget the chunk is closed and the row starts a new one. Rows
 * are never split between chunks, so every chunk is a contiguous {@code [startRow, endRow)}
 * range and the ranges partition the sheet.</p>
 *
 * <h3>Oversized rows:</h3>
 * <p>A row that alone exceeds the budget gets its own chunk, cut at the cell level: trailing
 * cells are dropped and the last kept cell is shortened until the row plus
 * {@value #TRUNCATION_MARKER} fits. The chunk is flagged {@link Chunk#truncated()}.</p>
 *
 * <h3>Usage:</h3>
 * <pre>
 * SheetChunker chunker = SheetChunker.builder()
 *         .contextWindowTokens(1_000_000)
 *         .charsPerToken(4)
 *         .budgetRatio(0.8)
 *         .build();
 *
 * List&lt;Chunk&gt; chunks = chunker.chunk(selectedSheet);
 * </pre>
 *
 * <p>Pure logic, no Spring dependencies.</p>
 */
public class SheetChunker {

    private static final Logger log = LoggerFactory.getLogger(SheetChunker.class);

    static final String CELL_SEPARATOR = " | ";
    static final String ROW_TERMINATOR = "\n";
    static final String TRUNCATION_MARKER = " ...[truncated]";

    private final int budgetChars;
    private final int charsPerToken;

    private SheetChunker(Builder builder) {
        this.charsPerToken = builder.charsPerToken;
        this.budgetChars = builder.budgetChars > 0
                ? builder.budgetChars
                : (int) Math.floor((double) builder.contextWindowTokens * builder.charsPerToken * builder.budgetRatio);

        if (budgetChars <= TRUNCATION_MARKER.length() + ROW_TERMINATOR.length()) {
            throw new IllegalArgumentException("chunk budget too small: " + budgetChars + " chars");
        }
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Splits the sheet into chunks covering every row exactly once.
     *
     * @param sheet the selected sheet
     * @return chunks in row order; empty when the sheet has no rows
     */
    public List<Chunk> chunk(SelectedSheet sheet) {
        List<List<String>> rows = sheet.rows();
        if (rows.isEmpty()) {
            log.info("{} has no rows, nothing to chunk", sheet);
            return List.of();
        }

        List<Chunk> chunks = new ArrayList<>();
        StringBuilder buffer = new StringBuilder();
        int chunkStart = 0;

        for (int r = 0; r < rows.size(); r++) {
            String serialized = serializeRow(rows.get(r));

            if (serialized.length() > budgetChars) {
                // flush what we have, then give the oversized row a chunk of its own
                if (buffer.length() > 0) {
                    chunks.add(newChunk(sheet, chunks.size(), chunkStart, r, buffer.toString(), false));
                    buffer.setLength(0);
                }
                String cut = truncateRow(rows.get(r));
                log.warn("Row {} of {} is {} chars, budget {}, truncated to {} chars",
                        r, sheet, serialized.length(), budgetChars, cut.length());
                chunks.add(newChunk(sheet, chunks.size(), r, r + 1, cut, true));
                chunkStart = r + 1;
                continue;
            }

            if (buffer.length() + serialized.length() > budgetChars) {
                chunks.add(newChunk(sheet, chunks.size(), chunkStart, r, buffer.toString(), false));
                buffer.setLength(0);
                chunkStart = r;
            }
            buffer.append(serialized);
        }

        if (buffer.length() > 0) {
            chunks.add(newChunk(sheet, chunks.size(), chunkStart, rows.size(), buffer.toString(), false));
        }

        // Fix totalChunks on all records
        int total = chunks.size();
        List<Chunk> result = new ArrayList<>(total);
        for (Chunk c : chunks) {
            result.add(new Chunk(c.fileId(), c.sheetName(), c.chunkIndex(), c.startRow(), c.endRow(),
                    c.text(), c.estimatedTokens(), c.truncated(), total));
        }

        log.info("{} split into {} chunks (budget {} chars)", sheet, total, budgetChars);
        for (Chunk c : result) {
            log.debug("  {}", c);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Estimates tokens from a character count using the configured ratio.
     */
    public int estimateTokens(String text) {
        if (text == null || text.isEmpty()) return 0;
        return (int) Math.ceil((double) text.length() / charsPerToken);
    }

    public int budgetChars() {
        return budgetChars;
    }

    /**
     * One row as it appears in chunk text: cells joined by {@value #CELL_SEPARATOR}, newline-terminated.
     */
    public static String serializeRow(List<String> row) {
        return String.join(CELL_SEPARATOR, row) + ROW_TERMINATOR;
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private Chunk newChunk(SelectedSheet sheet, int index, int startRow, int endRow, String text, boolean truncated) {
        return new Chunk(sheet.fileId(), sheet.sheetName(), index, startRow, endRow,
                text, estimateTokens(text), truncated, -1);
    }

    /**
     * Keeps whole cells while they fit, then as much of the next cell as fits,
     * always leaving room for the marker and the row terminator.
     */
    private String truncateRow(List<String> row) {
        int room = budgetChars - TRUNCATION_MARKER.length() - ROW_TERMINATOR.length();
        StringBuilder sb = new StringBuilder();

        for (int c = 0; c < row.size(); c++) {
            String prefix = c == 0 ? "" : CELL_SEPARATOR;
            String cell = row.get(c);
            int needed = prefix.length() + cell.length();

            if (sb.length() + needed <= room) {
                sb.append(prefix).append(cell);
                continue;
            }
            int left = room - sb.length() - prefix.length();
            if (left > 0) {
                sb.append(prefix).append(cell, 0, left);
            }
            break;
        }
        return sb.append(TRUNCATION_MARKER).append(ROW_TERMINATOR).toString();
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a chunker sized for a 1M-token context window at 4 chars/token, 80% used.
     */
    public static SheetChunker withDefaults() {
        return builder().build();
    }

    public static class Builder {
        private long contextWindowTokens = 1_000_000;
        private int charsPerToken = 4;
        private double budgetRatio = 0.8;
        private int budgetChars = -1;

        /**
         * Model input capacity in tokens. Default: 1,000,000.
         */
        public Builder contextWindowTokens(long contextWindowTokens) {
            if (contextWindowTokens < 1) throw new IllegalArgumentException("contextWindowTokens must be >= 1");
            this.contextWindowTokens = contextWindowTokens;
            return this;
        }

        /**
         * Characters counted as one token. Default: 4.
         */
        public Builder charsPerToken(int charsPerToken) {
            if (charsPerToken < 1) throw new IllegalArgumentException("charsPerToken must be >= 1");
            this.charsPerToken = charsPerToken;
            return this;
        }

        /**
         * Share of the context window a chunk may use. Default: 0.8.
         */
        public Builder budgetRatio(double budgetRatio) {
            if (budgetRatio <= 0 || budgetRatio > 1) {
                throw new IllegalArgumentException("budgetRatio must be in (0, 1]");
            }
            this.budgetRatio = budgetRatio;
            return this;
        }

        /**
         * Explicit budget in characters; overrides the window/ratio computation.
         */
        public Builder budgetChars(int budgetChars) {
            this.budgetChars = budgetChars;
            return this;
        }

        public SheetChunker build() {
            return new SheetChunker(this);
        }
    }
}

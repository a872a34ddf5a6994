package com.eainde.comps.model;

/**
 * A size-bounded slice of a sheet's rows, the unit of work sent to extraction.
 *
 * <pre>
 *   Chunk 0: rows [0..412)     size 3,199,870 chars
 *   Chunk 1: rows [412..790)   size 3,184,002 chars
 *   Chunk 2: rows [790..801)   size    92,110 chars
 * </pre>
 *
 * <p>Chunks of one sheet partition its rows: {@code chunk[i].endRow == chunk[i+1].startRow},
 * the first starts at 0 and the last ends at the row count.</p>
 *
 * @param fileId          id of the source file
 * @param sheetName       tab the rows came from
 * @param chunkIndex      zero-based index of this chunk within the sheet
 * @param startRow        zero-based inclusive first row
 * @param endRow          zero-based exclusive last row
 * @param text            serialized rows
 * @param estimatedTokens character count divided by the configured chars-per-token ratio
 * @param truncated       true when a single row exceeded the budget and was cut
 * @param totalChunks     number of chunks the sheet was split into
 */
public record Chunk(
        String fileId,
        String sheetName,
        int chunkIndex,
        int startRow,
        int endRow,
        String text,
        int estimatedTokens,
        boolean truncated,
        int totalChunks
) {

    /**
     * @return serialized size in characters
     */
    public int size() {
        return text.length();
    }

    public int rowCount() {
        return endRow - startRow;
    }

    public boolean isFirstChunk() {
        return chunkIndex == 0;
    }

    public boolean isLastChunk() {
        return chunkIndex == totalChunks - 1;
    }

    @Override
    public String toString() {
        return String.format("Chunk[%s/%s %d/%d, rows %d-%d, %d chars%s]",
                fileId, sheetName, chunkIndex + 1, totalChunks, startRow, endRow,
                text.length(), truncated ? ", TRUNCATED" : "");
    }
}

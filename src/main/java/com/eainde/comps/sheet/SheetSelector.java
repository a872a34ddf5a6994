package com.eainde.comps.sheet;

import com.eainde.comps.model.FileReference;
import com.eainde.comps.model.SelectedSheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Picks the one tab of a workbook that most likely lists comparable companies.
 *
 * <h3>Scoring:</h3>
 * <pre>
 *   name matches "(equity|trading|public) ... comps"       → 3
 *   name contains comps / competitors / comparables / peers → 2
 *   name has the word comp / peer / benchmark (or plural)   → 1
 *   header row has a company-name-like cell                 → +1
 * </pre>
 *
 * <p>The best sheet at or above {@code comps.sheets.min-score} wins; ties go to the
 * sheet that comes first in the workbook.</p>
 */
@Component
public class SheetSelector {

    private static final Logger log = LoggerFactory.getLogger(SheetSelector.class);

    private static final Pattern STRONG_NAME =
            Pattern.compile("(equity|trading|public).*comps");

    private static final List<String> SYNONYMS = List.of(
            "comps", "competitors", "comparable companies", "comparables", "peers", "peer group");

    /** Whole words only: "Company Overview" and "Compensation" are not comps tabs. */
    private static final Pattern WEAK_NAME =
            Pattern.compile("\\b(comp|peer|benchmark)s?\\b");

    private static final Pattern COMPANY_HEADER = Pattern.compile(
            "^(company|company name|companies|name|target|target name|acquirer|issuer|peer|competitor)s?$");

    /** Rows inspected when looking for the header. */
    private static final int HEADER_SCAN_ROWS = 5;

    private final SpreadsheetDecoder decoder;
    private final int minScore;

    public SheetSelector(SpreadsheetDecoder decoder,
                         @Value("${comps.sheets.min-score:1}") int minScore) {
        this.decoder = decoder;
        this.minScore = minScore;
    }

    /**
     * Decodes the file and returns its best-scoring sheet.
     *
     * @throws NoMatchingSheetException when decoding fails or no sheet reaches the minimum score
     */
    public SelectedSheet select(FileReference file) {
        Map<String, List<List<String>>> sheets;
        try {
            sheets = decoder.decode(file.displayName(), file.content());
        } catch (SpreadsheetDecodingException e) {
            throw new NoMatchingSheetException(e.getMessage(), e);
        }

        String bestName = null;
        int bestScore = Integer.MIN_VALUE;
        for (Map.Entry<String, List<List<String>>> sheet : sheets.entrySet()) {
            int score = score(sheet.getKey(), sheet.getValue());
            log.debug("{}: sheet '{}' scored {}", file.displayName(), sheet.getKey(), score);
            if (score > bestScore) {
                bestScore = score;
                bestName = sheet.getKey();
            }
        }

        if (bestName == null || bestScore < minScore) {
            throw new NoMatchingSheetException(String.format(
                    "No comps sheet found in %s (sheets: %s)", file.displayName(), sheets.keySet()));
        }

        log.info("Selected sheet '{}' of {} (score {})", bestName, file.displayName(), bestScore);
        return new SelectedSheet(file.id(), file.displayName(), bestName, sheets.get(bestName));
    }

    /**
     * Name score plus header bonus for one sheet.
     */
    int score(String sheetName, List<List<String>> rows) {
        return nameScore(sheetName) + (hasCompanyHeader(rows) ? 1 : 0);
    }

    int nameScore(String sheetName) {
        String name = normalize(sheetName);
        if (STRONG_NAME.matcher(name).find()) return 3;
        for (String synonym : SYNONYMS) {
            if (name.contains(synonym)) return 2;
        }
        return WEAK_NAME.matcher(name).find() ? 1 : 0;
    }

    boolean hasCompanyHeader(List<List<String>> rows) {
        int scanned = 0;
        for (List<String> row : rows) {
            if (scanned++ >= HEADER_SCAN_ROWS) break;
            boolean blank = row.stream().allMatch(String::isBlank);
            if (blank) continue;
            return row.stream().anyMatch(cell -> COMPANY_HEADER.matcher(normalize(cell)).matches());
        }
        return false;
    }

    /** Lower-case, separators (_ - . etc.) to single spaces. */
    private static String normalize(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}]+", " ")
                .strip();
    }
}

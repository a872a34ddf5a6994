package com.eainde.comps.resolve;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds document paths in a free-text Copilot search answer.
 *
 * <pre>
 *   "... Full Path: https://corp.sharepoint.com/sites/ib/Shared Documents/Deals/Pepsi comps.xlsx (modified ...)"
 *       fullPath     = https://corp.sharepoint.com/sites/ib/Shared Documents/Deals/Pepsi comps.xlsx
 *       relativePath = Deals/Pepsi comps.xlsx
 * </pre>
 *
 * <p>Matching is case-insensitive and stops at the first supported extension. Duplicates are
 * removed, keeping the order of first appearance.</p>
 */
@Component
public class CopilotFilePathExtractor {

    private static final Pattern FULL_PATH = Pattern.compile(
            "Full Path:\\s*(.+?\\.(?:xlsx|xls|csv|pptx|pdf))", Pattern.CASE_INSENSITIVE);

    static final String SHARED_DOCUMENTS = "Shared Documents/";

    public record ExtractedPath(String fullPath, String relativePath) {}

    public List<ExtractedPath> extract(String copilotResponse) {
        if (copilotResponse == null || copilotResponse.isBlank()) {
            return List.of();
        }

        Set<String> unique = new LinkedHashSet<>();
        Matcher matcher = FULL_PATH.matcher(copilotResponse);
        while (matcher.find()) {
            unique.add(matcher.group(1).strip());
        }

        List<ExtractedPath> paths = new ArrayList<>(unique.size());
        for (String fullPath : unique) {
            paths.add(new ExtractedPath(fullPath, relativePath(fullPath)));
        }
        return paths;
    }

    static String relativePath(String fullPath) {
        int idx = fullPath.indexOf(SHARED_DOCUMENTS);
        return idx < 0 ? fullPath : fullPath.substring(idx + SHARED_DOCUMENTS.length());
    }
}

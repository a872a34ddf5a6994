package com.eainde.comps.cache;

import com.eainde.comps.model.FileReference;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic cache key for an analysis request.
 *
 * <pre>
 *   sha256( "target:" + normalize(targetCompany) + "\n"
 *         + for each file sorted by id: "file:" + id + ":" + (contentVersion | "unresolved") + "\n" )
 * </pre>
 *
 * <p>Reordering the files or changing the target's case or spacing gives the same key;
 * changing a file's bytes gives a different one.</p>
 */
public final class RequestFingerprint {

    static final String UNRESOLVED = "unresolved";

    private RequestFingerprint() {
    }

    public static String compute(String targetCompany, List<FileReference> files) {
        StringBuilder material = new StringBuilder();
        material.append("target:").append(normalizeTarget(targetCompany)).append('\n');

        files.stream()
                .sorted(Comparator.comparing(FileReference::id))
                .forEach(file -> material.append("file:")
                        .append(file.id())
                        .append(':')
                        .append(file.isResolved() ? file.contentVersion() : UNRESOLVED)
                        .append('\n'));

        return DigestUtils.sha256Hex(material.toString());
    }

    static String normalizeTarget(String targetCompany) {
        return targetCompany.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}

package com.example.docsync.extraction;

import com.example.docsync.analysis.TextNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the pool of documentation references: documentation text plus the comments and
 * docstrings found in the code, which count as documentation for gap purposes.
 */
public final class ReferenceExtractor {

    private static final List<Pattern> BLOCK_COMMENTS = List.of(
            Pattern.compile("/\\*(.*?)\\*/", Pattern.DOTALL),
            Pattern.compile("\"\"\"(.*?)\"\"\"", Pattern.DOTALL),
            Pattern.compile("'''(.*?)'''", Pattern.DOTALL)
    );

    private static final Pattern LINE_COMMENT = Pattern.compile("(?:#|//)(.*)$", Pattern.MULTILINE);

    private final TextNormalizer normalizer;
    private final boolean wordBoundary;

    public ReferenceExtractor(TextNormalizer normalizer, boolean wordBoundary) {
        this.normalizer = normalizer;
        this.wordBoundary = wordBoundary;
    }

    /**
     * Collects block comments, docstrings and line comments of the code, in that order.
     *
     * @param codeText raw code text
     * @return comment bodies joined by spaces, empty when there are none
     */
    public String extractComments(String codeText) {
        if (codeText == null || codeText.isBlank()) return "";

        List<String> comments = new ArrayList<>();
        String remaining = codeText;
        for (Pattern block : BLOCK_COMMENTS) {
            Matcher matcher = block.matcher(remaining);
            while (matcher.find()) {
                comments.add(matcher.group(1).strip());
            }
            // blank out the blocks so line comments inside them are not collected twice
            remaining = matcher.replaceAll(" ");
        }
        Matcher line = LINE_COMMENT.matcher(remaining);
        while (line.find()) {
            comments.add(line.group(1).strip());
        }
        return String.join(" ", comments);
    }

    /**
     * @param docText        documentation text
     * @param inlineComments comments pulled from the code (see {@link #extractComments(String)})
     * @return lowercased reference pool
     */
    public ReferencePool extractReferences(String docText, String inlineComments) {
        String pool = ((docText != null ? docText : "") + " " + (inlineComments != null ? inlineComments : ""))
                .toLowerCase(Locale.ROOT);
        return new ReferencePool(pool, normalizer.normalize(pool), wordBoundary);
    }
}

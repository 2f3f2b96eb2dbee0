package com.example.docsync.analysis;

import com.example.docsync.model.GapSet;
import com.example.docsync.model.OperationalGap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Asymmetric gap detection between the code and documentation vocabularies.
 * <p>
 * Two independent checks:
 * <ul>
 *   <li>set algebra over the normalized vocabularies (common / missing in doc / missing in code)</li>
 *   <li>operational alignment: every trigger of the {@link OperationalTriggerTable} used by the code
 *       must be mentioned in the documentation, literally or through one of its synonyms</li>
 * </ul>
 */
public final class GapAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(GapAnalyzer.class);

    /** Synonyms at least this long also match inflected forms ("distances", "persisted"). */
    private static final int PREFIX_MATCH_MIN_LENGTH = 5;

    /** Lower-to-upper case boundary inside an identifier ({@code calcDist}, {@code toJSON}). */
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])");

    private final TextNormalizer normalizer;
    private final OperationalTriggerTable triggers;

    public GapAnalyzer(TextNormalizer normalizer, OperationalTriggerTable triggers) {
        this.normalizer = normalizer;
        this.triggers = triggers;
    }

    /**
     * Partitions the union of both vocabularies.
     *
     * @param codeTerms normalized code vocabulary
     * @param docTerms  normalized documentation vocabulary
     * @return disjoint common / missingInDoc / missingInCode sets
     */
    public GapSet analyzeGaps(Set<String> codeTerms, Set<String> docTerms) {
        TreeSet<String> common = new TreeSet<>(codeTerms);
        common.retainAll(docTerms);

        TreeSet<String> missingInDoc = new TreeSet<>(codeTerms);
        missingInDoc.removeAll(docTerms);

        TreeSet<String> missingInCode = new TreeSet<>(docTerms);
        missingInCode.removeAll(codeTerms);

        log.debug("GapAnalyzer: {} common, {} missing in doc, {} missing in code",
                common.size(), missingInDoc.size(), missingInCode.size());

        return new GapSet(common, missingInDoc, missingInCode);
    }

    /**
     * Flags code operations whose trigger appears in code but is never described in the documentation.
     *
     * @param codeText raw code text
     * @param docText  raw documentation text
     * @return one gap per unmet trigger, in table order
     */
    public List<OperationalGap> checkOperationalAlignment(String codeText, String docText) {
        Set<String> codeTokens = operationTokens(codeText);
        if (codeTokens.isEmpty()) return List.of();
        Set<String> docTokens = operationTokens(docText);

        List<OperationalGap> gaps = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : triggers.entries().entrySet()) {
            String trigger = entry.getKey();
            if (!codeTokens.contains(trigger)) continue;

            boolean mentioned = docTokens.contains(trigger)
                    || entry.getValue().stream().anyMatch(synonym -> mentions(docTokens, synonym));
            if (!mentioned) {
                gaps.add(new OperationalGap(trigger, entry.getValue()));
            }
        }

        if (!gaps.isEmpty()) {
            log.debug("GapAnalyzer: {} operational gap(s): {}", gaps.size(),
                    gaps.stream().map(OperationalGap::trigger).toList());
        }
        return gaps;
    }

    /**
     * Normalized tokens of the text as written plus those of its camelCase parts,
     * so {@code calcDist} yields {@code calcdist}, {@code calc} and {@code dist}.
     */
    private Set<String> operationTokens(String text) {
        Set<String> tokens = new HashSet<>(normalizer.normalize(text));
        if (text != null) {
            tokens.addAll(normalizer.normalize(CAMEL_BOUNDARY.matcher(text).replaceAll(" ")));
        }
        return tokens;
    }

    private static boolean mentions(Set<String> docTokens, String synonym) {
        if (docTokens.contains(synonym)) return true;
        if (synonym.length() < PREFIX_MATCH_MIN_LENGTH) return false;
        for (String token : docTokens) {
            if (token.startsWith(synonym)) return true;
        }
        return false;
    }
}

package com.outbreaksentinel.core.validation;

import com.outbreaksentinel.core.model.FusionResult;
import com.outbreaksentinel.core.model.MetricCell;
import com.outbreaksentinel.core.model.SourceCategory;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the initial {@link EvidenceBundle} for a screened cell.
 *
 * <p>
 * Summaries keep the five most frequent symptoms and keywords (ties broken
 * alphabetically). Correlations recorded here:
 * </p>
 * <ul>
 * <li>{@value #SYMPTOMS_MATCH}: hospital symptoms and social keywords both
 * name a disease term</li>
 * <li>{@value #ALL_SOURCES}: every source category reported</li>
 * </ul>
 */
public class EvidenceAssembler {

    public static final String SYMPTOMS_MATCH = "hospital-social symptoms match";
    public static final String ALL_SOURCES = "all three data sources available";
    public static final String ENVIRONMENT_SUPPORTS_SURGE = "high environmental risk supports hospital surge";

    static final int TOP_N = 5;

    static final Set<String> DISEASE_TERMS = Set.of(
            "fever", "cough", "dengue", "malaria", "flu", "sick", "illness", "chills", "headache");

    public EvidenceBundle assemble(MetricCell cell, FusionResult fusion) {
        EvidenceBundle.Builder b = EvidenceBundle.builder();

        boolean hospital = cell.hasSource(SourceCategory.HOSPITAL);
        boolean social = cell.hasSource(SourceCategory.SOCIAL);
        Map<String, Integer> topSymptoms = top(cell.getSymptomCounts());
        Map<String, Integer> topKeywords = top(cell.getKeywordCounts());

        if (hospital) {
            b.hospital(cell.getHospitalEvents(), cell.getSymptomCounts().size(), topSymptoms);
        }
        if (social) {
            b.social(cell.getSocialMentions(), cell.getKeywordCounts().size(), topKeywords);
        }
        if (cell.hasSource(SourceCategory.ENVIRONMENT)) {
            b.environment(cell.getEnvironment());
        }
        fusion.getNormalizedScores().forEach((id, score) -> b.modelScore(id.name(), score));

        if (hospital && social && mentionsDisease(topSymptoms) && mentionsDisease(topKeywords)) {
            b.correlation(SYMPTOMS_MATCH);
        }
        if (cell.getSources().size() == SourceCategory.values().length) {
            b.correlation(ALL_SOURCES);
        }
        return b.build();
    }

    static Map<String, Integer> top(Map<String, Integer> counts) {
        Map<String, Integer> top = new LinkedHashMap<>();
        counts.entrySet().stream()
                .filter(e -> e.getValue() != null)
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_N)
                .forEach(e -> top.put(e.getKey(), e.getValue()));
        return top;
    }

    private static boolean mentionsDisease(Map<String, Integer> terms) {
        return terms.keySet().stream().anyMatch(t -> DISEASE_TERMS.contains(t.toLowerCase(Locale.ROOT)));
    }
}

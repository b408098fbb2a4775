package io.mnemos.core.graph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Scoring helpers shared by the store implementations and the retrieval engine.
 */
public final class GraphSearch {
    public static final List<String> TEXT_PROPERTIES = List.of("name", "title", "summary", "content", "description", "text");

    private GraphSearch() {
    }

    /**
     * Cosine similarity. Zero when either vector is empty, has zero norm, or the lengths differ.
     */
    public static double cosine(double[] a, double[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    public static List<String> terms(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (!token.isBlank()) {
                out.add(token);
            }
        }
        return new ArrayList<>(out);
    }

    /**
     * Fraction of query terms that occur in the node's text properties, in [0, 1].
     */
    public static double textScore(List<String> queryTerms, Node node) {
        if (queryTerms.isEmpty()) {
            return 0.0;
        }
        Set<String> nodeTerms = new LinkedHashSet<>(terms(searchableText(node)));
        long hits = queryTerms.stream().filter(nodeTerms::contains).count();
        return (double) hits / queryTerms.size();
    }

    public static String searchableText(Node node) {
        StringBuilder text = new StringBuilder(node.name());
        for (String key : TEXT_PROPERTIES) {
            if (!"name".equals(key)) {
                node.property(key).ifPresent(value -> text.append(' ').append(value.asString()));
            }
        }
        return text.toString();
    }

    public static boolean containsIgnoreCase(String haystack, String needle) {
        if (haystack == null || needle == null) {
            return false;
        }
        return haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }

    /**
     * Weighted union of vector and text hits. A node missing from one side scores zero on that side.
     */
    public static List<ScoredNode> combine(
        List<ScoredNode> vectorHits,
        List<ScoredNode> textHits,
        int limit,
        double textWeight,
        double vectorWeight
    ) {
        Map<String, Node> nodes = new LinkedHashMap<>();
        Map<String, Double> vectorScores = new LinkedHashMap<>();
        Map<String, Double> textScores = new LinkedHashMap<>();
        for (ScoredNode hit : vectorHits) {
            nodes.putIfAbsent(hit.node().id(), hit.node());
            vectorScores.put(hit.node().id(), hit.score());
        }
        for (ScoredNode hit : textHits) {
            nodes.putIfAbsent(hit.node().id(), hit.node());
            textScores.put(hit.node().id(), hit.score());
        }

        List<ScoredNode> combined = new ArrayList<>();
        for (Map.Entry<String, Node> entry : nodes.entrySet()) {
            double score = vectorWeight * vectorScores.getOrDefault(entry.getKey(), 0.0)
                + textWeight * textScores.getOrDefault(entry.getKey(), 0.0);
            combined.add(new ScoredNode(entry.getValue(), score));
        }
        combined.sort(Comparator.comparingDouble(ScoredNode::score).reversed());
        return combined.size() > limit ? List.copyOf(combined.subList(0, limit)) : List.copyOf(combined);
    }
}

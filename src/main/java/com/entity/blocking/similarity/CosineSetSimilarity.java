package com.entity.blocking.similarity;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cosine similarity between two sets, with elements weighted by their inverse document
 * frequency across a corpus of example sets.
 *
 * <p>IDF is smoothed as {@code ln((N + 1) / (df + 1)) + 1}; elements never seen in the corpus get
 * the weight of a term with {@code df = 0}. Identical non-empty sets score 1.0, disjoint sets 0.0.
 * If either set is empty the result is {@link #UNDEFINED}.</p>
 */
public class CosineSetSimilarity implements SetComparator {

    private final Map<String, Double> idf;
    private final double unseenIdf;
    private final int corpusSize;

    public CosineSetSimilarity(Collection<? extends Collection<String>> corpus) {
        Map<String, Integer> documentFrequency = new HashMap<>();
        int n = 0;
        for (Collection<String> document : corpus) {
            n++;
            for (String element : distinct(document)) {
                documentFrequency.merge(element, 1, Integer::sum);
            }
        }
        final int size = n;
        Map<String, Double> weights = new HashMap<>();
        documentFrequency.forEach((element, df) -> weights.put(element, Math.log((size + 1.0) / (df + 1.0)) + 1.0));
        this.idf = weights;
        this.unseenIdf = Math.log(size + 1.0) + 1.0;
        this.corpusSize = size;
    }

    @Override
    public double compare(Collection<String> set1, Collection<String> set2) {
        Set<String> a = distinct(set1);
        Set<String> b = distinct(set2);
        if (a.isEmpty() || b.isEmpty()) {
            return UNDEFINED;
        }
        double dot = 0.0;
        for (String element : a) {
            if (b.contains(element)) {
                double w = weight(element);
                dot += w * w;
            }
        }
        return dot / (norm(a) * norm(b));
    }

    @Override
    public String getName() {
        return "CosineSet";
    }

    public int getCorpusSize() {
        return corpusSize;
    }

    private double weight(String element) {
        return idf.getOrDefault(element, unseenIdf);
    }

    private double norm(Set<String> set) {
        double sum = 0.0;
        for (String element : set) {
            double w = weight(element);
            sum += w * w;
        }
        return Math.sqrt(sum);
    }

    private static Set<String> distinct(Collection<String> set) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String element : set != null ? set : List.<String>of()) {
            if (element != null && !element.isEmpty()) {
                distinct.add(element);
            }
        }
        return distinct;
    }
}

package com.entity.blocking.index;

import com.entity.blocking.exception.IndexStateException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * In-memory TF-IDF index over token-list documents.
 *
 * <p>Documents are identified by their (sorted) token list; each distinct document gets a
 * stable integer id when first indexed. Search returns the ids of corpus documents whose
 * TF-IDF cosine similarity with the query is at or above a threshold.</p>
 *
 * <p>IDF is smoothed as {@code ln((N + 1) / (df + 1)) + 1}, so every term has a positive weight.</p>
 */
public class TfidfIndex implements Index {

    private final Map<List<String>, Integer> docToId = new HashMap<>();
    private final Map<Integer, List<String>> idToDoc = new LinkedHashMap<>();
    // the same document may be indexed from several raw values
    private final Map<Integer, Integer> refCounts = new HashMap<>();
    private int nextId;

    private boolean searchReady;
    private Map<String, Double> idf = Map.of();
    private Map<String, List<Posting>> postings = Map.of();
    private double unseenTermIdf;

    @Override
    public void index(Object prepared) {
        List<String> doc = asDocument(prepared);
        Integer id = docToId.get(doc);
        if (id == null) {
            id = nextId++;
            docToId.put(doc, id);
            idToDoc.put(id, doc);
        }
        refCounts.merge(id, 1, Integer::sum);
        searchReady = false;
    }

    @Override
    public void unindex(Object prepared) {
        List<String> doc = asDocument(prepared);
        Integer id = docToId.get(doc);
        if (id == null) {
            return;
        }
        int remaining = refCounts.merge(id, -1, Integer::sum);
        if (remaining <= 0) {
            refCounts.remove(id);
            docToId.remove(doc);
            idToDoc.remove(id);
        }
        searchReady = false;
    }

    @Override
    public void initSearch() {
        int n = idToDoc.size();
        Map<String, Integer> documentFrequency = new HashMap<>();
        for (List<String> doc : idToDoc.values()) {
            for (String term : termCounts(doc).keySet()) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        }

        Map<String, Double> weights = new HashMap<>();
        documentFrequency.forEach((term, df) -> weights.put(term, Math.log((n + 1.0) / (df + 1.0)) + 1.0));

        Map<String, List<Posting>> inverted = new HashMap<>();
        for (Map.Entry<Integer, List<String>> entry : idToDoc.entrySet()) {
            Map<String, Double> vector = vector(entry.getValue(), weights, 0.0);
            vector.forEach((term, weight) ->
                    inverted.computeIfAbsent(term, t -> new ArrayList<>()).add(new Posting(entry.getKey(), weight)));
        }

        this.idf = weights;
        this.postings = inverted;
        this.unseenTermIdf = Math.log(n + 1.0) + 1.0;
        this.searchReady = true;
    }

    @Override
    public boolean isSearchReady() {
        return searchReady;
    }

    @Override
    public int size() {
        return idToDoc.size();
    }

    /**
     * Returns the id of an indexed document, or empty if the document is not in the corpus.
     */
    public OptionalInt documentId(Object prepared) {
        requireReady();
        Integer id = docToId.get(asDocument(prepared));
        return id == null ? OptionalInt.empty() : OptionalInt.of(id);
    }

    /**
     * Returns ids of corpus documents with cosine similarity {@code >= threshold}, in id order.
     */
    public List<Integer> search(Object prepared, double threshold) {
        requireReady();
        Map<String, Double> query = vector(asDocument(prepared), idf, unseenTermIdf);
        if (query.isEmpty()) {
            return List.of();
        }
        Map<Integer, Double> scores = new TreeMap<>();
        query.forEach((term, weight) -> {
            for (Posting posting : postings.getOrDefault(term, List.of())) {
                scores.merge(posting.docId(), weight * posting.weight(), Double::sum);
            }
        });
        List<Integer> hits = new ArrayList<>();
        // tolerate rounding so an identical document always clears a threshold of 1.0
        scores.forEach((id, score) -> {
            if (score + 1e-9 >= threshold) {
                hits.add(id);
            }
        });
        return hits;
    }

    private void requireReady() {
        if (!searchReady) {
            throw new IndexStateException("TF-IDF index queried before initSearch()");
        }
    }

    @SuppressWarnings("unchecked")
    private static List<String> asDocument(Object prepared) {
        if (prepared instanceof List<?> list) {
            return Collections.unmodifiableList(new ArrayList<>((List<String>) list));
        }
        throw new IllegalArgumentException("TF-IDF documents must be token lists, got "
                + (prepared == null ? "null" : prepared.getClass().getName()));
    }

    private static Map<String, Integer> termCounts(List<String> doc) {
        Map<String, Integer> counts = new HashMap<>();
        for (String term : doc) {
            counts.merge(term, 1, Integer::sum);
        }
        return counts;
    }

    private static Map<String, Double> vector(List<String> doc, Map<String, Double> weights, double fallback) {
        Map<String, Double> vector = new HashMap<>();
        double norm = 0.0;
        for (Map.Entry<String, Integer> entry : termCounts(doc).entrySet()) {
            double weight = entry.getValue() * weights.getOrDefault(entry.getKey(), fallback);
            if (weight > 0.0) {
                vector.put(entry.getKey(), weight);
                norm += weight * weight;
            }
        }
        if (norm == 0.0) {
            return Map.of();
        }
        double length = Math.sqrt(norm);
        vector.replaceAll((term, weight) -> weight / length);
        return vector;
    }

    private record Posting(int docId, double weight) {}
}

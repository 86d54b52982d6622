package com.entity.blocking.field;

import com.entity.blocking.core.model.Instance;
import com.entity.blocking.core.model.InstancePair;
import com.entity.blocking.core.model.TrainingPairs;
import com.entity.blocking.exception.BlockingConfigurationException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads labeled training pairs from JSON.
 *
 * <pre>
 * {
 *   "match":    [[{"name": "Acme"}, {"name": "ACME Inc"}]],
 *   "distinct": [[{"name": "Acme"}, {"name": "Apex"}]]
 * }
 * </pre>
 *
 * <p>JSON arrays become lists, so set-valued fields arrive as {@code List<String>}.</p>
 */
public class TrainingPairsLoader {
    private static final Logger log = LoggerFactory.getLogger(TrainingPairsLoader.class);
    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public TrainingPairsLoader() {
        this(new ObjectMapper());
    }

    public TrainingPairsLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws BlockingConfigurationException if the JSON is malformed
     */
    public TrainingPairs load(Reader reader) {
        JsonNode root;
        try {
            root = mapper.readTree(reader);
        } catch (IOException e) {
            throw new BlockingConfigurationException("Unreadable training pairs: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new BlockingConfigurationException("Training pairs must be a JSON object");
        }
        TrainingPairs pairs = new TrainingPairs(
                readPairs(root.path(TrainingPairs.MATCH), TrainingPairs.MATCH),
                readPairs(root.path(TrainingPairs.DISTINCT), TrainingPairs.DISTINCT));
        log.info("training.loaded match={} distinct={}", pairs.match().size(), pairs.distinct().size());
        return pairs;
    }

    private List<InstancePair> readPairs(JsonNode node, String label) {
        List<InstancePair> pairs = new ArrayList<>();
        if (node.isMissingNode() || node.isNull()) {
            return pairs;
        }
        if (!node.isArray()) {
            throw new BlockingConfigurationException("'" + label + "' must be an array of pairs");
        }
        for (JsonNode pair : node) {
            if (!pair.isArray() || pair.size() != 2) {
                throw new BlockingConfigurationException("Each '" + label + "' entry must be a pair of records");
            }
            pairs.add(new InstancePair(toInstance(pair.get(0)), toInstance(pair.get(1))));
        }
        return pairs;
    }

    private Instance toInstance(JsonNode record) {
        if (!record.isObject()) {
            throw new BlockingConfigurationException("Training records must be JSON objects");
        }
        return Instance.of(mapper.convertValue(record, FIELDS));
    }
}

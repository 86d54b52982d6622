package com.entity.blocking.field;

import com.entity.blocking.exception.BlockingConfigurationException;
import com.entity.blocking.index.TfidfIndexType;
import com.entity.blocking.predicate.BlockingPredicate;
import com.entity.blocking.predicate.CanopyPredicate;
import com.entity.blocking.predicate.CommonSetElementPredicate;
import com.entity.blocking.predicate.CommonThreeElementsPredicate;
import com.entity.blocking.predicate.CommonTwoElementsPredicate;
import com.entity.blocking.predicate.FirstSetElementPredicate;
import com.entity.blocking.predicate.LastSetElementPredicate;
import com.entity.blocking.predicate.MagnitudeOfCardinalityPredicate;
import com.entity.blocking.predicate.SearchPredicate;
import com.entity.blocking.predicate.WholeSetPredicate;
import com.entity.blocking.similarity.CosineSetSimilarity;
import com.entity.blocking.similarity.MinDistanceSetSimilarity;
import com.entity.blocking.similarity.SetComparator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Definition of a set-valued field: its name, its type, and for cosine comparison the
 * corpus of example sets that seeds the term weights.
 */
public class FieldDefinition {

    static final double[] INDEX_THRESHOLDS = {0.2, 0.4, 0.6, 0.8};

    private final String field;
    private final SetFieldType type;
    private final List<List<String>> corpus;

    private FieldDefinition(Builder builder) {
        this.field = builder.field;
        this.type = builder.type;
        this.corpus = builder.corpus;
    }

    public String getField() {
        return field;
    }

    public SetFieldType getType() {
        return type;
    }

    /**
     * The configured corpus, or null when none was configured.
     */
    public List<List<String>> getCorpus() {
        return corpus;
    }

    /**
     * Creates the comparator for this field.
     *
     * @throws BlockingConfigurationException if a cosine comparator is requested without a corpus
     */
    public SetComparator comparator() {
        return switch (type) {
            case SET -> {
                if (corpus == null) {
                    throw new BlockingConfigurationException(
                            "Field '" + field + "' of type Set requires a corpus");
                }
                yield new CosineSetSimilarity(corpus);
            }
            case MIN_DISTANCE_SET -> new MinDistanceSetSimilarity();
        };
    }

    /**
     * Stateless blocking predicates that apply to this field.
     */
    public List<BlockingPredicate> predicates() {
        return List.of(
                new WholeSetPredicate(field),
                new CommonSetElementPredicate(field),
                new CommonTwoElementsPredicate(field),
                new CommonThreeElementsPredicate(field),
                new FirstSetElementPredicate(field),
                new LastSetElementPredicate(field),
                new MagnitudeOfCardinalityPredicate(field));
    }

    /**
     * TF-IDF search and canopy predicates over this field, one of each per threshold.
     */
    public List<BlockingPredicate> indexPredicates() {
        List<BlockingPredicate> predicates = new ArrayList<>();
        for (double threshold : INDEX_THRESHOLDS) {
            predicates.add(new SearchPredicate(TfidfIndexType.SET, field, threshold));
            predicates.add(new CanopyPredicate(TfidfIndexType.SET, field, threshold));
        }
        return predicates;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String field;
        private SetFieldType type = SetFieldType.SET;
        private List<List<String>> corpus;

        public Builder field(String field) {
            this.field = field;
            return this;
        }

        public Builder type(SetFieldType type) {
            this.type = type;
            return this;
        }

        public Builder corpus(Collection<? extends Collection<String>> corpus) {
            if (corpus == null) {
                this.corpus = null;
                return this;
            }
            List<List<String>> copy = new ArrayList<>();
            for (Collection<String> document : corpus) {
                copy.add(List.copyOf(document));
            }
            this.corpus = List.copyOf(copy);
            return this;
        }

        public FieldDefinition build() {
            if (field == null || field.isBlank()) {
                throw new BlockingConfigurationException("Field definition requires a field name");
            }
            Objects.requireNonNull(type, "type is required");
            return new FieldDefinition(this);
        }
    }

    @Override
    public String toString() {
        return "FieldDefinition{" +
                "field='" + field + '\'' +
                ", type=" + type.getLabel() +
                ", corpus=" + (corpus == null ? "none" : corpus.size() + " sets") +
                '}';
    }
}

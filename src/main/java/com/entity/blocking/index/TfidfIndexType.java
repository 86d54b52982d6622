package com.entity.blocking.index;

import java.util.List;
import java.util.function.Function;

/**
 * The kinds of TF-IDF index a predicate can ask for. Each kind fixes how raw values
 * are tokenized before they enter the corpus.
 */
public enum TfidfIndexType {
    TEXT("TfidfText", Tokenizers::words),
    SET("TfidfSet", Tokenizers::elements),
    NGRAM("TfidfNGram", Tokenizers::trigrams);

    private final String tag;
    private final Function<Object, List<String>> tokenizer;

    TfidfIndexType(String tag, Function<Object, List<String>> tokenizer) {
        this.tag = tag;
        this.tokenizer = tokenizer;
    }

    public String getTag() {
        return tag;
    }

    public List<String> tokenize(Object value) {
        return tokenizer.apply(value);
    }
}

package com.entity.blocking.index;

/**
 * A searchable corpus of preprocessed field values.
 *
 * <p>Lifecycle: any number of {@link #index}/{@link #unindex} calls, then one
 * {@link #initSearch()} to finalize. Querying is only legal while
 * {@link #isSearchReady()} is true; further mutation makes the index not ready
 * until {@code initSearch()} is called again.</p>
 */
public interface Index {

    /**
     * Adds a preprocessed value to the corpus.
     */
    void index(Object prepared);

    /**
     * Removes a preprocessed value from the corpus. Unknown values are ignored.
     */
    void unindex(Object prepared);

    /**
     * Finalizes the corpus so it can be searched.
     */
    void initSearch();

    boolean isSearchReady();

    /**
     * Number of distinct documents in the corpus.
     */
    int size();
}

package com.einvoicenews.collector.repository;

import com.einvoicenews.collector.entity.Corpus;
import com.einvoicenews.collector.exception.CorpusStoreException;

public interface CorpusRepository {

    /**
     * @return the stored corpus, or {@link Corpus#empty()} when nothing has been stored yet
     * @throws CorpusStoreException when stored data exists but cannot be read
     */
    Corpus read();

    /**
     * Replaces the stored corpus. Readers see either the old or the new content.
     *
     * @throws CorpusStoreException when the corpus cannot be written
     */
    void write(Corpus corpus);
}

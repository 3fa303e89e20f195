package com.vidnyan.dtc.application.port.out;

import com.vidnyan.dtc.domain.model.CorpusEntry;

import java.util.List;

/**
 * Port for reading the raw corpus.
 * Implemented by adapters that parse files or classpath resources.
 */
public interface CorpusSource {

    /**
     * Read every record block in corpus order.
     *
     * @throws com.vidnyan.dtc.domain.error.CorpusLoadException if the source is unreadable or malformed
     */
    List<CorpusEntry> readEntries();

    /**
     * Where the corpus comes from, for logging.
     */
    String describe();
}

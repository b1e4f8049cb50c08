package br.edu.ifba.meetingrag.storage;

import java.util.List;
import java.util.Optional;

/**
 * Key-value store of raw source text. Keys are slash-separated relative paths.
 */
public interface BlobStore {

    Optional<byte[]> get(String key);

    void put(String key, byte[] content);

    /**
     * Keys starting with {@code prefix}, sorted.
     */
    List<String> list(String prefix);
}

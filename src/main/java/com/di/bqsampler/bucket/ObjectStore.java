package com.di.bqsampler.bucket;

import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Port for the blob store holding policies and sample requests.
 *
 * <p>Listings are lazy: implementations page through the store as the stream is
 * consumed and never materialise the whole listing. Callers close the streams.
 */
public interface ObjectStore {

    /**
     * Lists object paths under {@code prefix} (all objects when null) accepted by {@code filter}.
     */
    Stream<String> listObjects(String bucket, String prefix, Predicate<String> filter);

    /**
     * Lists the immediate "directories" under {@code prefix} (the bucket root when null or
     * empty), each ending with {@code /}, e.g. {@code project/} or {@code project/dataset/}.
     */
    Stream<String> listPrefixes(String bucket, String prefix);

    /**
     * @return the object content, empty when the object does not exist
     */
    Optional<byte[]> readObject(String bucket, String path);
}

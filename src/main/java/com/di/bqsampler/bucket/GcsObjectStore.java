package com.di.bqsampler.bucket;

import com.google.api.gax.paging.Page;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.Storage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link ObjectStore} on Google Cloud Storage. Storage errors propagate as
 * {@link com.google.cloud.storage.StorageException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GcsObjectStore implements ObjectStore {

    private final Storage storage;

    @Override
    public Stream<String> listObjects(String bucket, String prefix, Predicate<String> filter) {
        List<Storage.BlobListOption> options = new ArrayList<>();
        if (prefix != null && !prefix.isEmpty()) {
            options.add(Storage.BlobListOption.prefix(prefix));
        }
        log.debug("[GCS] Listing objects in gs://{}/{}", bucket, prefix != null ? prefix : "");
        Page<Blob> page = storage.list(bucket, options.toArray(new Storage.BlobListOption[0]));
        return StreamSupport.stream(page.iterateAll().spliterator(), false)
                .map(Blob::getName)
                .filter(filter);
    }

    @Override
    public Stream<String> listPrefixes(String bucket, String prefix) {
        List<Storage.BlobListOption> options = new ArrayList<>();
        options.add(Storage.BlobListOption.currentDirectory());
        if (prefix != null && !prefix.isEmpty()) {
            options.add(Storage.BlobListOption.prefix(prefix.endsWith("/") ? prefix : prefix + "/"));
        }
        log.debug("[GCS] Listing prefixes in gs://{}/{}", bucket, prefix != null ? prefix : "");
        Page<Blob> page = storage.list(bucket, options.toArray(new Storage.BlobListOption[0]));
        return StreamSupport.stream(page.iterateAll().spliterator(), false)
                .filter(Blob::isDirectory)
                .map(Blob::getName);
    }

    @Override
    public Optional<byte[]> readObject(String bucket, String path) {
        String objectName = path.startsWith("/") ? path.substring(1) : path;
        Blob blob = storage.get(BlobId.of(bucket, objectName));
        if (blob == null || !blob.exists()) {
            log.debug("[GCS] Object gs://{}/{} does not exist", bucket, objectName);
            return Optional.empty();
        }
        byte[] content = blob.getContent();
        log.debug("[GCS] Read {} bytes from gs://{}/{}", content.length, bucket, objectName);
        return Optional.of(content);
    }
}

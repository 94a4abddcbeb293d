package com.eyelevel.archiveunzipper.service.storage;

import com.eyelevel.archiveunzipper.common.async.Futures;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.core.async.AsyncResponseTransformer;
import software.amazon.awssdk.core.async.BlockingInputStreamAsyncRequestBody;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.InputStream;
import java.util.concurrent.CompletableFuture;

/**
 * An {@link ObjectStore} backed by an S3-compatible endpoint. Containers map to buckets, object names to keys.
 * Every call goes through the async client and is awaited before returning.
 */
@Slf4j
public class S3ObjectStore implements ObjectStore {

    private static final int NOT_FOUND = 404;

    private final S3AsyncClient s3AsyncClient;
    private final String serviceUrl;

    public S3ObjectStore(final S3AsyncClient s3AsyncClient, final String serviceUrl) {
        this.s3AsyncClient = s3AsyncClient;
        this.serviceUrl = serviceUrl;
    }

    @Override
    public boolean containerExists(final String container) {
        log.debug("Checking bucket '{}' at {}", container, serviceUrl);
        try {
            Futures.await(s3AsyncClient.headBucket(HeadBucketRequest.builder().bucket(container).build()));
            return true;
        } catch (NoSuchBucketException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == NOT_FOUND) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public boolean objectExists(final String container, final String objectName) {
        try {
            headObject(container, objectName);
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == NOT_FOUND) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public long objectSize(final String container, final String objectName) {
        Long contentLength = headObject(container, objectName).contentLength();
        return contentLength == null ? -1L : contentLength;
    }

    @Override
    public byte[] download(final String container, final String objectName) {
        log.debug("Downloading object '{}' from bucket '{}'", objectName, container);
        final GetObjectRequest request = GetObjectRequest.builder().bucket(container).key(objectName).build();
        final ResponseBytes<GetObjectResponse> bytes = Futures.await(
                s3AsyncClient.getObject(request, AsyncResponseTransformer.toBytes()));
        return bytes.asByteArray();
    }

    @Override
    public void upload(final String container, final String objectName, final InputStream content,
                       final long contentLength) {
        log.debug("Uploading {} bytes to bucket '{}' key '{}'", contentLength, container, objectName);
        final PutObjectRequest request = PutObjectRequest.builder().bucket(container).key(objectName)
                                                         .contentLength(contentLength).build();

        // The body must be subscribed (putObject started) before the stream is pushed into it.
        final BlockingInputStreamAsyncRequestBody body = AsyncRequestBody.forBlockingInputStream(contentLength);
        final CompletableFuture<PutObjectResponse> response = s3AsyncClient.putObject(request, body);
        if (response.isCompletedExceptionally()) {
            // Rejected before the body was subscribed.
            Futures.await(response);
        }
        try {
            body.writeInputStream(content);
        } catch (RuntimeException e) {
            if (response.isCompletedExceptionally()) {
                awaitFailedPut(response, e);
            }
            throw e;
        }
        Futures.await(response);
    }

    private static void awaitFailedPut(final CompletableFuture<PutObjectResponse> response,
                                       final RuntimeException writeFailure) {
        try {
            Futures.await(response);
        } catch (RuntimeException putFailure) {
            putFailure.addSuppressed(writeFailure);
            throw putFailure;
        }
    }

    @Override
    public void close() {
        s3AsyncClient.close();
    }

    private HeadObjectResponse headObject(final String container, final String objectName) {
        log.debug("Checking object '{}' in bucket '{}'", objectName, container);
        return Futures.await(
                s3AsyncClient.headObject(HeadObjectRequest.builder().bucket(container).key(objectName).build()));
    }
}

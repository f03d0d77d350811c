package com.eyelevel.documentindexer.service.storage;

import com.eyelevel.documentindexer.exception.StorageAccessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.io.IOException;
import java.net.URL;
import java.time.Duration;

/**
 * {@link StorageAccessor} backed by Amazon S3. The bucket part of each URI is the S3 bucket.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class S3StorageAccessor implements StorageAccessor {

    private final S3Client s3Client;
    private final S3Presigner s3Presigner;

    @Override
    public byte[] read(String uri) {
        StorageUri location = StorageUri.parse(uri);
        GetObjectRequest request = GetObjectRequest.builder().bucket(location.bucket()).key(location.key()).build();
        try (ResponseInputStream<GetObjectResponse> object = s3Client.getObject(request)) {
            byte[] content = IOUtils.toByteArray(object);
            log.debug("Read {} bytes from s3://{}", content.length, location);
            return content;
        } catch (SdkException | IOException e) {
            log.error("Failed to read s3://{}", location, e);
            throw new StorageAccessException("Cannot read " + uri + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String write(String uri, byte[] content, String contentType) {
        StorageUri location = StorageUri.parse(uri);
        PutObjectRequest request = PutObjectRequest.builder()
                                                   .bucket(location.bucket())
                                                   .key(location.key())
                                                   .contentType(contentType)
                                                   .contentLength((long) content.length)
                                                   .build();
        try {
            s3Client.putObject(request, RequestBody.fromBytes(content));
            log.debug("Wrote {} bytes to s3://{}", content.length, location);
            return location.toString();
        } catch (SdkException e) {
            log.error("Failed to write s3://{}", location, e);
            throw new StorageAccessException("Cannot write " + uri + ": " + e.getMessage(), e);
        }
    }

    @Override
    public URL presignedReadUrl(String uri, Duration ttl) {
        StorageUri location = StorageUri.parse(uri);
        GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
                .signatureDuration(ttl)
                .getObjectRequest(r -> r.bucket(location.bucket()).key(location.key()))
                .build();
        try {
            return s3Presigner.presignGetObject(presignRequest).url();
        } catch (SdkException e) {
            throw new StorageAccessException("Cannot presign " + uri + ": " + e.getMessage(), e);
        }
    }
}

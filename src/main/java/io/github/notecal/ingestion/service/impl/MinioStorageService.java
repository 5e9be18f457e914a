package io.github.notecal.ingestion.service.impl;

import io.github.notecal.ingestion.domain.exception.StorageException;
import io.github.notecal.ingestion.service.StorageService;
import io.minio.GetObjectArgs;
import io.minio.MinioClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.InputStream;

@Slf4j
@Service
public class MinioStorageService implements StorageService {

    private final MinioClient minioClient;
    private final String bucketName;

    public MinioStorageService(MinioClient minioClient, @Value("${app.minio.bucket}") String bucketName) {
        this.minioClient = minioClient;
        this.bucketName = bucketName;
    }

    @Override
    public InputStream downloadFile(String fileKey) {
        try {
            log.info("Baixando anexo {} do bucket {}", fileKey, bucketName);

            return minioClient.getObject(
                    GetObjectArgs.builder()
                            .bucket(bucketName)
                            .object(fileKey)
                            .build()
            );
        } catch (Exception e) {
            log.error("Erro ao baixar anexo do MinIO: {}", fileKey, e);
            throw new StorageException("Falha ao baixar anexo do storage: " + fileKey, e);
        }
    }
}

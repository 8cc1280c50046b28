package com.voxpop.backend.services;

import com.voxpop.backend.config.ImportProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * Keeps uploaded spreadsheets on local disk until their import job has read them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FileStorageService {

    private final ImportProperties importProperties;

    /**
     * Store an upload under a generated name and return its absolute path.
     */
    public Path storeFile(MultipartFile file, String prefix) throws IOException {
        Path uploadPath = Paths.get(importProperties.uploadDir()).toAbsolutePath().normalize();
        if (!Files.exists(uploadPath)) {
            Files.createDirectories(uploadPath);
        }

        String originalFilename = file.getOriginalFilename();
        String extension = originalFilename != null && originalFilename.contains(".")
                ? originalFilename.substring(originalFilename.lastIndexOf(".")).toLowerCase()
                : "";
        Path filePath = uploadPath.resolve(prefix + "_" + UUID.randomUUID() + extension);

        try (InputStream in = file.getInputStream()) {
            Files.copy(in, filePath, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("Stored upload {} at {}", originalFilename, filePath);
        return filePath;
    }

    public void deleteFile(Path path) throws IOException {
        if (path == null) {
            return;
        }
        Files.deleteIfExists(path);
    }
}

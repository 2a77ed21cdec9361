package com.shopgrid.catalogservice.storage;

import com.shopgrid.catalogservice.config.ImageStorageProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.UUID;

/**
 * Keeps uploaded images on the local filesystem under {@code catalog.images.storage-dir}.
 * Keys look like {@code product_images/<uuid>.<ext>} and are served under {@code catalog.images.base-url}.
 */
@Slf4j
@Component
public class LocalImageStorage implements ImageStorage {

    static final String FOLDER = "product_images";

    private final Path root;
    private final String baseUrl;

    public LocalImageStorage(ImageStorageProperties properties) {
        this.root = Path.of(properties.storageDir()).toAbsolutePath().normalize();
        this.baseUrl = properties.baseUrl().endsWith("/") ? properties.baseUrl() : properties.baseUrl() + "/";
    }

    @Override
    public String store(MultipartFile file) {
        String key = FOLDER + "/" + UUID.randomUUID() + extensionOf(file.getOriginalFilename());
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            try (InputStream in = file.getInputStream()) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new ImageStorageException("Could not store image " + file.getOriginalFilename(), e);
        }
        log.debug("Image stored: key={}, size={}", key, file.getSize());
        return key;
    }

    @Override
    public void delete(String key) {
        try {
            if (!Files.deleteIfExists(resolve(key))) {
                log.warn("Image file already gone: key={}", key);
            }
        } catch (IOException e) {
            throw new ImageStorageException("Could not delete image " + key, e);
        }
    }

    @Override
    public String publicUrl(String key) {
        return key == null ? null : baseUrl + key;
    }

    Path resolve(String key) {
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException("Image key escapes storage root: " + key);
        }
        return path;
    }

    private static String extensionOf(String filename) {
        String extension = StringUtils.getFilenameExtension(filename);
        if (extension == null || !extension.matches("[A-Za-z0-9]{1,8}")) {
            return "";
        }
        return "." + extension.toLowerCase(Locale.ROOT);
    }
}

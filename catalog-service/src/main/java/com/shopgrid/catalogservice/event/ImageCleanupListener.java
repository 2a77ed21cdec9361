package com.shopgrid.catalogservice.event;

import com.shopgrid.catalogservice.storage.ImageStorage;
import com.shopgrid.catalogservice.storage.ImageStorageException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Removes stored image files once the transaction that deleted their rows has committed.
 */
@Component
@RequiredArgsConstructor
public class ImageCleanupListener {

    private static final Logger log = LoggerFactory.getLogger(ImageCleanupListener.class);

    private final ImageStorage imageStorage;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleImagesRemoved(ImagesRemovedEvent event) {
        for (String key : event.getImageKeys()) {
            try {
                imageStorage.delete(key);
            } catch (ImageStorageException e) {
                // rows are already gone, an orphaned file is left behind for manual cleanup
                log.error("Failed to delete image file: productId={}, key={}", event.getProductId(), key, e);
            }
        }
        log.info("Image files removed: productId={}, count={}", event.getProductId(), event.getImageKeys().size());
    }
}

package com.shopgrid.catalogservice.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.util.List;

/**
 * Event published when image rows are deleted, either one by one or together with their product.
 * Handled after commit so stored files are only removed once the rows are really gone.
 */
@Getter
public class ImagesRemovedEvent extends ApplicationEvent {
    private final Long productId;
    private final List<String> imageKeys;

    public ImagesRemovedEvent(Object source, Long productId, List<String> imageKeys) {
        super(source);
        this.productId = productId;
        this.imageKeys = List.copyOf(imageKeys);
    }
}

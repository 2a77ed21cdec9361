package com.shopgrid.catalogservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Page;

import java.util.List;

/**
 * Paginated listing envelope: {@code count} is the total number of matches,
 * {@code results} the items of the requested page.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageResponse<T> {

    private long count;
    private int page;
    private int size;
    private int totalPages;
    private List<T> results;

    public static <T> PageResponse<T> of(Page<T> page) {
        return PageResponse.<T>builder()
                .count(page.getTotalElements())
                .page(page.getNumber())
                .size(page.getSize())
                .totalPages(page.getTotalPages())
                .results(page.getContent())
                .build();
    }
}

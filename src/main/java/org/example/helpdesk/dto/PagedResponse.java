package org.example.helpdesk.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Paginated response wrapper.
 *
 * @param <T> the type of the rows
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PagedResponse<T> {

    private List<T> rows;
    private int totalPages;
    private int currentPage;
    private long total;

    /**
     * Create a PagedResponse for a 1-based page of {@code limit} rows out of {@code total}.
     */
    public static <T> PagedResponse<T> of(List<T> rows, int currentPage, int limit, long total) {
        return PagedResponse.<T>builder()
                .rows(rows)
                .currentPage(currentPage)
                .total(total)
                .totalPages((int) ((total + limit - 1) / limit))
                .build();
    }
}

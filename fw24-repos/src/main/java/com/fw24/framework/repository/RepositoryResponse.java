package com.fw24.framework.repository;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Native response of a repository call; a single record for key operations and a
 * list of records for match and query.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RepositoryResponse {
    private Object data;
    private String cursor;

    public static RepositoryResponse of(Object data) {
        return RepositoryResponse.builder().data(data).build();
    }
}

package com.geevly.projection;

import java.util.List;
import java.util.function.Function;

public record PagedResult<T>(List<T> items, long count) {

    public PagedResult {
        items = List.copyOf(items);
    }

    public <R> PagedResult<R> map(Function<T, R> mapper) {
        return new PagedResult<>(items.stream().map(mapper).toList(), count);
    }
}

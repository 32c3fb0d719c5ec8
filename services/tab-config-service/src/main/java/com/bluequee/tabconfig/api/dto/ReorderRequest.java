package com.bluequee.tabconfig.api.dto;

import com.bluequee.tabconfig.domain.OrderChange;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/** Body of {@code PATCH /api/v1/tab-configs/reorder}. */
public record ReorderRequest(@NotNull @Valid List<Item> tabs) {

    public List<OrderChange> toChanges() {
        return tabs.stream().map(item -> new OrderChange(item.id(), item.displayOrder())).toList();
    }

    public record Item(@NotNull Long id, @NotNull Integer displayOrder) {}
}

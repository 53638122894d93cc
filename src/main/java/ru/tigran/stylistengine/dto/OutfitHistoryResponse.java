package ru.tigran.stylistengine.dto;

import java.util.List;

public record OutfitHistoryResponse(
        List<SavedOutfitResponse> items,
        int page,
        int size,
        long totalElements
) {
}

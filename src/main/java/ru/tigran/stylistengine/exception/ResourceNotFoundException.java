package ru.tigran.stylistengine.exception;

/**
 * Thrown when a closet item, a style profile or a saved outfit does not exist for the requesting user.
 * An item owned by someone else is reported the same way as a missing one.
 * HTTP status: 404 Not Found
 */
public class ResourceNotFoundException extends ApplicationException {
    public ResourceNotFoundException(String message, String errorCode) {
        super(message, errorCode);
    }

    public static ResourceNotFoundException clothingItem(Long itemId) {
        return new ResourceNotFoundException("Clothing item " + itemId + " not found",
                ErrorCode.CLOTHING_ITEM_NOT_FOUND.getCode());
    }

    public static ResourceNotFoundException styleProfile(Long userId) {
        return new ResourceNotFoundException("User " + userId + " has not completed the style quiz",
                ErrorCode.STYLE_PROFILE_NOT_FOUND.getCode());
    }

    public static ResourceNotFoundException outfitRecommendation(Long recommendationId) {
        return new ResourceNotFoundException("Outfit recommendation " + recommendationId + " not found",
                ErrorCode.OUTFIT_RECOMMENDATION_NOT_FOUND.getCode());
    }
}

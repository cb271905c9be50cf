package com.kmg.merch.model;

public record ErrorRecord(
        ErrorScope scope,
        Integer itemIndex,
        String title,
        String message
) {
    public static ErrorRecord item(int itemIndex, String title, String message) {
        return new ErrorRecord(ErrorScope.ITEM, itemIndex, title, message);
    }

    public static ErrorRecord global(String message) {
        return new ErrorRecord(ErrorScope.GLOBAL, null, "Global Error", message);
    }

    public static ErrorRecord note(String title, String message) {
        return new ErrorRecord(ErrorScope.NOTE, null, title, message);
    }
}

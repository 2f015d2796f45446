package com.jimin.digest.exception;

/**
 * ItemNotFoundException - 아이템을 찾을 수 없을 때 발생
 */
public class ItemNotFoundException extends RuntimeException {

    private final String itemId;

    public ItemNotFoundException(String itemId) {
        super("아이템을 찾을 수 없습니다. ID: " + itemId);
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }
}

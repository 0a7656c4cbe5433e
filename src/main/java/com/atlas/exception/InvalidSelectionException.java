package com.atlas.exception;

/**
 * Thrown for usage errors in a request: a diff over fewer than two or more
 * than six records, an export with neither filters nor ids, a comparison
 * without any criterion.
 */
public class InvalidSelectionException extends RuntimeException {

    private final int selectionSize;

    public InvalidSelectionException(String message) {
        super(message);
        this.selectionSize = -1;
    }

    public InvalidSelectionException(String message, int selectionSize) {
        super(message);
        this.selectionSize = selectionSize;
    }

    /**
     * @return the size of the rejected selection, or -1 when not applicable
     */
    public int getSelectionSize() {
        return selectionSize;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (selectionSize >= 0) {
            sb.append(" [Selected: ").append(selectionSize).append("]");
        }
        return sb.toString();
    }
}

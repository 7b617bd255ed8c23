package com.tumorboard.batch;

/**
 * Per-item result of a batch run: the value on success, the cause on failure.
 */
public final class ItemOutcome<I, O> {

    private final int index;
    private final I input;
    private final O value;
    private final Exception error;

    private ItemOutcome(int index, I input, O value, Exception error) {
        this.index = index;
        this.input = input;
        this.value = value;
        this.error = error;
    }

    public static <I, O> ItemOutcome<I, O> success(int index, I input, O value) {
        return new ItemOutcome<>(index, input, value, null);
    }

    public static <I, O> ItemOutcome<I, O> failure(int index, I input, Exception error) {
        return new ItemOutcome<>(index, input, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** Position of the item in the batch input. */
    public int getIndex() {
        return index;
    }

    public I getInput() {
        return input;
    }

    /**
     * @throws IllegalStateException on a failed outcome
     */
    public O getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("Item " + index + " failed", error);
        }
        return value;
    }

    public Exception getError() {
        return error;
    }
}

package com.seqindex.index;

public class ClosedIndexException extends IllegalStateException {

    public ClosedIndexException(String message) {
        super(message);
    }
}

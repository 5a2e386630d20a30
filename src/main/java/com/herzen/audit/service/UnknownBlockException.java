package com.herzen.audit.service;

public class UnknownBlockException extends RuntimeException {
    private final String blockId;

    public UnknownBlockException(String blockId) {
        super("Block is not registered: " + blockId);
        this.blockId = blockId;
    }

    public String blockId() {
        return blockId;
    }
}

package com.herzen.audit.evaluation;

/**
 * Integration defect during evaluation, such as an unlinked reference. Never raised for
 * a transcript that simply does not satisfy a block.
 */
public class EvaluationException extends RuntimeException {
    private final String code;

    public EvaluationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String code() {
        return code;
    }
}

package com.herzen.audit.validation;

import java.util.List;
import java.util.stream.Collectors;

public class LinkException extends RuntimeException {
    private final List<LinkIssue> issues;

    public LinkException(List<LinkIssue> issues) {
        super(issues.stream().map(LinkIssue::message).collect(Collectors.joining("; ")));
        this.issues = List.copyOf(issues);
    }

    public List<LinkIssue> issues() {
        return issues;
    }

    public record LinkIssue(String code, String blockId, String reference, String message) {}
}

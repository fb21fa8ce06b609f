package com.kilnlang.compiler.ast;

/**
 * {@code import "uri";}
 */
public final class ImportDirective {
    private final String uri;
    private final SourceLocation location;

    public ImportDirective(String uri, SourceLocation location) {
        this.uri = uri;
        this.location = location;
    }

    public String getUri() {
        return uri;
    }

    public SourceLocation getLocation() {
        return location;
    }
}

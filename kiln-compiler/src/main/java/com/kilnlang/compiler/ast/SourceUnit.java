package com.kilnlang.compiler.ast;

import java.net.URI;
import java.util.Collections;
import java.util.List;

/**
 * 一个源文件的语法树：导入列表 + 顶层声明
 */
public final class SourceUnit {
    private final URI uri;
    private final List<ImportDirective> imports;
    private final List<ValDecl> declarations;

    public SourceUnit(URI uri, List<ImportDirective> imports, List<ValDecl> declarations) {
        this.uri = uri;
        this.imports = Collections.unmodifiableList(imports);
        this.declarations = Collections.unmodifiableList(declarations);
    }

    public URI getUri() {
        return uri;
    }

    public List<ImportDirective> getImports() {
        return imports;
    }

    public List<ValDecl> getDeclarations() {
        return declarations;
    }
}

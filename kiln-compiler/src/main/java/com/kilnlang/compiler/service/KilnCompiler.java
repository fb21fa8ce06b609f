package com.kilnlang.compiler.service;

import com.kilnlang.compiler.ast.Expression;
import com.kilnlang.compiler.ast.ImportDirective;
import com.kilnlang.compiler.ast.Literal;
import com.kilnlang.compiler.ast.NameRef;
import com.kilnlang.compiler.ast.SourceLocation;
import com.kilnlang.compiler.ast.SourceUnit;
import com.kilnlang.compiler.ast.ValDecl;
import com.kilnlang.compiler.diagnostic.Diagnostic;
import com.kilnlang.compiler.diagnostic.DiagnosticCode;
import com.kilnlang.compiler.diagnostic.DiagnosticHandler;
import com.kilnlang.compiler.fs.FileSystem;
import com.kilnlang.compiler.packages.PackageConfig;
import com.kilnlang.compiler.parser.Parser;
import com.kilnlang.ir.codec.IrFormatException;
import com.kilnlang.ir.codec.ModuleGraphCodec;
import com.kilnlang.ir.graph.Declaration;
import com.kilnlang.ir.graph.ModuleGraph;
import com.kilnlang.ir.graph.ModuleNode;
import com.kilnlang.ir.graph.Reference;
import com.kilnlang.ir.graph.ValueType;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Kiln 模块语言的编译器服务实现。
 * 管线：加载（含传递导入）→ 词法/语法分析 → 名字与类型检查 → 模块图。
 */
public class KilnCompiler implements CompilerService {
    private static final Logger LOG = Logger.getLogger(KilnCompiler.class.getName());

    // ============ 初始化 ============

    @Override
    public CompilerState initializeCompiler(CompilerState previous, URI platformSummary, URI packageMetadata,
                                            List<URI> inputSummaries, List<URI> inputLinked,
                                            FileSystem fileSystem) throws IOException {
        byte[] platformBytes = fileSystem.entityForUri(platformSummary).readAsBytes();
        byte[] packageBytes = packageMetadata != null
                ? fileSystem.entityForUri(packageMetadata).readAsBytes()
                : null;
        List<byte[]> summaryBytes = readAll(inputSummaries, fileSystem);
        List<byte[]> linkedBytes = readAll(inputLinked, fileSystem);

        MessageDigest md = sha256();
        update(md, platformSummary, platformBytes);
        update(md, packageMetadata, packageBytes);
        for (int i = 0; i < inputSummaries.size(); i++) update(md, inputSummaries.get(i), summaryBytes.get(i));
        for (int i = 0; i < inputLinked.size(); i++) update(md, inputLinked.get(i), linkedBytes.get(i));
        String digest = toHex(md.digest());

        if (previous != null && digest.equals(previous.getInputDigest())) {
            LOG.fine("输入未变化，复用已加载的摘要: " + digest);
            return previous.withFileSystem(fileSystem);
        }

        PackageConfig packages = PackageConfig.EMPTY;
        if (packageBytes != null) {
            try {
                packages = PackageConfig.parse(packageBytes, packageMetadata);
            } catch (IllegalArgumentException e) {
                throw new IOException("Invalid package metadata " + packageMetadata + ": " + e.getMessage(), e);
            }
        }

        List<ModuleNode> platformModules = decode(platformSummary, platformBytes).getModules();
        Map<URI, ModuleNode> external = new LinkedHashMap<>();
        addExternal(external, platformModules);
        for (int i = 0; i < inputSummaries.size(); i++) {
            addExternal(external, decode(inputSummaries.get(i), summaryBytes.get(i)).getModules());
        }
        for (int i = 0; i < inputLinked.size(); i++) {
            addExternal(external, decode(inputLinked.get(i), linkedBytes.get(i)).getModules());
        }
        LOG.fine("已加载 " + external.size() + " 个外部模块（平台 " + platformModules.size() + "）");
        return new CompilerState(digest, packages, new ArrayList<>(platformModules), external, fileSystem);
    }

    private static List<byte[]> readAll(List<URI> uris, FileSystem fs) throws IOException {
        List<byte[]> result = new ArrayList<>(uris.size());
        for (URI uri : uris) {
            result.add(fs.entityForUri(uri).readAsBytes());
        }
        return result;
    }

    private static ModuleGraph decode(URI uri, byte[] bytes) throws IOException {
        try {
            return ModuleGraphCodec.decode(bytes);
        } catch (IrFormatException e) {
            throw new IrFormatException("Invalid summary " + uri + ": " + e.getMessage(), e);
        }
    }

    private static void addExternal(Map<URI, ModuleNode> external, List<ModuleNode> modules) {
        for (ModuleNode module : modules) {
            // 同一模块出现在多个输入中时以先出现者为准
            if (external.putIfAbsent(module.getIdentity(), module) != null) {
                LOG.fine("忽略重复的外部模块: " + module.getIdentity());
            }
        }
    }

    // ============ 编译 ============

    @Override
    public ModuleGraph compile(CompilerState state, List<URI> sources, boolean summaryOnly,
                               DiagnosticHandler onDiagnostic) {
        Compilation compilation = new Compilation(state, onDiagnostic);
        compilation.load(sources);
        List<ModuleNode> modules = compilation.check();
        if (compilation.errorCount > 0) {
            LOG.fine("编译失败: " + compilation.errorCount + " 个错误");
            return null;
        }

        ModuleGraph graph = new ModuleGraph();
        for (ModuleNode module : modules) {
            graph.getModules().add(summaryOnly ? module.outline() : module);
        }
        // 对摘要中模块的引用预先绑定，序列化时才能解析
        for (Reference ref : compilation.externalReferences) {
            graph.getRoot().bind(ref);
        }
        return graph;
    }

    /**
     * 单次编译的可变状态
     */
    private static final class Compilation {
        private final CompilerState state;
        private final DiagnosticHandler handler;
        private final Map<URI, SourceUnit> units = new LinkedHashMap<>();
        private final Map<URI, List<URI>> resolvedImports = new HashMap<>();
        private final Set<URI> unreadable = new HashSet<>();
        private final Set<Reference> externalReferences = new LinkedHashSet<>();
        private int errorCount;

        Compilation(CompilerState state, DiagnosticHandler handler) {
            this.state = state;
            this.handler = diagnostic -> {
                if (diagnostic.isError()) {
                    errorCount++;
                }
                handler.onDiagnostic(diagnostic);
            };
        }

        /** 从源模块出发按导入关系广度优先加载，摘要中已有的模块不加载 */
        void load(List<URI> sources) {
            Deque<Pending> queue = new ArrayDeque<>();
            for (URI source : sources) {
                queue.add(new Pending(source, null));
            }
            while (!queue.isEmpty()) {
                Pending next = queue.poll();
                URI uri = next.uri;
                if (units.containsKey(uri) || unreadable.contains(uri) || state.isExternal(uri)) {
                    continue;
                }
                String text = read(uri, next.importedAt);
                if (text == null) {
                    unreadable.add(uri);
                    continue;
                }
                SourceUnit unit = new Parser(uri, text, handler).parse();
                units.put(uri, unit);

                List<URI> imports = new ArrayList<>();
                for (ImportDirective directive : unit.getImports()) {
                    try {
                        URI target = ImportUris.resolve(uri, directive.getUri());
                        imports.add(target);
                        queue.add(new Pending(target, directive.getLocation()));
                    } catch (URISyntaxException e) {
                        error("Invalid import URI '" + directive.getUri() + "'", directive.getLocation());
                    }
                }
                resolvedImports.put(uri, imports);
            }
        }

        private String read(URI uri, SourceLocation importedAt) {
            URI physical = uri;
            if ("package".equals(uri.getScheme())) {
                physical = state.getPackages().resolve(uri);
                if (physical == null) {
                    error("Couldn't resolve the package URI '" + uri + "'", importedAt);
                    return null;
                }
            }
            try {
                return state.getFileSystem().entityForUri(physical).readAsString();
            } catch (IOException | IllegalArgumentException e) {
                handler.onDiagnostic(new Diagnostic(Diagnostic.Severity.ERROR, DiagnosticCode.COMPILE_DIAGNOSTIC,
                        "Couldn't read file " + uri, importedAt,
                        Arrays.asList(String.valueOf(e.getMessage()))));
                return null;
            }
        }

        /** 检查全部已加载单元，生成模块节点 */
        List<ModuleNode> check() {
            Map<URI, Map<String, ValueType>> declaredTypes = new HashMap<>();
            for (SourceUnit unit : units.values()) {
                declaredTypes.put(unit.getUri(), collectDeclarations(unit));
            }

            List<ModuleNode> modules = new ArrayList<>();
            for (SourceUnit unit : units.values()) {
                List<Declaration> decls = new ArrayList<>();
                for (ValDecl decl : unit.getDeclarations()) {
                    Declaration checked = checkDeclaration(unit, decl, declaredTypes);
                    if (checked != null) {
                        decls.add(checked);
                    }
                }
                List<URI> deps = resolvedImports.get(unit.getUri());
                for (URI dep : deps) {
                    if (state.isExternal(dep)) {
                        externalReferences.add(Reference.module(dep));
                    }
                }
                modules.add(new ModuleNode(unit.getUri(), deps, decls));
            }
            return modules;
        }

        private Map<String, ValueType> collectDeclarations(SourceUnit unit) {
            Map<String, ValueType> types = new LinkedHashMap<>();
            for (ValDecl decl : unit.getDeclarations()) {
                ValueType type = ValueType.fromName(decl.getTypeName());
                if (types.containsKey(decl.getName())) {
                    error("'" + decl.getName() + "' is already declared in this module", decl.getLocation());
                    continue;
                }
                if (type == null) {
                    error("Type '" + decl.getTypeName() + "' not found", decl.getLocation());
                }
                types.put(decl.getName(), type);
            }
            return types;
        }

        private Declaration checkDeclaration(SourceUnit unit, ValDecl decl,
                                             Map<URI, Map<String, ValueType>> declaredTypes) {
            Map<String, ValueType> own = declaredTypes.get(unit.getUri());
            ValueType type = own.get(decl.getName());
            if (type == null) {
                return null; // 已报告未知类型
            }

            Expression init = decl.getInitializer();
            if (init instanceof Literal) {
                Literal literal = (Literal) init;
                checkAssignable(literal.getType(), type, init.getLocation());
                return new Declaration(decl.getName(), type, null, literal.getValue());
            }

            NameRef ref = (NameRef) init;
            if (ref.getName().equals(decl.getName())) {
                error("'" + decl.getName() + "' can't refer to itself", ref.getLocation());
                return null;
            }
            Reference target = lookup(unit, ref, declaredTypes);
            if (target == null) {
                return null;
            }
            ValueType targetType = typeOf(target, declaredTypes);
            if (targetType != null) {
                checkAssignable(targetType, type, ref.getLocation());
            }
            if (state.isExternal(target.getModule())) {
                externalReferences.add(target);
            }
            return new Declaration(decl.getName(), type, target, null);
        }

        /** 名字查找：本模块 → 导入模块 → 平台模块 */
        private Reference lookup(SourceUnit unit, NameRef ref, Map<URI, Map<String, ValueType>> declaredTypes) {
            String name = ref.getName();
            if (declaredTypes.get(unit.getUri()).containsKey(name)) {
                return Reference.member(unit.getUri(), name);
            }

            List<URI> providers = new ArrayList<>();
            for (URI dep : resolvedImports.get(unit.getUri())) {
                if (declares(dep, name, declaredTypes) && !providers.contains(dep)) {
                    providers.add(dep);
                }
            }
            if (providers.size() > 1) {
                error("'" + name + "' is imported from both " + providers.get(0) + " and " + providers.get(1),
                        ref.getLocation());
                return null;
            }
            if (providers.size() == 1) {
                return Reference.member(providers.get(0), name);
            }

            for (ModuleNode platform : state.getPlatformModules()) {
                if (platform.findDeclaration(name) != null) {
                    return Reference.member(platform.getIdentity(), name);
                }
            }
            error("Undefined name '" + name + "'", ref.getLocation());
            return null;
        }

        private boolean declares(URI module, String name, Map<URI, Map<String, ValueType>> declaredTypes) {
            Map<String, ValueType> compiled = declaredTypes.get(module);
            if (compiled != null) {
                return compiled.containsKey(name);
            }
            ModuleNode external = state.getExternalModule(module);
            return external != null && external.findDeclaration(name) != null;
        }

        private ValueType typeOf(Reference target, Map<URI, Map<String, ValueType>> declaredTypes) {
            Map<String, ValueType> compiled = declaredTypes.get(target.getModule());
            if (compiled != null) {
                return compiled.get(target.getMember());
            }
            return state.getExternalModule(target.getModule()).findDeclaration(target.getMember()).getType();
        }

        private void checkAssignable(ValueType actual, ValueType expected, SourceLocation location) {
            if (actual != expected) {
                error("A value of type '" + actual + "' can't be assigned to a variable of type '"
                        + expected + "'", location);
            }
        }

        private void error(String message, SourceLocation location) {
            handler.onDiagnostic(Diagnostic.error(DiagnosticCode.COMPILE_DIAGNOSTIC, message, location));
        }
    }

    private static final class Pending {
        final URI uri;
        final SourceLocation importedAt;

        Pending(URI uri, SourceLocation importedAt) {
            this.uri = uri;
            this.importedAt = importedAt;
        }
    }

    // ============ 摘要 ============

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static void update(MessageDigest md, URI uri, byte[] bytes) {
        if (uri == null) return;
        md.update(uri.toString().getBytes(StandardCharsets.UTF_8));
        md.update((byte) 0);
        md.update(bytes);
    }

    private static String toHex(byte[] hash) {
        StringBuilder sb = new StringBuilder();
        for (byte b : hash) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}

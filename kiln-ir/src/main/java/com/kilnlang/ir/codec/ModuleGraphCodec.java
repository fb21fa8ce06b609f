package com.kilnlang.ir.codec;

import com.kilnlang.ir.graph.CanonicalName;
import com.kilnlang.ir.graph.CanonicalNameRoot;
import com.kilnlang.ir.graph.Declaration;
import com.kilnlang.ir.graph.ModuleGraph;
import com.kilnlang.ir.graph.ModuleNode;
import com.kilnlang.ir.graph.Reference;
import com.kilnlang.ir.graph.ValueType;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 模块图二进制编解码器
 *
 * <p>格式：</p>
 * <pre>
 * magic "KILN" | version
 * 规范名表: count, (uri, hasMember, member?)*
 * 模块:     count, (nameIndex, deps[nameIndex], decls)*
 * </pre>
 *
 * <p>所有引用都写成规范名表中的索引。编码前为顶层模块计算规范名，
 * 任何引用若在根中没有绑定则拒绝编码。</p>
 */
public final class ModuleGraphCodec {

    public static final int MAGIC = 0x4B494C4E;
    public static final int VERSION = 1;

    private static final int CONST_NONE = 0;
    private static final int CONST_INT = 1;
    private static final int CONST_STRING = 2;
    private static final int CONST_BOOL = 3;

    private ModuleGraphCodec() {
    }

    // ============ 编码 ============

    public static byte[] encode(ModuleGraph graph) throws IOException {
        graph.computeCanonicalNames();
        CanonicalNameRoot root = graph.getRoot();

        for (ModuleNode module : graph.getModules()) {
            for (Reference ref : module.getOutgoingReferences()) {
                if (!root.isBound(ref)) {
                    throw new IrFormatException("Reference to '" + ref + "' from "
                            + module.getIdentity() + " has no canonical name");
                }
            }
        }

        Map<Reference, Integer> indices = new HashMap<>();
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeInt(MAGIC);
        out.writeInt(VERSION);

        out.writeInt(root.size());
        for (CanonicalName name : root.getNames()) {
            Reference ref = name.getReference();
            indices.put(ref, indices.size());
            out.writeUTF(ref.getModule().toString());
            out.writeBoolean(!ref.isModule());
            if (!ref.isModule()) {
                out.writeUTF(ref.getMember());
            }
        }

        out.writeInt(graph.getModules().size());
        for (ModuleNode module : graph.getModules()) {
            out.writeInt(indices.get(module.getReference()));
            out.writeInt(module.getDependencies().size());
            for (URI dep : module.getDependencies()) {
                out.writeInt(indices.get(Reference.module(dep)));
            }
            out.writeInt(module.getDeclarations().size());
            for (Declaration decl : module.getDeclarations()) {
                writeDeclaration(out, decl, indices);
            }
        }
        out.flush();
        return bytes.toByteArray();
    }

    private static void writeDeclaration(DataOutputStream out, Declaration decl,
                                         Map<Reference, Integer> indices) throws IOException {
        out.writeUTF(decl.getName());
        out.writeByte(decl.getType().ordinal());
        out.writeBoolean(decl.getTarget() != null);
        if (decl.getTarget() != null) {
            out.writeInt(indices.get(decl.getTarget()));
        }
        Object constant = decl.getConstant();
        if (constant == null) {
            out.writeByte(CONST_NONE);
        } else if (constant instanceof Integer) {
            out.writeByte(CONST_INT);
            out.writeInt((Integer) constant);
        } else if (constant instanceof String) {
            out.writeByte(CONST_STRING);
            out.writeUTF((String) constant);
        } else if (constant instanceof Boolean) {
            out.writeByte(CONST_BOOL);
            out.writeBoolean((Boolean) constant);
        } else {
            throw new IrFormatException("Unsupported constant in " + decl.getName()
                    + ": " + constant.getClass().getName());
        }
    }

    // ============ 解码 ============

    /**
     * 解码产物。规范名表中所有名字（包括不属于本产物的）都会重新绑定到新图的根上。
     */
    public static ModuleGraph decode(byte[] data) throws IrFormatException {
        DataInputStream in = new DataInputStream(new ByteArrayInputStream(data));
        try {
            if (in.readInt() != MAGIC) {
                throw new IrFormatException("Not a Kiln IR file (bad magic)");
            }
            int version = in.readInt();
            if (version != VERSION) {
                throw new IrFormatException("Unsupported IR version " + version + ", expected " + VERSION);
            }

            CanonicalNameRoot root = new CanonicalNameRoot();
            int nameCount = readCount(in, "name");
            List<Reference> names = new ArrayList<>();
            for (int i = 0; i < nameCount; i++) {
                URI module = parseUri(in.readUTF());
                Reference ref = in.readBoolean()
                        ? Reference.member(module, in.readUTF())
                        : Reference.module(module);
                names.add(ref);
                root.bind(ref);
            }

            int moduleCount = readCount(in, "module");
            List<ModuleNode> modules = new ArrayList<>();
            for (int i = 0; i < moduleCount; i++) {
                Reference self = nameAt(names, in.readInt());
                int depCount = readCount(in, "dependency");
                List<URI> deps = new ArrayList<>();
                for (int d = 0; d < depCount; d++) {
                    deps.add(nameAt(names, in.readInt()).getModule());
                }
                int declCount = readCount(in, "declaration");
                List<Declaration> decls = new ArrayList<>();
                for (int d = 0; d < declCount; d++) {
                    decls.add(readDeclaration(in, names));
                }
                modules.add(new ModuleNode(self.getModule(), deps, decls));
            }
            return new ModuleGraph(modules, root);
        } catch (EOFException e) {
            throw new IrFormatException("Truncated IR file", e);
        } catch (IrFormatException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new IrFormatException("Malformed IR file: " + e.getMessage(), e);
        }
    }

    /**
     * 读取元素个数。每个元素至少占一个字节，超过剩余字节数的个数必然是损坏的文件。
     */
    private static int readCount(DataInputStream in, String what) throws IOException {
        int count = in.readInt();
        if (count < 0 || count > in.available()) {
            throw new IrFormatException("Invalid " + what + " count " + count);
        }
        return count;
    }

    private static Declaration readDeclaration(DataInputStream in, List<Reference> names) throws IOException {
        String name = in.readUTF();
        int typeIndex = in.readByte();
        if (typeIndex < 0 || typeIndex >= ValueType.values().length) {
            throw new IrFormatException("Unknown value type tag " + typeIndex);
        }
        Reference target = in.readBoolean() ? nameAt(names, in.readInt()) : null;
        Object constant;
        int tag = in.readByte();
        switch (tag) {
            case CONST_NONE:   constant = null; break;
            case CONST_INT:    constant = in.readInt(); break;
            case CONST_STRING: constant = in.readUTF(); break;
            case CONST_BOOL:   constant = in.readBoolean(); break;
            default:
                throw new IrFormatException("Unknown constant tag " + tag);
        }
        return new Declaration(name, ValueType.values()[typeIndex], target, constant);
    }

    private static Reference nameAt(List<Reference> names, int index) throws IrFormatException {
        if (index < 0 || index >= names.size()) {
            throw new IrFormatException("Canonical name index out of range: " + index);
        }
        return names.get(index);
    }

    private static URI parseUri(String text) throws IrFormatException {
        try {
            return new URI(text);
        } catch (URISyntaxException e) {
            throw new IrFormatException("Invalid module URI: " + text, e);
        }
    }
}

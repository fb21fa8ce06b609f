package com.kilnlang.ir.codec;

import com.kilnlang.ir.graph.CanonicalNameRoot;
import com.kilnlang.ir.graph.Declaration;
import com.kilnlang.ir.graph.ModuleGraph;
import com.kilnlang.ir.graph.ModuleNode;
import com.kilnlang.ir.graph.Reference;
import com.kilnlang.ir.graph.ValueType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.net.URI;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ModuleGraphCodec 测试")
class ModuleGraphCodecTest {

    private static final URI MAIN = URI.create("org-kiln-multi-root:///app/main.kn");
    private static final URI UTIL = URI.create("org-kiln-multi-root:///app/util.kn");
    private static final URI CORE = URI.create("kiln:core");

    private ModuleGraph sampleGraph() {
        ModuleNode main = new ModuleNode(MAIN, Collections.singletonList(UTIL), Arrays.asList(
                new Declaration("greeting", ValueType.STRING, null, "hi"),
                new Declaration("count", ValueType.INT, null, 42),
                new Declaration("enabled", ValueType.BOOL, null, Boolean.TRUE),
                new Declaration("alias", ValueType.STRING, Reference.member(UTIL, "name"), null)));
        ModuleNode util = new ModuleNode(UTIL, Collections.emptyList(), Collections.singletonList(
                new Declaration("name", ValueType.STRING, null, "kiln")));
        return new ModuleGraph(Arrays.asList(main, util), new CanonicalNameRoot());
    }

    @Nested
    @DisplayName("encode / decode")
    class EncodeDecode {

        @Test
        @DisplayName("保留模块顺序、依赖、声明和常量")
        void testPreservesStructure() throws Exception {
            ModuleGraph decoded = ModuleGraphCodec.decode(ModuleGraphCodec.encode(sampleGraph()));

            assertThat(decoded.getModuleIdentities()).containsExactly(MAIN, UTIL);
            ModuleNode main = decoded.findModule(MAIN);
            assertThat(main.getDependencies()).containsExactly(UTIL);
            assertThat(main.getDeclarations()).extracting(Declaration::getName)
                    .containsExactly("greeting", "count", "enabled", "alias");
            assertThat(main.findDeclaration("count").getConstant()).isEqualTo(42);
            assertThat(main.findDeclaration("enabled").getConstant()).isEqualTo(Boolean.TRUE);
            assertThat(main.findDeclaration("alias").getTarget()).isEqualTo(Reference.member(UTIL, "name"));
            assertThat(main.findDeclaration("alias").getConstant()).isNull();
        }

        @Test
        @DisplayName("外部模块的规范名只按身份保留，不产生模块体")
        void testExternalNamesSurvive() throws Exception {
            ModuleGraph graph = new ModuleGraph();
            graph.getModules().add(new ModuleNode(MAIN, Collections.singletonList(CORE),
                    Collections.singletonList(new Declaration("v", ValueType.STRING,
                            Reference.member(CORE, "version"), null))));
            graph.getRoot().bind(Reference.member(CORE, "version"));

            ModuleGraph decoded = ModuleGraphCodec.decode(ModuleGraphCodec.encode(graph));

            assertThat(decoded.getModuleIdentities()).containsExactly(MAIN);
            assertThat(decoded.getRoot().isBound(Reference.member(CORE, "version"))).isTrue();
            assertThat(decoded.getRoot().isBound(Reference.module(CORE))).isTrue();
        }

        @Test
        @DisplayName("空图可以编码")
        void testEmptyGraph() throws Exception {
            ModuleGraph decoded = ModuleGraphCodec.decode(ModuleGraphCodec.encode(new ModuleGraph()));
            assertThat(decoded.getModules()).isEmpty();
            assertThat(decoded.getRoot().size()).isZero();
        }
    }

    @Nested
    @DisplayName("错误处理")
    class Errors {

        @Test
        @DisplayName("引用未绑定时拒绝编码")
        void testUnboundReferenceRejected() {
            ModuleGraph graph = sampleGraph();
            graph.getModules().remove(1); // 去掉 util 且不绑定其规范名

            assertThatThrownBy(() -> ModuleGraphCodec.encode(graph))
                    .isInstanceOf(IrFormatException.class)
                    .hasMessageContaining("util.kn")
                    .hasMessageContaining("no canonical name");
        }

        @Test
        @DisplayName("魔数错误")
        void testBadMagic() {
            assertThatThrownBy(() -> ModuleGraphCodec.decode(new byte[]{1, 2, 3, 4, 0, 0, 0, 1}))
                    .isInstanceOf(IrFormatException.class)
                    .hasMessageContaining("bad magic");
        }

        @Test
        @DisplayName("截断的文件")
        void testTruncated() throws Exception {
            byte[] full = ModuleGraphCodec.encode(sampleGraph());
            byte[] truncated = Arrays.copyOf(full, full.length / 2);

            assertThatThrownBy(() -> ModuleGraphCodec.decode(truncated))
                    .isInstanceOf(IrFormatException.class);
        }

        @Test
        @DisplayName("元素个数超出文件长度或为负时报告格式错误")
        void testCorruptCounts() {
            assertThatThrownBy(() -> ModuleGraphCodec.decode(header(Integer.MAX_VALUE)))
                    .isInstanceOf(IrFormatException.class)
                    .hasMessageContaining("Invalid name count");
            assertThatThrownBy(() -> ModuleGraphCodec.decode(header(-5)))
                    .isInstanceOf(IrFormatException.class)
                    .hasMessageContaining("Invalid name count -5");
        }

        @Test
        @DisplayName("声明中的非法字段不会以非受检异常抛出")
        void testInvalidFieldsWrapped() throws Exception {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            DataOutputStream out = new DataOutputStream(bytes);
            out.write(header(1));
            out.writeUTF("file:///a.kn");
            out.writeBoolean(false);
            out.writeInt(1);          // 模块数
            out.writeInt(0);          // 自身
            out.writeInt(0);          // 依赖数
            out.writeInt(1);          // 声明数
            out.writeUTF("x");
            out.writeByte(0);
            out.writeBoolean(false);
            out.writeByte(9);         // 未知常量标签
            out.flush();

            assertThatThrownBy(() -> ModuleGraphCodec.decode(bytes.toByteArray()))
                    .isInstanceOf(IrFormatException.class)
                    .hasMessageContaining("Unknown constant tag 9");
        }

        /** 魔数 + 版本 + 名字个数 */
        private byte[] header(int nameCount) {
            return ByteBuffer.allocate(12).putInt(ModuleGraphCodec.MAGIC).putInt(ModuleGraphCodec.VERSION).putInt(nameCount).array();
        }
    }
}

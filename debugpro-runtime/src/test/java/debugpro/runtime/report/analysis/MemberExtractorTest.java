package debugpro.runtime.report.analysis;

import debugpro.runtime.ErrorCategory;
import debugpro.runtime.detail.MemberDetail;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * 成员不存在的详情提取
 */
class MemberExtractorTest {

    @Test
    @DisplayName("HashMap 缺少方法：列出公开成员，无相似成员")
    void testHashMapMissingMethod() {
        Map<String, Integer> myDict = new HashMap<>();
        myDict.put("a", 1);
        Map<String, Object> bindings = new LinkedHashMap<>();
        bindings.put("my_dict", myDict);

        AnalysisResult result = DetailExtractorsTest.analyze(ErrorCategory.MEMBER_NOT_FOUND,
                "java.util.HashMap.grab_item(java.lang.Object)", bindings,
                "my_dict.getClass().getMethod(\"grab_item\", Object.class);");

        MemberDetail detail = (MemberDetail) result.getDetail();
        assertThat(detail.getLabel()).isEqualTo("MemberNotFound");
        assertThat(detail.getObjectName()).isEqualTo("my_dict");
        assertThat(detail.getObjectValue()).isEqualTo("{a=1}");
        assertThat(detail.getTypeName()).isEqualTo("HashMap");
        assertThat(detail.getMissingMember()).isEqualTo("grab_item");
        assertThat(detail.getMembers()).contains("get", "put", "containsKey").isSorted();
        assertThat(detail.getMembers()).doesNotContain("toString", "hashCode", "getClass", "wait");
        assertThat(detail.getSimilarMembers()).isEmpty();
    }

    @Test
    @DisplayName("相似成员")
    void testSimilarMembers() {
        Map<String, Object> bindings = new LinkedHashMap<>();
        bindings.put("text", new StringBuilder("abc"));

        AnalysisResult result = DetailExtractorsTest.analyze(ErrorCategory.MEMBER_NOT_FOUND,
                "java.lang.StringBuilder.append_all()", bindings, "text.getClass().getMethod(\"append_all\");");

        assertThat(((MemberDetail) result.getDetail()).getSimilarMembers()).containsExactly("append");
    }

    @Test
    @DisplayName("成员列表最多 100 个，其余计数")
    void testMemberCap() throws Exception {
        Object wide = newWideObject(150);
        Map<String, Object> bindings = new LinkedHashMap<>();
        bindings.put("wide", wide);

        AnalysisResult result = DetailExtractorsTest.analyze(ErrorCategory.MEMBER_NOT_FOUND,
                "debugpro.gen.Wide.m150()", bindings, "wide.getClass().getMethod(\"m150\");");

        MemberDetail detail = (MemberDetail) result.getDetail();
        assertThat(detail.getMembers()).hasSize(MemberDetail.MAX_MEMBERS);
        assertThat(detail.getMembers().get(0)).isEqualTo("m000");
        assertThat(detail.getMembers().get(99)).isEqualTo("m099");
        assertThat(detail.getMemberCount()).isEqualTo(150);
        assertThat(detail.getHiddenMemberCount()).isEqualTo(50);
        assertThat(detail.getSimilarMembers()).isEmpty();
    }

    @Test
    @DisplayName("保留名与合成名被略去")
    void testListMembersFilters() {
        List<String> members = MemberExtractor.listMembers(new Sample());
        assertThat(members).containsExactly("count", "total");
    }

    @Test
    @DisplayName("消息无法解析时只有备注")
    void testUnparseableMessage() {
        Map<String, Object> bindings = new LinkedHashMap<>();
        bindings.put("target", "x");

        AnalysisResult result = DetailExtractorsTest.analyze(ErrorCategory.MEMBER_NOT_FOUND,
                "member lookup failed", bindings, "target.frob();");

        assertThat(result.hasDetail()).isFalse();
        assertThat(result.getNotes()).containsExactly("Could not parse the missing member from: member lookup failed");
    }

    public static class Sample {
        public int count;

        public int total() {
            return count;
        }

        public void __internal() {
        }
    }

    /**
     * 生成一个有 {@code methods} 个公开无参方法（m000, m001, ...）的类并实例化。
     */
    private static Object newWideObject(int methods) throws Exception {
        ClassWriter cw = new ClassWriter(ClassWriter.COMPUTE_MAXS);
        cw.visit(Opcodes.V1_8, Opcodes.ACC_PUBLIC | Opcodes.ACC_SUPER, "debugpro/gen/Wide", null,
                "java/lang/Object", null);

        MethodVisitor init = cw.visitMethod(Opcodes.ACC_PUBLIC, "<init>", "()V", null, null);
        init.visitCode();
        init.visitVarInsn(Opcodes.ALOAD, 0);
        init.visitMethodInsn(Opcodes.INVOKESPECIAL, "java/lang/Object", "<init>", "()V", false);
        init.visitInsn(Opcodes.RETURN);
        init.visitMaxs(0, 0);
        init.visitEnd();

        for (int i = 0; i < methods; i++) {
            MethodVisitor mv = cw.visitMethod(Opcodes.ACC_PUBLIC, String.format("m%03d", i), "()V", null, null);
            mv.visitCode();
            mv.visitInsn(Opcodes.RETURN);
            mv.visitMaxs(0, 0);
            mv.visitEnd();
        }
        cw.visitEnd();

        byte[] bytes = cw.toByteArray();
        Class<?> type = new ClassLoader(MemberExtractorTest.class.getClassLoader()) {
            Class<?> define() {
                return defineClass("debugpro.gen.Wide", bytes, 0, bytes.length);
            }
        }.define();
        return type.getConstructor().newInstance();
    }
}

package com.protolang.compiler.symbol;

import com.protolang.compiler.types.PrimitiveType;
import com.protolang.compiler.types.ProtoType;
import com.protolang.compiler.types.TypeSystem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 符号表中的一个存储槽：变量、参数、类成员或临时变量。
 *
 * <p>{@code storageIndex} 是符号在所属表中的位置，追加时分配；
 * {@code memoryOffset} 是值所在的内存位置：全局变量和静态成员为全局栈下标，
 * 局部变量和参数相对帧指针，实例成员为对象槽位。</p>
 */
public final class SymbolNode {

    private final String name;
    private int storageIndex = Constants.INVALID_INDEX;
    private final int memoryOffset;
    private final int classScope;
    private final int functionScope;
    private final int codeBlockId;
    private final boolean isStatic;
    private final boolean isArgument;
    private final boolean isTemporary;
    private final int size;
    private final AccessModifier access;
    private final List<Integer> arraySizes;   // 仅定长数组声明非 null（调试器不支持）
    private final String forArrayName;

    private ProtoType declaredType;
    private ProtoType staticType;

    private SymbolNode(Builder b) {
        this.name = b.name;
        this.memoryOffset = b.memoryOffset;
        this.classScope = b.classScope;
        this.functionScope = b.functionScope;
        this.codeBlockId = b.codeBlockId;
        this.isStatic = b.isStatic;
        this.isArgument = b.isArgument;
        this.isTemporary = b.name.startsWith(Constants.TEMP_PREFIX);
        this.size = b.size;
        this.access = b.access;
        this.arraySizes = b.arraySizes != null ? Collections.unmodifiableList(new ArrayList<>(b.arraySizes)) : null;
        this.forArrayName = b.forArrayName;
        this.declaredType = b.declaredType;
        this.staticType = b.staticType != null ? b.staticType : b.declaredType;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** 空白占位节点，用于 undefine 后保持下标 */
    public static SymbolNode blank() {
        return new Builder("").classScope(Constants.INVALID_INDEX).size(0).build();
    }

    public String getName() { return name; }
    public int getStorageIndex() { return storageIndex; }
    public int getMemoryOffset() { return memoryOffset; }
    public int getClassScope() { return classScope; }
    public int getFunctionScope() { return functionScope; }
    public int getCodeBlockId() { return codeBlockId; }
    public boolean isStatic() { return isStatic; }
    public boolean isArgument() { return isArgument; }
    public boolean isTemporary() { return isTemporary; }
    public int getSize() { return size; }
    public AccessModifier getAccess() { return access; }
    public List<Integer> getArraySizes() { return arraySizes; }
    public String getForArrayName() { return forArrayName; }
    public ProtoType getDeclaredType() { return declaredType; }
    public ProtoType getStaticType() { return staticType; }

    public boolean isBlank() {
        return name.isEmpty();
    }

    /** 定长数组声明（调试器不支持） */
    public boolean isFixedSizeArray() {
        return arraySizes != null;
    }

    /** 全局作用域中的符号（不在任何函数内） */
    public boolean isGlobalFunctionScope() {
        return functionScope == Constants.GLOBAL_SCOPE;
    }

    /** 由 SymbolTable 在追加/重编号时设置 */
    void setStorageIndex(int storageIndex) {
        this.storageIndex = storageIndex;
    }

    /**
     * 静态类型收窄。新类型为标量 var 时只记录，不覆盖声明类型。
     */
    public void setStaticType(ProtoType newType) {
        if (Objects.equals(staticType, newType)) {
            return;
        }
        staticType = newType;
        if (newType.getUid() != PrimitiveType.VAR.getUid() || newType.getRank() != 0) {
            declaredType = newType;
        }
    }

    /** 名称 + 函数 + 类 + 代码块相同即视为同一符号 */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymbolNode)) return false;
        SymbolNode other = (SymbolNode) o;
        return name.equals(other.name)
                && functionScope == other.functionScope
                && classScope == other.classScope
                && codeBlockId == other.codeBlockId;
    }

    @Override
    public int hashCode() {
        int result = name.hashCode();
        result = 31 * result + functionScope;
        result = 31 * result + classScope;
        result = 31 * result + codeBlockId;
        return result;
    }

    @Override
    public String toString() {
        return name + ", fi = " + functionScope + ", ci = " + classScope + ", block = " + codeBlockId;
    }

    /**
     * SymbolNode 构建器。默认：全局作用域、无类、单槽、公有、var 类型。
     */
    public static final class Builder {
        private final String name;
        private int memoryOffset;
        private int classScope = Constants.INVALID_INDEX;
        private int functionScope = Constants.GLOBAL_SCOPE;
        private int codeBlockId = Constants.INVALID_INDEX;
        private boolean isStatic;
        private boolean isArgument;
        private int size = 1;
        private AccessModifier access = AccessModifier.PUBLIC;
        private List<Integer> arraySizes;
        private String forArrayName;
        private ProtoType declaredType = TypeSystem.buildPrimitiveTypeObject(PrimitiveType.VAR, 0);
        private ProtoType staticType;

        private Builder(String name) {
            if (name == null) {
                throw new IllegalArgumentException("Symbol name must not be null");
            }
            this.name = name;
        }

        public Builder memoryOffset(int memoryOffset) { this.memoryOffset = memoryOffset; return this; }
        public Builder classScope(int classScope) { this.classScope = classScope; return this; }
        public Builder functionScope(int functionScope) { this.functionScope = functionScope; return this; }
        public Builder codeBlockId(int codeBlockId) { this.codeBlockId = codeBlockId; return this; }
        public Builder isStatic(boolean isStatic) { this.isStatic = isStatic; return this; }
        public Builder isArgument(boolean isArgument) { this.isArgument = isArgument; return this; }
        public Builder size(int size) { this.size = size; return this; }
        public Builder access(AccessModifier access) { this.access = access; return this; }
        public Builder arraySizes(List<Integer> arraySizes) { this.arraySizes = arraySizes; return this; }
        public Builder forArrayName(String forArrayName) { this.forArrayName = forArrayName; return this; }
        public Builder declaredType(ProtoType declaredType) { this.declaredType = declaredType; return this; }
        public Builder staticType(ProtoType staticType) { this.staticType = staticType; return this; }

        public SymbolNode build() {
            return new SymbolNode(this);
        }
    }
}

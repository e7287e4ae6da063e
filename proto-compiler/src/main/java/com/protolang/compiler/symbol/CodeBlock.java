package com.protolang.compiler.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 编译后的一段词法区域：顶层程序、内嵌语言块、构造块（if/while）或函数体。
 *
 * <p>父子关系在编译期确定，调试器据此重建词法作用域链。</p>
 */
public final class CodeBlock {

    public enum CodeBlockType {
        LANGUAGE,    // [Associative] / [Imperative] 语言块
        CONSTRUCT,   // if/else/while 等构造块
        FUNCTION     // 函数体
    }

    public enum Language {
        ASSOCIATIVE,
        IMPERATIVE
    }

    private final int codeBlockId;
    private final CodeBlockType blockType;
    private final Language language;
    private final CodeBlock parent;
    private final List<CodeBlock> children = new ArrayList<>();
    private int entryPoint;

    public CodeBlock(int codeBlockId, CodeBlockType blockType, Language language, CodeBlock parent) {
        this.codeBlockId = codeBlockId;
        this.blockType = blockType;
        this.language = language;
        this.parent = parent;
        if (parent != null) {
            parent.children.add(this);
        }
    }

    public int getCodeBlockId() { return codeBlockId; }
    public CodeBlockType getBlockType() { return blockType; }
    public Language getLanguage() { return language; }
    public CodeBlock getParent() { return parent; }
    public List<CodeBlock> getChildren() { return Collections.unmodifiableList(children); }

    /** 块内第一个可执行图节点的下标 */
    public int getEntryPoint() { return entryPoint; }
    public void setEntryPoint(int entryPoint) { this.entryPoint = entryPoint; }

    /** 给定块是否为本块的（严格）祖先 */
    public boolean isMyAncestorBlock(int blockId) {
        CodeBlock cursor = parent;
        while (cursor != null) {
            if (cursor.codeBlockId == blockId) {
                return true;
            }
            cursor = cursor.parent;
        }
        return false;
    }

    /** 到顶层块的距离，顶层为 0 */
    public int getDepth() {
        int depth = 0;
        CodeBlock cursor = parent;
        while (cursor != null) {
            depth++;
            cursor = cursor.parent;
        }
        return depth;
    }

    @Override
    public String toString() {
        return "CodeBlock#" + codeBlockId + "(" + blockType + ", " + language + ")";
    }
}

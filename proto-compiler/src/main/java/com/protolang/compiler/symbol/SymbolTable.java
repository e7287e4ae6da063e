package com.protolang.compiler.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 符号表：一个作用域（全局块、一个函数、或一个类的成员）的有序符号集合。
 *
 * <p>主索引按声明顺序保存符号，下标即 {@code storageIndex}；
 * 名称索引用于按 (名称, 类, 函数) 的快速消歧查找。所有查找失败时返回
 * {@link Constants#INVALID_INDEX}，不抛异常。</p>
 *
 * <p>交互式重定义只能用 {@link #undefineSymbol}：它保留所有下标。
 * {@link #remove} 会让后续符号的下标前移，只能在编译期建表时使用。</p>
 */
public final class SymbolTable {

    private static final Logger LOG = Logger.getLogger(SymbolTable.class.getName());

    private final List<SymbolNode> symbols = new ArrayList<>();
    private final Map<String, List<SymbolNode>> nameIndex = new HashMap<>();
    private int globalSize;

    private String scopeName;
    private int runtimeIndex;

    public SymbolTable(String scopeName, int runtimeIndex) {
        this.scopeName = scopeName;
        this.runtimeIndex = runtimeIndex;
    }

    public String getScopeName() { return scopeName; }
    public void setScopeName(String scopeName) { this.scopeName = scopeName; }
    public int getRuntimeIndex() { return runtimeIndex; }
    public void setRuntimeIndex(int runtimeIndex) { this.runtimeIndex = runtimeIndex; }

    /** 全局作用域（非函数局部）符号的总大小，决定全局栈帧的分配 */
    public int getGlobalSize() {
        return globalSize;
    }

    public int size() {
        return symbols.size();
    }

    public SymbolNode get(int index) {
        return symbols.get(index);
    }

    /** 按声明顺序的只读视图 */
    public List<SymbolNode> getSymbols() {
        return Collections.unmodifiableList(symbols);
    }

    // ========== 追加 / 删除 ==========

    /**
     * 追加符号并分配 storageIndex。
     *
     * @return 新下标；已存在相同符号（名称 + 函数 + 类 + 代码块）时返回 INVALID_INDEX
     */
    public int append(SymbolNode node) {
        if (node == null) {
            throw new IllegalArgumentException("Cannot append a null symbol");
        }
        List<SymbolNode> sameName = nameIndex.get(node.getName());
        if (sameName != null && sameName.contains(node)) {
            return Constants.INVALID_INDEX;
        }

        int index = symbols.size();
        node.setStorageIndex(index);
        symbols.add(node);
        if (node.isGlobalFunctionScope()) {
            globalSize += node.getSize();
        }

        if (sameName == null) {
            sameName = new ArrayList<>();
            nameIndex.put(node.getName(), sameName);
        }
        sameName.add(node);
        return index;
    }

    /**
     * 取消定义：原槽位替换为空白占位节点，其他符号的下标保持不变。
     * 全局大小不回收，槽位仍占用栈空间。
     */
    public void undefineSymbol(SymbolNode symbol) {
        int index = symbol.getStorageIndex();
        if (index < 0 || index >= symbols.size() || !symbols.get(index).equals(symbol)) {
            throw new IllegalArgumentException("Symbol is not defined in table '" + scopeName + "': " + symbol);
        }

        SymbolNode placeholder = SymbolNode.blank();
        placeholder.setStorageIndex(index);
        symbols.set(index, placeholder);

        List<SymbolNode> cached = nameIndex.get(symbol.getName());
        if (cached != null) {
            for (int n = 0; n < cached.size(); n++) {
                SymbolNode entry = cached.get(n);
                if (entry.getName().equals(symbol.getName())
                        && entry.getClassScope() == symbol.getClassScope()
                        && entry.getFunctionScope() == symbol.getFunctionScope()) {
                    cached.set(n, placeholder);
                    break;
                }
            }
        }
        LOG.log(Level.FINER, "取消定义 {0}（{1}）", new Object[]{symbol.getName(), scopeName});
    }

    /**
     * 编译期删除：移除符号并让其后的符号下标前移。交互式流程不得调用。
     *
     * @return 是否删除
     */
    public boolean remove(SymbolNode node) {
        List<SymbolNode> cached = nameIndex.get(node.getName());
        if (cached != null) {
            cached.remove(node);
        }

        int index = node.getStorageIndex();
        if (index < 0 || index >= symbols.size() || symbols.get(index) != node) {
            return false;
        }
        symbols.remove(index);
        if (node.isGlobalFunctionScope()) {
            globalSize -= node.getSize();
        }
        for (int i = index; i < symbols.size(); i++) {
            symbols.get(i).setStorageIndex(i);
        }
        node.setStorageIndex(Constants.INVALID_INDEX);
        return true;
    }

    // ========== 查找 ==========

    /** 所有同名符号（按声明顺序） */
    public List<SymbolNode> getNodesForName(String name) {
        List<SymbolNode> result = new ArrayList<>();
        for (SymbolNode symbol : symbols) {
            if (symbol.getName().equals(name)) {
                result.add(symbol);
            }
        }
        return result;
    }

    /**
     * 第一个同名符号，忽略作用域。可能命中被遮蔽的符号，新代码不应使用。
     */
    public int indexOf(String name) {
        for (SymbolNode symbol : symbols) {
            if (symbol.getName().equals(name)) {
                return symbol.getStorageIndex();
            }
        }
        return Constants.INVALID_INDEX;
    }

    /** 名称 + 类匹配的第一个符号，忽略函数（成员查找） */
    public int indexOf(String name, int classScope) {
        for (SymbolNode symbol : symbols) {
            if (symbol.getName().equals(name) && symbol.getClassScope() == classScope) {
                return symbol.getStorageIndex();
            }
        }
        return Constants.INVALID_INDEX;
    }

    /** 名称 + 类 + 函数精确匹配，经名称索引查找 */
    public int indexOf(String name, int classScope, int functionScope) {
        List<SymbolNode> cached = nameIndex.get(name);
        if (cached == null) {
            return Constants.INVALID_INDEX;
        }
        for (SymbolNode symbol : cached) {
            if (symbol.getName().equals(name)
                    && symbol.getClassScope() == classScope
                    && symbol.getFunctionScope() == functionScope) {
                return symbol.getStorageIndex();
            }
        }
        return Constants.INVALID_INDEX;
    }

    /**
     * 类成员查找：类级字段（functionScope 为全局）对任意成员函数可见，优先匹配；
     * 否则回退到类 + 函数精确匹配。
     */
    public int indexOfClass(String name, int classScope, int functionScope) {
        for (SymbolNode symbol : symbols) {
            if (symbol.getName().equals(name) && symbol.isGlobalFunctionScope()) {
                return symbol.getStorageIndex();
            }
        }
        for (SymbolNode symbol : symbols) {
            if (symbol.getName().equals(name)
                    && symbol.getClassScope() == classScope
                    && symbol.getFunctionScope() == functionScope) {
                return symbol.getStorageIndex();
            }
        }
        return Constants.INVALID_INDEX;
    }

    @Override
    public String toString() {
        return "SymbolTable[" + scopeName + ", " + symbols.size() + " symbols]";
    }
}

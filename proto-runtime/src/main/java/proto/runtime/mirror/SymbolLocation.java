package proto.runtime.mirror;

import com.protolang.compiler.symbol.SymbolNode;
import com.protolang.compiler.symbol.SymbolTable;

/**
 * 名称解析结果：命中的符号、所在的表和代码块、解析时的类作用域
 */
final class SymbolLocation {

    final SymbolNode symbol;
    final SymbolTable table;
    final int block;
    final int classScope;

    SymbolLocation(SymbolNode symbol, SymbolTable table, int block, int classScope) {
        this.symbol = symbol;
        this.table = table;
        this.block = block;
        this.classScope = classScope;
    }

    @Override
    public String toString() {
        return symbol + " in " + table.getScopeName();
    }
}

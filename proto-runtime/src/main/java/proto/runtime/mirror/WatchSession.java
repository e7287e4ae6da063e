package proto.runtime.mirror;

import com.protolang.compiler.symbol.Constants;
import com.protolang.compiler.symbol.SymbolNode;
import proto.runtime.StackValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一个调试会话的 watch 状态：watch 表达式求值时记录的符号和对应值。
 * 每个会话独立，{@link ExecutionMirror#getWatchValue(WatchSession)} 读取后清空。
 */
public final class WatchSession {

    private final List<SymbolNode> watchSymbolList = new ArrayList<>();
    private final List<StackValue> watchStack = new ArrayList<>();
    private int watchClassScope = Constants.INVALID_INDEX;

    public void record(SymbolNode symbol, StackValue value) {
        watchSymbolList.add(symbol);
        watchStack.add(value);
    }

    public List<SymbolNode> getWatchSymbolList() {
        return Collections.unmodifiableList(watchSymbolList);
    }

    public List<StackValue> getWatchStack() {
        return Collections.unmodifiableList(watchStack);
    }

    /** 最近一次在方法帧内解析名称时的类作用域 */
    public int getWatchClassScope() {
        return watchClassScope;
    }

    void setWatchClassScope(int watchClassScope) {
        this.watchClassScope = watchClassScope;
    }

    public void clear() {
        watchSymbolList.clear();
        watchStack.clear();
    }
}

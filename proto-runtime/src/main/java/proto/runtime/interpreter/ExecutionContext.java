package proto.runtime.interpreter;

import com.protolang.compiler.symbol.SymbolNode;
import proto.runtime.Heap;
import proto.runtime.StackValue;

/**
 * 图节点表达式和过程体可见的执行环境
 */
public interface ExecutionContext {

    StackValue getValue(SymbolNode symbol);

    void setValue(SymbolNode symbol, StackValue value);

    Heap getHeap();

    /** 当前正在执行的代码块 */
    int getRunningBlock();

    /**
     * 调用过程：压入方法分派帧，写入参数后执行过程体
     *
     * @param thisPointer 实例方法的接收者，全局函数传 {@link StackValue#NULL}
     */
    StackValue callProcedure(int procedureId, StackValue thisPointer, StackValue... args);

    /** 在当前帧内执行一个子代码块 */
    void bounce(int blockId);

    /** 断点：把控制权交给调试器的暂停回调 */
    void pause();
}

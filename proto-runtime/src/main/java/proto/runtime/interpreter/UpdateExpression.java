package proto.runtime.interpreter;

import proto.runtime.StackValue;

/**
 * 图节点的更新表达式：读取依赖符号，算出目标符号的新值
 */
@FunctionalInterface
public interface UpdateExpression {

    StackValue evaluate(ExecutionContext context);
}

package proto.runtime.mirror;

import proto.runtime.ProtoException;

/**
 * 变量已声明但从未赋值
 */
public class UninitializedVariableException extends ProtoException {

    private final String name;

    public UninitializedVariableException(String name) {
        super("Variable is not initialized: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}

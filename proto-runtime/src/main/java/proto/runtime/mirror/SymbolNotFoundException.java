package proto.runtime.mirror;

/**
 * 按符号表直接查找（不经过帧解析）失败
 */
public class SymbolNotFoundException extends NameNotFoundException {

    public SymbolNotFoundException(String name) {
        super("Cannot find symbol: " + name, name);
    }
}

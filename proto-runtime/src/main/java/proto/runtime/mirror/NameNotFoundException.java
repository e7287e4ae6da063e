package proto.runtime.mirror;

import proto.runtime.ProtoException;

/**
 * 名称在任何可达作用域中都无法解析
 */
public class NameNotFoundException extends ProtoException {

    private final String name;

    public NameNotFoundException(String name) {
        this("Name not found: " + name, name);
    }

    protected NameNotFoundException(String message, String name) {
        super(message);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}

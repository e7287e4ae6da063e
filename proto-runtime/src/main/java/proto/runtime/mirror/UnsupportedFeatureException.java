package proto.runtime.mirror;

import proto.runtime.ProtoException;

/**
 * 调试镜像不支持的情形：定长数组声明、未知值标签等
 */
public class UnsupportedFeatureException extends ProtoException {

    public UnsupportedFeatureException(String message) {
        super(message);
    }
}

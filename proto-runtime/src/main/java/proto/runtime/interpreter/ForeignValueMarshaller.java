package proto.runtime.interpreter;

import proto.runtime.StackValue;

/**
 * 外部语言导入类的编组器：提供实例的字符串形式
 */
public interface ForeignValueMarshaller {

    String getStringValue(StackValue value);
}

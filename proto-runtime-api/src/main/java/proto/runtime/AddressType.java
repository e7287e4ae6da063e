package proto.runtime;

/**
 * 运行时值标签。
 *
 * <p>每个常量都实现 {@link #dispatch}，把值分派到 {@link StackValueVisitor} 的对应方法。</p>
 */
public enum AddressType {
    INVALID {
        @Override
        <R> R dispatch(StackValueVisitor<R> visitor, StackValue value) {
            return visitor.visitInvalid(value);
        }
    },
    NULL {
        @Override
        <R> R dispatch(StackValueVisitor<R> visitor, StackValue value) {
            return visitor.visitNull(value);
        }
    },
    INT {
        @Override
        <R> R dispatch(StackValueVisitor<R> visitor, StackValue value) {
            return visitor.visitInt(value);
        }
    },
    DOUBLE {
        @Override
        <R> R dispatch(StackValueVisitor<R> visitor, StackValue value) {
            return visitor.visitDouble(value);
        }
    },
    BOOLEAN {
        @Override
        <R> R dispatch(StackValueVisitor<R> visitor, StackValue value) {
            return visitor.visitBoolean(value);
        }
    },
    CHAR {
        @Override
        <R> R dispatch(StackValueVisitor<R> visitor, StackValue value) {
            return visitor.visitChar(value);
        }
    },
    STRING {
        @Override
        <R> R dispatch(StackValueVisitor<R> visitor, StackValue value) {
            return visitor.visitString(value);
        }
    },
    /** 类实例指针，metaType 为类 id */
    POINTER {
        @Override
        <R> R dispatch(StackValueVisitor<R> visitor, StackValue value) {
            return visitor.visitPointer(value);
        }
    },
    ARRAY_POINTER {
        @Override
        <R> R dispatch(StackValueVisitor<R> visitor, StackValue value) {
            return visitor.visitArrayPointer(value);
        }
    },
    FUNCTION_POINTER {
        @Override
        <R> R dispatch(StackValueVisitor<R> visitor, StackValue value) {
            return visitor.visitFunctionPointer(value);
        }
    },
    DEFAULT_ARG {
        @Override
        <R> R dispatch(StackValueVisitor<R> visitor, StackValue value) {
            return visitor.visitDefaultArg(value);
        }
    },
    CALLING_CONVENTION {
        @Override
        <R> R dispatch(StackValueVisitor<R> visitor, StackValue value) {
            return visitor.visitInternal(value);
        }
    },
    BLOCK_INDEX {
        @Override
        <R> R dispatch(StackValueVisitor<R> visitor, StackValue value) {
            return visitor.visitInternal(value);
        }
    },
    CLASS_INDEX {
        @Override
        <R> R dispatch(StackValueVisitor<R> visitor, StackValue value) {
            return visitor.visitInternal(value);
        }
    },
    FRAME_TYPE {
        @Override
        <R> R dispatch(StackValueVisitor<R> visitor, StackValue value) {
            return visitor.visitInternal(value);
        }
    };

    abstract <R> R dispatch(StackValueVisitor<R> visitor, StackValue value);
}

package proto.runtime.mirror;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 数组的镜像快照：按下标排列的子 {@link Obj}
 */
public final class DsasmArray {

    private final Obj[] members;

    DsasmArray(Obj[] members) {
        this.members = members;
    }

    public int size() {
        return members.length;
    }

    public Obj get(int index) {
        return members[index];
    }

    public List<Obj> getMembers() {
        return Collections.unmodifiableList(Arrays.asList(members));
    }

    @Override
    public String toString() {
        return Arrays.toString(members);
    }
}

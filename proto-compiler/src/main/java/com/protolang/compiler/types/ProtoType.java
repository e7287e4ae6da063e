package com.protolang.compiler.types;

/**
 * 结构化类型：类型 uid + 名称 + 数组维度。
 *
 * <p>rank 为 0 表示标量，{@link #ARBITRARY_RANK} 表示任意维数组。</p>
 */
public final class ProtoType {

    public static final int ARBITRARY_RANK = -1;

    private final int uid;
    private final String name;
    private final int rank;

    public ProtoType(int uid, String name, int rank) {
        this.uid = uid;
        this.name = name;
        this.rank = rank;
    }

    public int getUid() { return uid; }
    public String getName() { return name; }
    public int getRank() { return rank; }

    /** 是否可下标访问（数组类型） */
    public boolean isIndexable() {
        return rank != 0;
    }

    public boolean isArbitraryRank() {
        return rank == ARBITRARY_RANK;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProtoType)) return false;
        ProtoType other = (ProtoType) o;
        return uid == other.uid && rank == other.rank;
    }

    @Override
    public int hashCode() {
        return 31 * uid + rank;
    }

    @Override
    public String toString() {
        if (rank == 0) return name;
        if (rank == ARBITRARY_RANK) return name + "[]..[]";
        StringBuilder sb = new StringBuilder(name);
        for (int i = 0; i < rank; i++) {
            sb.append("[]");
        }
        return sb.toString();
    }
}

package io.avery.mastertree.manager;

import io.avery.mastertree.MasterManager;

/**
 * Range add, range minimum over {@code long} elements. The product of an empty range is {@code Long.MAX_VALUE}.
 */
public final class AddMinManager implements MasterManager<Long, AddMinManager.Info, Long, Long> {
    public static final AddMinManager INSTANCE = new AddMinManager();

    public static final class Info {
        final long min;
        final long pending;

        Info(long min, long pending) {
            this.min = min;
            this.pending = pending;
        }

        public long min() {
            return min;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Info i && min == i.min && pending == i.pending;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(min) * 31 + Long.hashCode(pending);
        }

        @Override
        public String toString() {
            return "Info[min=" + min + ", pending=" + pending + "]";
        }
    }

    @Override
    public Info makeInfo(Info left, int leftLength, Long value, Info right, int rightLength) {
        long min = value;
        if (left != null) {
            min = Math.min(min, left.min);
        }
        if (right != null) {
            min = Math.min(min, right.min);
        }
        return new Info(min, 0);
    }

    @Override
    public Info reverse(Info info, int length) {
        return info;
    }

    @Override
    public Info applyInfo(Info info, int length, Long lazy) {
        return new Info(info.min + lazy, info.pending + lazy);
    }

    @Override
    public Long applyValue(Long value, Long lazy) {
        return value + lazy;
    }

    @Override
    public void propagate(Propagation<Long, Info> node) {
        Info info = node.info();
        long pending = info.pending;
        if (pending == 0) {
            return;
        }
        node.setValue(node.value() + pending);
        Info left = node.leftInfo();
        if (left != null) {
            node.setLeftInfo(applyInfo(left, node.leftLength(), pending));
        }
        Info right = node.rightInfo();
        if (right != null) {
            node.setRightInfo(applyInfo(right, node.rightLength(), pending));
        }
        node.setInfo(new Info(info.min, 0));
    }

    @Override
    public Long infoToProd(Info info) {
        return info.min;
    }

    @Override
    public Long valueToProd(Long value) {
        return value;
    }

    @Override
    public Long identity() {
        return Long.MAX_VALUE;
    }

    @Override
    public Long op(Long left, Long right) {
        return Math.min(left, right);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AddMinManager;
    }

    @Override
    public int hashCode() {
        return AddMinManager.class.hashCode();
    }
}

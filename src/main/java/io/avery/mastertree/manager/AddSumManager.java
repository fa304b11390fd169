package io.avery.mastertree.manager;

import io.avery.mastertree.MasterManager;

/**
 * Range add, range sum over {@code long} elements. Arithmetic wraps on overflow.
 */
public final class AddSumManager implements MasterManager<Long, AddSumManager.Info, Long, Long> {
    public static final AddSumManager INSTANCE = new AddSumManager();

    public static final class Info {
        final long sum;
        final long pending;

        Info(long sum, long pending) {
            this.sum = sum;
            this.pending = pending;
        }

        public long sum() {
            return sum;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Info i && sum == i.sum && pending == i.pending;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(sum) * 31 + Long.hashCode(pending);
        }

        @Override
        public String toString() {
            return "Info[sum=" + sum + ", pending=" + pending + "]";
        }
    }

    @Override
    public Info makeInfo(Info left, int leftLength, Long value, Info right, int rightLength) {
        long sum = value;
        if (left != null) {
            sum += left.sum;
        }
        if (right != null) {
            sum += right.sum;
        }
        return new Info(sum, 0);
    }

    @Override
    public Info reverse(Info info, int length) {
        return info;
    }

    @Override
    public Info applyInfo(Info info, int length, Long lazy) {
        return new Info(info.sum + lazy * length, info.pending + lazy);
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
        node.setInfo(new Info(info.sum, 0));
    }

    @Override
    public Long infoToProd(Info info) {
        return info.sum;
    }

    @Override
    public Long valueToProd(Long value) {
        return value;
    }

    @Override
    public Long identity() {
        return 0L;
    }

    @Override
    public Long op(Long left, Long right) {
        return left + right;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AddSumManager;
    }

    @Override
    public int hashCode() {
        return AddSumManager.class.hashCode();
    }
}

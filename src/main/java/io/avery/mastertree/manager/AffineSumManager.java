package io.avery.mastertree.manager;

import io.avery.mastertree.MasterManager;

import java.util.Objects;

/**
 * Range affine update ({@code x -> a*x + b}), range sum, over integers modulo a fixed modulus. Elements and lazy
 * coefficients may be given unreduced; results are always in {@code [0, modulus)}.
 */
public final class AffineSumManager implements MasterManager<Long, AffineSumManager.Info, Long, AffineSumManager.Affine> {
    private final long modulus;

    /**
     * @param modulus the modulus, in {@code [1, 2^31]}, so that products of two residues fit in a {@code long}
     */
    public AffineSumManager(long modulus) {
        if (modulus < 1 || modulus > 1L << 31) {
            throw new IllegalArgumentException("Modulus out of range: " + modulus);
        }
        this.modulus = modulus;
    }

    public long modulus() {
        return modulus;
    }

    /**
     * The map {@code x -> a*x + b}.
     */
    public static final class Affine {
        final long a;
        final long b;

        public Affine(long a, long b) {
            this.a = a;
            this.b = b;
        }

        public static Affine add(long b) {
            return new Affine(1, b);
        }

        public static Affine multiply(long a) {
            return new Affine(a, 0);
        }

        public static Affine assign(long b) {
            return new Affine(0, b);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Affine f && a == f.a && b == f.b;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(a) * 31 + Long.hashCode(b);
        }

        @Override
        public String toString() {
            return "x -> " + a + "x + " + b;
        }
    }

    // The pending map is kept reduced; a == 1 && b == 0 means nothing is pending
    public static final class Info {
        final long sum;
        final long a;
        final long b;

        Info(long sum, long a, long b) {
            this.sum = sum;
            this.a = a;
            this.b = b;
        }

        public long sum() {
            return sum;
        }

        boolean hasPending() {
            return a != 1 || b != 0;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Info i && sum == i.sum && a == i.a && b == i.b;
        }

        @Override
        public int hashCode() {
            return Objects.hash(sum, a, b);
        }

        @Override
        public String toString() {
            return "Info[sum=" + sum + ", pending=x -> " + a + "x + " + b + "]";
        }
    }

    private long reduce(long x) {
        return Math.floorMod(x, modulus);
    }

    @Override
    public Info makeInfo(Info left, int leftLength, Long value, Info right, int rightLength) {
        long sum = reduce(value);
        if (left != null) {
            sum = (sum + left.sum) % modulus;
        }
        if (right != null) {
            sum = (sum + right.sum) % modulus;
        }
        return new Info(sum, 1, 0);
    }

    @Override
    public Info reverse(Info info, int length) {
        return info;
    }

    @Override
    public Info applyInfo(Info info, int length, Affine lazy) {
        return applyInfo(info, length, reduce(lazy.a), reduce(lazy.b));
    }

    // a and b are reduced
    private Info applyInfo(Info info, int length, long a, long b) {
        long sum = (a * info.sum % modulus + b * (length % modulus) % modulus) % modulus;
        // (a, b) after (info.a, info.b)
        long pa = a * info.a % modulus;
        long pb = (a * info.b % modulus + b) % modulus;
        return new Info(sum, pa, pb);
    }

    @Override
    public Long applyValue(Long value, Affine lazy) {
        return (reduce(lazy.a) * reduce(value) % modulus + reduce(lazy.b)) % modulus;
    }

    @Override
    public void propagate(Propagation<Long, Info> node) {
        Info info = node.info();
        if (!info.hasPending()) {
            return;
        }
        long a = info.a, b = info.b;
        node.setValue((a * reduce(node.value()) % modulus + b) % modulus);
        Info left = node.leftInfo();
        if (left != null) {
            node.setLeftInfo(applyInfo(left, node.leftLength(), a, b));
        }
        Info right = node.rightInfo();
        if (right != null) {
            node.setRightInfo(applyInfo(right, node.rightLength(), a, b));
        }
        node.setInfo(new Info(info.sum, 1, 0));
    }

    @Override
    public Long infoToProd(Info info) {
        return info.sum;
    }

    @Override
    public Long valueToProd(Long value) {
        return reduce(value);
    }

    @Override
    public Long identity() {
        return 0L;
    }

    @Override
    public Long op(Long left, Long right) {
        return (left + right) % modulus;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AffineSumManager m && modulus == m.modulus;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(modulus);
    }
}

package io.avery.mastertree;

// A 64-bit xorshift generator, used only to pick balance points. Not suitable for anything else.
final class XorShift {
    static final long DEFAULT_SEED = 0xf285692d6bf31f57L;

    private long state;

    XorShift() {
        this(DEFAULT_SEED);
    }

    XorShift(long seed) {
        // The all-zero state is a fixed point of the xorshift step
        state = seed == 0 ? DEFAULT_SEED : seed;
    }

    long next() {
        long s = state;
        s ^= s << 7;
        s ^= s >>> 9;
        return state = s;
    }

    /**
     * Returns {@code true} with probability approximately {@code a / (a + b)}.
     */
    boolean choose(int a, int b) {
        assert a >= 0 && b >= 0 && a + (long) b > 0;
        long total = (long) a + b;
        long x = next();
        // High word of the unsigned 128-bit product x * total (total is non-negative)
        long hi = Math.multiplyHigh(x, total) + ((x >> 63) & total);
        return hi < a;
    }

    /**
     * Advances this generator, then returns a generator whose stream is decorrelated from this one's.
     */
    XorShift fork() {
        next();
        long s = state;
        s ^= s >>> 7;
        s ^= s << 9;
        return new XorShift(s);
    }

    XorShift copy() {
        return new XorShift(state);
    }
}

package st.foglo.spindle_sync.grid;

/**
 * Half-open index range [from, to).
 */
public final class IndexRange {

    public final int from;
    public final int to;

    public IndexRange(int from, int to) {
        this.from = from;
        this.to = to;
    }

    public int length() {
        return to - from;
    }

    public boolean contains(int k) {
        return k >= from && k < to;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof IndexRange)) {
            return false;
        }
        final IndexRange other = (IndexRange) o;
        return from == other.from && to == other.to;
    }

    @Override
    public int hashCode() {
        return 31*from + to;
    }

    @Override
    public String toString() {
        return String.format("[%d, %d)", from, to);
    }
}

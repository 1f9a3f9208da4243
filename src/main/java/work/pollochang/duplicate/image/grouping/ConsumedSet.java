package work.pollochang.duplicate.image.grouping;

import java.util.BitSet;

/**
 * 以輸入位置記錄已加入群組的圖片。
 */
public class ConsumedSet {

    private final BitSet bits;

    public ConsumedSet(int size) {
        this.bits = new BitSet(size);
    }

    public synchronized void consume(int index) {
        bits.set(index);
    }

    public synchronized boolean isConsumed(int index) {
        return bits.get(index);
    }

    public synchronized int count() {
        return bits.cardinality();
    }
}

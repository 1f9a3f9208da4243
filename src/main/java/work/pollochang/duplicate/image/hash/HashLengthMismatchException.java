package work.pollochang.duplicate.image.hash;

/**
 * 兩個感知雜湊長度不同，屬於程式錯誤 (不同 hashSize 的雜湊被拿來比較)。
 */
public class HashLengthMismatchException extends RuntimeException {

    public HashLengthMismatchException(int leftBits, int rightBits) {
        super("雜湊長度不匹配: " + leftBits + " vs " + rightBits);
    }
}

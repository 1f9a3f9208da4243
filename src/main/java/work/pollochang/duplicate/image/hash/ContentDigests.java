package work.pollochang.duplicate.image.hash;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

final class ContentDigests {

    private ContentDigests() {}

    static String md5Hex(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return toHex(digest.digest(data));
        } catch (NoSuchAlgorithmException e) {
            // 每個 JRE 都必須提供 MD5
            throw new IllegalStateException("JRE 未提供 MD5", e);
        }
    }

    private static String toHex(byte[] data) {
        StringBuilder sb = new StringBuilder(data.length * 2);
        for (byte b : data) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}

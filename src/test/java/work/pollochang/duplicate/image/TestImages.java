package work.pollochang.duplicate.image;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Random;

/**
 * 測試用影像。
 */
public final class TestImages {

    private TestImages() {}

    /**
     * 96x64 的隨機色塊圖，每個色塊 12x8，剛好對齊 8x8 的雜湊格線。不同種子的圖片互不相似。
     */
    public static BufferedImage blocks(long seed) {
        return blocks(seed, 96, 64, 12, 8);
    }

    public static BufferedImage blocks(long seed, int width, int height, int blockWidth, int blockHeight) {
        Random random = new Random(seed);
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int by = 0; by < height; by += blockHeight) {
            for (int bx = 0; bx < width; bx += blockWidth) {
                int rgb = random.nextInt(0x1000000);
                for (int y = by; y < Math.min(height, by + blockHeight); y++) {
                    for (int x = bx; x < Math.min(width, bx + blockWidth); x++) {
                        image.setRGB(x, y, rgb);
                    }
                }
            }
        }
        return image;
    }

    public static BufferedImage solid(int width, int height, Color color) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setPaint(color);
            g.fillRect(0, 0, width, height);
        } finally {
            g.dispose();
        }
        return image;
    }

    public static Path write(BufferedImage image, Path file) throws IOException {
        String name = file.getFileName().toString();
        String format = name.substring(name.lastIndexOf('.') + 1);
        if (!ImageIO.write(image, format, file.toFile())) {
            throw new IOException("沒有可用的寫入器: " + format);
        }
        return file;
    }
}

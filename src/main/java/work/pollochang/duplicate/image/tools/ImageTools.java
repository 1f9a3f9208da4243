package work.pollochang.duplicate.image.tools;

import java.awt.*;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;

/**
 * 圖片幾何與灰階處理工具。
 * <p>
 * 雜湊計算使用面積平均 (box filter) 縮放，大幅縮小時不會像雙線性插值那樣只取到少數像素，
 * 同一張圖不同解析度的版本可以得到接近的縮圖。透明像素一律疊在白色背景上。
 */
public class ImageTools {

    private ImageTools() {}

    /**
     * 依比例縮放圖片 (放大使用雙線性插值，縮小使用面積平均)。
     */
    public static BufferedImage resizeImage(BufferedImage originalImage, double scale) {
        int newWidth = Math.max(1, (int) (originalImage.getWidth() * scale));
        int newHeight = Math.max(1, (int) (originalImage.getHeight() * scale));
        if (scale < 1.0) {
            return areaResize(originalImage, newWidth, newHeight);
        }

        // 保留 Alpha 通道
        int imageType = originalImage.getType();
        if (imageType == 0 || imageType == BufferedImage.TYPE_CUSTOM) {
            imageType = originalImage.getAlphaRaster() != null ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        }

        BufferedImage resizedImage = new BufferedImage(newWidth, newHeight, imageType);
        Graphics2D g2d = resizedImage.createGraphics();
        g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g2d.drawImage(originalImage, 0, 0, newWidth, newHeight, null);
        g2d.dispose();
        return resizedImage;
    }

    /**
     * 等比例縮小到最長邊不超過 {@code maxSide}；原本就夠小時直接回傳原圖。
     */
    public static BufferedImage fitWithin(BufferedImage image, int maxSide) {
        int longSide = Math.max(image.getWidth(), image.getHeight());
        if (longSide <= maxSide) {
            return image;
        }
        double scale = (double) maxSide / longSide;
        int w = Math.max(1, (int) Math.round(image.getWidth() * scale));
        int h = Math.max(1, (int) Math.round(image.getHeight() * scale));
        return areaResize(image, w, h);
    }

    /**
     * 以面積平均縮放為指定尺寸的 RGB 圖片。
     */
    public static BufferedImage areaResize(BufferedImage image, int width, int height) {
        double[][] channels = accumulate(image, width, height, false);
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int i = y * width + x;
                int r = clamp(channels[0][i]);
                int g = clamp(channels[1][i]);
                int b = clamp(channels[2][i]);
                row[x] = (r << 16) | (g << 8) | b;
            }
            out.setRGB(0, y, width, 1, row, 0, width);
        }
        return out;
    }

    /**
     * 以面積平均縮放並轉為灰階 (ITU-R 601 亮度)，回傳 [列][欄] 矩陣，數值範圍 0-255。
     */
    public static double[][] grayscaleMatrix(BufferedImage image, int width, int height) {
        double[] gray = accumulate(image, width, height, true)[0];
        double[][] matrix = new double[height][width];
        for (int y = 0; y < height; y++) {
            System.arraycopy(gray, y * width, matrix[y], 0, width);
        }
        return matrix;
    }

    /**
     * 逆時針旋轉圖片並擴展畫布，空白處填白色。90 度的倍數以像素搬移完成，不會有插值誤差。
     */
    public static BufferedImage rotate(BufferedImage image, int angle) {
        int normalized = Math.floorMod(angle, 360);
        if (normalized == 0) {
            return image;
        }
        int w = image.getWidth();
        int h = image.getHeight();
        if (normalized % 90 == 0) {
            boolean swap = normalized != 180;
            BufferedImage out = new BufferedImage(swap ? h : w, swap ? w : h, BufferedImage.TYPE_INT_RGB);
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    int rgb = onWhite(image.getRGB(x, y));
                    switch (normalized) {
                        case 90 -> out.setRGB(y, w - 1 - x, rgb);
                        case 180 -> out.setRGB(w - 1 - x, h - 1 - y, rgb);
                        default -> out.setRGB(h - 1 - y, x, rgb);
                    }
                }
            }
            return out;
        }

        double radians = Math.toRadians(normalized);
        double sin = Math.abs(Math.sin(radians));
        double cos = Math.abs(Math.cos(radians));
        int newWidth = (int) Math.ceil(w * cos + h * sin);
        int newHeight = (int) Math.ceil(h * cos + w * sin);
        BufferedImage out = new BufferedImage(newWidth, newHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = out.createGraphics();
        try {
            g2d.setPaint(Color.WHITE);
            g2d.fillRect(0, 0, newWidth, newHeight);
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            AffineTransform transform = new AffineTransform();
            transform.translate(newWidth / 2.0, newHeight / 2.0);
            // 螢幕座標 y 軸向下，負角度才是逆時針
            transform.rotate(-radians);
            transform.translate(-w / 2.0, -h / 2.0);
            g2d.drawImage(image, transform, null);
        } finally {
            g2d.dispose();
        }
        return out;
    }

    /**
     * 面積平均累加。每個來源像素依其覆蓋目標格子的面積比例分配權重。
     * @param luminance true 時只輸出一個亮度通道，否則輸出 R、G、B 三個通道
     */
    private static double[][] accumulate(BufferedImage image, int width, int height, boolean luminance) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("目標尺寸必須為正數: " + width + "x" + height);
        }
        int sw = image.getWidth();
        int sh = image.getHeight();
        int channelCount = luminance ? 1 : 3;
        double[][] sums = new double[channelCount][width * height];
        double[] weights = new double[width * height];

        double fx = (double) width / sw;
        double fy = (double) height / sh;
        int[][] spanX = new int[sw][];
        double[][] weightX = new double[sw][];
        for (int x = 0; x < sw; x++) {
            spanX[x] = span(x, fx, width);
            weightX[x] = overlap(x, fx, spanX[x]);
        }

        int[] row = new int[sw];
        for (int y = 0; y < sh; y++) {
            image.getRGB(0, y, sw, 1, row, 0, sw);
            int[] ty = span(y, fy, height);
            double[] wy = overlap(y, fy, ty);
            for (int x = 0; x < sw; x++) {
                int rgb = onWhite(row[x]);
                int r = (rgb >> 16) & 0xff;
                int g = (rgb >> 8) & 0xff;
                int b = rgb & 0xff;
                double lum = 0.299 * r + 0.587 * g + 0.114 * b;
                for (int iy = 0; iy < ty.length; iy++) {
                    for (int ix = 0; ix < spanX[x].length; ix++) {
                        double weight = wy[iy] * weightX[x][ix];
                        if (weight <= 0) {
                            continue;
                        }
                        int i = ty[iy] * width + spanX[x][ix];
                        if (luminance) {
                            sums[0][i] += lum * weight;
                        } else {
                            sums[0][i] += r * weight;
                            sums[1][i] += g * weight;
                            sums[2][i] += b * weight;
                        }
                        weights[i] += weight;
                    }
                }
            }
        }

        for (int c = 0; c < channelCount; c++) {
            for (int i = 0; i < weights.length; i++) {
                sums[c][i] = weights[i] > 0 ? sums[c][i] / weights[i] : 0;
            }
        }
        return sums;
    }

    private static int[] span(int source, double factor, int limit) {
        int first = (int) Math.floor(source * factor);
        int last = (int) Math.ceil((source + 1) * factor) - 1;
        first = Math.min(Math.max(first, 0), limit - 1);
        last = Math.min(Math.max(last, first), limit - 1);
        int[] targets = new int[last - first + 1];
        for (int i = 0; i < targets.length; i++) {
            targets[i] = first + i;
        }
        return targets;
    }

    private static double[] overlap(int source, double factor, int[] targets) {
        double start = source * factor;
        double end = (source + 1) * factor;
        double[] result = new double[targets.length];
        for (int i = 0; i < targets.length; i++) {
            result[i] = Math.min(targets[i] + 1, end) - Math.max(targets[i], start);
        }
        return result;
    }

    /**
     * 將 ARGB 像素疊在白色背景上，回傳不透明的 RGB。
     */
    static int onWhite(int argb) {
        int a = (argb >>> 24) & 0xff;
        if (a == 0xff) {
            return argb & 0xffffff;
        }
        int r = blend((argb >> 16) & 0xff, a);
        int g = blend((argb >> 8) & 0xff, a);
        int b = blend(argb & 0xff, a);
        return (r << 16) | (g << 8) | b;
    }

    private static int blend(int channel, int alpha) {
        return (channel * alpha + 255 * (255 - alpha) + 127) / 255;
    }

    private static int clamp(double value) {
        return (int) Math.max(0, Math.min(255, Math.round(value)));
    }
}

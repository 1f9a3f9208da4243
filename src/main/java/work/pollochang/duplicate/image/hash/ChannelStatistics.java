package work.pollochang.duplicate.image.hash;

/**
 * R、G、B 三個通道的標準差 (母體標準差)。
 */
record ChannelStatistics(double redStd, double greenStd, double blueStd) {

    static ChannelStatistics of(int[] rgbSamples) {
        int n = rgbSamples.length;
        if (n == 0) {
            return new ChannelStatistics(0, 0, 0);
        }
        double[] sum = new double[3];
        double[] sumSq = new double[3];
        for (int rgb : rgbSamples) {
            int[] c = {(rgb >> 16) & 0xff, (rgb >> 8) & 0xff, rgb & 0xff};
            for (int k = 0; k < 3; k++) {
                sum[k] += c[k];
                sumSq[k] += (double) c[k] * c[k];
            }
        }
        double[] std = new double[3];
        for (int k = 0; k < 3; k++) {
            double mean = sum[k] / n;
            std[k] = Math.sqrt(Math.max(0, sumSq[k] / n - mean * mean));
        }
        return new ChannelStatistics(std[0], std[1], std[2]);
    }

    boolean allBelow(double threshold) {
        return redStd < threshold && greenStd < threshold && blueStd < threshold;
    }
}

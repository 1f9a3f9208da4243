package work.pollochang.duplicate.image.feature;

import org.junit.jupiter.api.Test;
import work.pollochang.duplicate.image.TestImages;

import java.awt.Color;

import static org.junit.jupiter.api.Assertions.*;

class FeatureVectorTest {

    @Test
    void similarity_ofIdenticalVectorsIsOne() {
        FeatureVector v = new FeatureVector(1.5, 120, 40, 6.2, 30);

        assertEquals(1.0, v.similarity(v), 1e-9);
    }

    @Test
    void similarity_isSymmetricAndBounded() {
        FeatureVector a = new FeatureVector(1.5, 10, 0, 0, 0);
        FeatureVector b = new FeatureVector(0.5, 250, 127, 8, 255);

        double ab = a.similarity(b);
        assertEquals(ab, b.similarity(a), 1e-12);
        assertTrue(ab >= 0.0 && ab <= 1.0);
        assertTrue(ab < 0.2, "ab=" + ab);
    }

    @Test
    void similarity_weightsBrightnessMoreThanEntropy() {
        FeatureVector base = new FeatureVector(1.0, 100, 40, 4, 20);
        FeatureVector brighter = new FeatureVector(1.0, 100 + 255 * 0.5, 40, 4, 20);
        FeatureVector moreEntropy = new FeatureVector(1.0, 100, 40, 4 + 8 * 0.5, 20);

        assertTrue(base.similarity(brighter) < base.similarity(moreEntropy));
    }

    @Test
    void extract_uniformImageHasNoContrastEntropyOrEdges() {
        FeatureVector v = FeatureExtractor.extract(TestImages.solid(200, 100, new Color(80, 80, 80)));

        assertEquals(2.0, v.aspectRatio(), 1e-9);
        assertEquals(80, v.brightness(), 0.5);
        assertEquals(0, v.contrast(), 1e-6);
        assertEquals(0, v.entropy(), 1e-9);
        assertEquals(0, v.edgeDensity(), 1e-6);
    }

    @Test
    void extract_isCloseAcrossResolutions() {
        FeatureVector small = FeatureExtractor.extract(TestImages.blocks(5));
        FeatureVector large = FeatureExtractor.extract(TestImages.blocks(5, 768, 512, 96, 64));

        assertEquals(small.aspectRatio(), large.aspectRatio(), 1e-9);
        assertTrue(small.similarity(large) > 0.9, "similarity " + small.similarity(large));
    }
}

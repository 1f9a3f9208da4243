package work.pollochang.duplicate.image.stage;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.duplicate.image.TestImages;
import work.pollochang.duplicate.image.core.ImageIoDecoder;
import work.pollochang.duplicate.image.core.RunControl;
import work.pollochang.duplicate.image.hash.JavaHashProvider;
import work.pollochang.duplicate.image.model.ReasonTag;

import java.awt.Color;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class PureColorStageTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private PureColorStage stage() {
        return new PureColorStage(new JavaHashProvider(), new ImageIoDecoder(), executor, 3.0);
    }

    @Test
    void allPureColorImagesFormOneGroup(@TempDir Path dir) throws IOException {
        String white = TestImages.write(TestImages.solid(30, 30, Color.WHITE), dir.resolve("white.png")).toString();
        String photo = TestImages.write(TestImages.blocks(1), dir.resolve("photo.png")).toString();
        String red = TestImages.write(TestImages.solid(60, 20, Color.RED), dir.resolve("red.png")).toString();

        StageResult result = stage().run(List.of(white, photo, red), RunControl.detached());

        assertEquals(1, result.groups().size());
        assertEquals(List.of(white, red), result.groups().get(0).paths());
        assertTrue(result.groups().get(0).reasonTags().contains(ReasonTag.PURE_COLOR));
        assertEquals(List.of(photo), result.survivors());
        assertEquals(2, result.pureColorImages());
    }

    @Test
    void singlePureColorImageIsRemovedWithoutGroup(@TempDir Path dir) throws IOException {
        String white = TestImages.write(TestImages.solid(30, 30, Color.WHITE), dir.resolve("white.png")).toString();
        String photo = TestImages.write(TestImages.blocks(1), dir.resolve("photo.png")).toString();

        StageResult result = stage().run(List.of(white, photo), RunControl.detached());

        assertTrue(result.groups().isEmpty());
        assertEquals(List.of(photo), result.survivors());
        assertEquals(1, result.pureColorImages());
    }
}

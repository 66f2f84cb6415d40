package com.jdc.foodgram.storage;

import com.jdc.foodgram.config.MediaProperties;
import com.jdc.foodgram.util.Base64ImageDecoder.DecodedImage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class LocalImageStorageTest {

    @TempDir
    Path tempDir;

    private LocalImageStorage storage;

    @BeforeEach
    void setUp() throws Exception {
        MediaProperties props = new MediaProperties();
        props.setRoot(tempDir.toString());
        props.setUrlPrefix("/media");
        storage = new LocalImageStorage(props);
    }

    @Test
    @DisplayName("save: 디렉터리 아래 uuid 파일로 저장하고 공개 URL을 돌려준다")
    void save_writesFileAndReturnsUrl() throws Exception {
        String url = storage.save(LocalImageStorage.RECIPE_IMAGES, new DecodedImage(new byte[]{1, 2, 3}, "png"));

        assertThat(url).startsWith("/media/recipes/images/").endsWith(".png");
        Optional<Path> path = storage.pathFromUrl(url);
        assertThat(path).isPresent();
        assertThat(Files.readAllBytes(path.get())).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("deleteByUrl: 저장한 파일을 지운다")
    void deleteByUrl_removesFile() throws Exception {
        String url = storage.save(LocalImageStorage.AVATARS, new DecodedImage(new byte[]{7}, "jpeg"));
        Path path = storage.pathFromUrl(url).orElseThrow();

        storage.deleteByUrl(url);

        assertThat(Files.exists(path)).isFalse();
    }

    @Test
    @DisplayName("pathFromUrl: 접두어가 다르거나 root를 벗어나면 비어 있다")
    void pathFromUrl_rejectsForeignAndTraversal() {
        assertThat(storage.pathFromUrl("https://cdn.example.com/a.png")).isEmpty();
        assertThat(storage.pathFromUrl("/media/../../etc/passwd")).isEmpty();
        assertThat(storage.pathFromUrl(null)).isEmpty();
    }

    @Test
    @DisplayName("deleteByUrlQuietly: 없는 파일이어도 예외 없이 넘어간다")
    void deleteQuietly_missing() {
        assertThatCode(() -> storage.deleteByUrlQuietly("/media/recipes/images/none.png")).doesNotThrowAnyException();
    }
}

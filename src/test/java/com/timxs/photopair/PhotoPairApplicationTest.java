package com.timxs.photopair;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.*;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static com.timxs.photopair.TestImages.solidPng;
import static org.assertj.core.api.Assertions.assertThat;

class PhotoPairApplicationTest {

    @TempDir
    Path tempDir;

    @Test
    void wrongArgumentCountIsAUsageError() {
        assertThat(PhotoPairApplication.run(new String[0])).isEqualTo(PhotoPairApplication.EXIT_USAGE);
        assertThat(PhotoPairApplication.run(new String[]{"only-one"})).isEqualTo(PhotoPairApplication.EXIT_USAGE);
    }

    @Test
    void composesTwoDirectoriesEndToEnd() throws IOException {
        Path left = Files.createDirectories(tempDir.resolve("before"));
        Path right = Files.createDirectories(tempDir.resolve("after"));
        Path out = tempDir.resolve("out");
        Files.write(left.resolve("Smith_John_01.png"), solidPng(40, 30, Color.RED));
        Files.write(left.resolve("Doe_Jane_01.png"), solidPng(30, 40, Color.GREEN));
        Files.write(right.resolve("b.png"), solidPng(40, 40, Color.BLUE));
        Files.write(right.resolve("a.png"), solidPng(40, 40, Color.YELLOW));

        int exitCode = PhotoPairApplication.run(new String[]{left.toString(), right.toString(), out.toString()});

        assertThat(exitCode).isEqualTo(PhotoPairApplication.EXIT_OK);
        Path archive = out.resolve("processed_images.zip");
        assertThat(archive).exists();
        assertThat(entryNames(archive)).containsExactly("Jane Doe_combined.jpg", "John Smith_combined.jpg");
    }

    @Test
    void corruptPhotoFailsTheRun() throws IOException {
        Path left = Files.createDirectories(tempDir.resolve("before"));
        Path right = Files.createDirectories(tempDir.resolve("after"));
        Files.writeString(left.resolve("Smith_John_01.jpg"), "not an image");
        Files.write(right.resolve("a.png"), solidPng(10, 10, Color.BLUE));

        int exitCode = PhotoPairApplication.run(
            new String[]{left.toString(), right.toString(), tempDir.resolve("out").toString()});

        assertThat(exitCode).isEqualTo(PhotoPairApplication.EXIT_FAILURE);
        assertThat(tempDir.resolve("out").resolve("processed_images.zip")).doesNotExist();
    }

    private static List<String> entryNames(Path archive) throws IOException {
        List<String> names = new ArrayList<>();
        try (InputStream in = Files.newInputStream(archive); ZipInputStream zip = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                names.add(entry.getName());
            }
        }
        return names;
    }
}

package com.afipvision.core.importer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentScannerTest {

    @TempDir
    Path root;

    private Path touch(String rel) throws Exception {
        Path p = root.resolve(rel);
        Files.createDirectories(p.getParent());
        Files.write(p, new byte[]{1});
        return p;
    }

    @Test
    void findsImagesAtAnyDepthSorted() throws Exception {
        Path b = touch("b.PNG");
        Path a = touch("2024/10/a.jpg");
        Path c = touch("scan.tiff");
        touch("notes.txt");
        touch("2024/factura.pdf");

        List<Path> found = new DocumentScanner(null).scan(root);
        assertEquals(List.of(a, b, c).stream().sorted().toList(), found);
    }

    @Test
    void customPatterns() throws Exception {
        Path keep = touch("in/doc1.png");
        touch("out/doc2.png");
        List<Path> found = new DocumentScanner(List.of("in/*.png")).scan(root);
        assertEquals(List.of(keep), found);
    }

    @Test
    void rootMustBeDirectory() throws Exception {
        Path f = touch("x.png");
        assertThrows(IllegalArgumentException.class, () -> new DocumentScanner(null).scan(f));
        assertThrows(IllegalArgumentException.class, () -> new DocumentScanner(null).scan(root.resolve("nope")));
    }
}
